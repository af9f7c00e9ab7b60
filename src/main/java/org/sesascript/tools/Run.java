/*
 * Copyright 2025 The Sesascript Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.sesascript.tools;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.sesascript.compiler.CompileError;
import org.sesascript.compiler.Compiler;
import org.sesascript.compiler.ParseContext;

/**
 * A simple command-line tool for compiling a single Sesascript file and printing the resulting C
 * program.
 *
 * <p>The module name can be set with {@code -DmoduleName=...}; it defaults to "main".
 */
public class Run {
  private Run() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: run <fileName>");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    checkUsage(args.length == 1);
    String moduleName = System.getProperty("moduleName", ParseContext.MAIN_MODULE);
    Path file = Path.of(args[0]);
    String source = Files.readString(file, StandardCharsets.UTF_8);
    try {
      System.out.print(Compiler.compileOrThrow(source, moduleName));
    } catch (CompileError e) {
      System.err.printf("%s: %s\n", file.getFileName(), e.getMessage());
      System.exit(1);
    }
  }
}
