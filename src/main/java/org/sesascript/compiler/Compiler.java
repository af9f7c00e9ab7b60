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

package org.sesascript.compiler;

import org.apache.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.sesascript.ast.Root;
import org.sesascript.util.Logging;
import org.sesascript.util.SpeculativeCursor;

/** Parses Sesascript source code and emits the equivalent C program. */
public final class Compiler {

  private static final Logger logger = Logging.getLogger();

  // Static methods only
  private Compiler() {}

  /** Parses a main module; see {@link #parse(String, String)}. */
  public static @Nullable Root parse(String source) {
    return parse(source, ParseContext.MAIN_MODULE);
  }

  /**
   * Parses a Sesascript module.
   *
   * @param source the program text
   * @param moduleName the name of the module; only the main module ({@link
   *     ParseContext#MAIN_MODULE}) can refer to the built-in functions
   * @return the syntax tree, or null if {@code source} is not a valid module
   * @throws CompileError if the program can't be compiled for some reason other than a syntax
   *     error
   */
  public static @Nullable Root parse(String source, String moduleName) {
    SpeculativeCursor<Token> tokens = SpeculativeCursor.over(new Tokenizer().tokenize(source));
    ParseContext context = new ParseContext(moduleName);
    Root root = Parser.root(tokens, context);
    if (logger.isDebugEnabled()) {
      if (root == null) {
        logger.debug(String.format("Module '%s' failed to parse", moduleName));
      } else {
        logger.debug(
            String.format(
                "Parsed module '%s': %s statements, %s local variables, %s tokens",
                moduleName,
                root.statements().size(),
                context.localVars().size(),
                tokens.buffered()));
      }
    }
    return root;
  }

  /** Compiles a main module; see {@link #compile(String, String)}. */
  public static @Nullable String compile(String source) {
    return compile(source, ParseContext.MAIN_MODULE);
  }

  /**
   * Compiles a Sesascript module to C.
   *
   * @return the C program, or null if {@code source} is not a valid module
   */
  public static @Nullable String compile(String source, String moduleName) {
    Root root = parse(source, moduleName);
    return (root == null) ? null : root.render();
  }

  /**
   * Compiles a Sesascript module to C.
   *
   * @throws CompileError if {@code source} is not a valid module
   */
  public static String compileOrThrow(String source, String moduleName) {
    String result = compile(source, moduleName);
    if (result == null) {
      throw CompileError.syntaxError(moduleName);
    }
    return result;
  }
}
