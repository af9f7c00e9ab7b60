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

import com.google.errorprone.annotations.FormatMethod;

/**
 * All Sesascript language errors that can't be handled by trying another alternative throw a
 * CompileError.
 *
 * <p>Ordinary parse failures are not errors in this sense; grammar rules report them by returning
 * null, and only the top-level entry points turn a failed parse into a CompileError.
 */
public class CompileError extends RuntimeException {
  public final String msg;

  public CompileError(String msg) {
    super(msg);
    this.msg = msg;
  }

  /** Returns a new CompileError with a formatted message. */
  @FormatMethod
  public static CompileError format(String fmt, Object... fmtArgs) {
    return new CompileError(String.format(fmt, fmtArgs));
  }

  /** Returns a new "Syntax error" CompileError for a program that couldn't be parsed. */
  static CompileError syntaxError(String moduleName) {
    return format("Syntax error in module '%s'", moduleName);
  }
}
