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

package org.sesascript.types;

import org.sesascript.compiler.CompileError;

/**
 * Thrown by {@link DataType#finalType} when asked for the final type of an {@link Unresolved}
 * that was never unified with anything.
 */
public class UnresolvedTypeError extends CompileError {
  public UnresolvedTypeError(String msg) {
    super(msg);
  }
}
