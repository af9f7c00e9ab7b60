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

import com.google.common.collect.ImmutableList;
import org.sesascript.types.FunctionType;
import org.sesascript.types.StringType;
import org.sesascript.types.VariableBinding;
import org.sesascript.types.VoidType;

/** A statics-only class that creates the bindings every main module starts with. */
public final class Builtins {

  // Statics only
  private Builtins() {}

  public static final String PRINTF = "printf";

  /** {@code printf(message: str) -> void}, spelled {@code printf_t} in C. */
  public static final FunctionType PRINTF_TYPE =
      FunctionType.builder()
          .param("message", StringType.INSTANCE)
          .returns(VoidType.INSTANCE)
          .alias("printf_t")
          .build();

  /** Returns new bindings for each of the built-in symbols. */
  public static ImmutableList<VariableBinding> create() {
    return ImmutableList.of(new VariableBinding(PRINTF, PRINTF_TYPE));
  }
}
