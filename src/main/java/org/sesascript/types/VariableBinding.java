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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Associates a symbol with its type.
 *
 * <p>The type is usually fixed when the binding is created, but a binding created for the first
 * assignment to a variable starts out {@link Unresolved}; once the assignment has unified it with
 * the assigned value's type, {@link #finalizeType} replaces the placeholder with the concrete type.
 */
public final class VariableBinding {
  private final String symbol;
  private DataType type;

  public VariableBinding(String symbol, DataType type) {
    Preconditions.checkArgument(!symbol.isEmpty(), "Empty symbol");
    this.symbol = symbol;
    this.type = Preconditions.checkNotNull(type);
  }

  public String symbol() {
    return symbol;
  }

  public DataType type() {
    return type;
  }

  /**
   * Replaces this binding's type by its {@link DataType#finalType final type}, and returns it.
   *
   * @throws UnresolvedTypeError if the type is an Unresolved that was never bound
   */
  @CanIgnoreReturnValue
  public DataType finalizeType() {
    type = type.finalType();
    return type;
  }

  @Override
  public String toString() {
    return symbol + ": " + type.name();
  }
}
