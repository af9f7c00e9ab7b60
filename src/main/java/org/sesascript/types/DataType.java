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

import org.jspecify.annotations.Nullable;

/**
 * A DataType is the static type of a Sesascript value. There are four subclasses:
 *
 * <ul>
 *   <li>{@link StringType} and {@link VoidType}, each with a single instance;
 *   <li>{@link FunctionType}, for functions with named, ordered parameters; and
 *   <li>{@link Unresolved}, a placeholder that becomes bound to another type the first time it is
 *       passed to {@link #unify}.
 * </ul>
 *
 * <p>{@link Object#equals} on DataTypes is structural for the first three and identity for
 * Unresolved; it never binds anything. Type checking should use {@link #unify}.
 */
public abstract class DataType {

  // All subclasses are in this package.
  DataType() {}

  /** Returns the name of this type as it would be written in Sesascript, e.g. {@code str}. */
  public abstract String name();

  /** Returns the spelling of this type in the emitted C code, e.g. {@code char[]}. */
  public abstract String targetName();

  /**
   * Returns a C declarator for a variable of this type named {@code symbol}, e.g. {@code char[]
   * msg}.
   */
  public String declare(String symbol) {
    return targetName() + " " + symbol;
  }

  /**
   * Returns the concrete type this type stands for. For everything but {@link Unresolved} that's
   * just {@code this}.
   *
   * @throws UnresolvedTypeError if this is an Unresolved that was never bound
   */
  public DataType finalType() {
    return this;
  }

  /**
   * Checks that a value of type {@code actual} can be used where {@code expected} is required.
   *
   * <p>If either argument is an unbound {@link Unresolved} it is bound to the other (if both are,
   * {@code expected} is bound to {@code actual}), and the result is the type it was bound to. An
   * Unresolved that is already bound is replaced by its binding. Otherwise the types must be
   * equal.
   *
   * @return the unified type, or null if the types don't match
   */
  public static @Nullable DataType unify(DataType expected, DataType actual) {
    if (expected instanceof Unresolved placeholder) {
      return placeholder.unifyWith(actual);
    } else if (actual instanceof Unresolved placeholder) {
      return placeholder.unifyWith(expected);
    }
    return expected.equals(actual) ? expected : null;
  }

  @Override
  public String toString() {
    return name();
  }
}
