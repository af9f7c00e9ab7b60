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
 * A placeholder for a type that isn't known yet, e.g. the type of a variable on the left hand side
 * of its first assignment. The first call to {@link DataType#unify} that involves it binds it to the
 * other type; after that it behaves like the type it is bound to.
 *
 * <p>Unresolved instances are compared by identity.
 */
public final class Unresolved extends DataType {
  private @Nullable DataType bound;

  public Unresolved() {}

  /** Returns true if this has been unified with another type. */
  public boolean isBound() {
    return bound != null;
  }

  /** Unifies this placeholder with {@code other}, which may be another Unresolved. */
  @Nullable DataType unifyWith(DataType other) {
    if (bound != null) {
      return unify(bound, other);
    }
    // Don't create a cycle if other is (or is bound through a chain to) this.
    DataType target = other;
    while (target instanceof Unresolved placeholder && placeholder.bound != null) {
      target = placeholder.bound;
    }
    if (target == this) {
      return this;
    }
    bound = other;
    return other;
  }

  @Override
  public DataType finalType() {
    if (bound == null) {
      throw new UnresolvedTypeError("No type was inferred");
    }
    return bound.finalType();
  }

  @Override
  public String name() {
    return (bound == null) ? "infer" : bound.name();
  }

  /** Only valid once this is bound to a concrete type. */
  @Override
  public String targetName() {
    return finalType().targetName();
  }

  @Override
  public String declare(String symbol) {
    return finalType().declare(symbol);
  }
}
