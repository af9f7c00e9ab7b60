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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.stream.Collectors.joining;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The type of a function: an ordered list of named parameters, and a return type.
 *
 * <p>Each FunctionType also has an alias, the name used for it when it is spelled out in C (e.g.
 * {@code void (*printf_t)(char[])}). Two FunctionTypes with the same parameters and return type are
 * equal even if their aliases differ.
 */
public final class FunctionType extends DataType {
  /** The alias used if none is specified. */
  public static final String DEFAULT_ALIAS = "c_fn";

  private final ImmutableMap<String, VariableBinding> params;
  private final DataType returnType;
  private final String alias;

  private FunctionType(
      ImmutableMap<String, VariableBinding> params, DataType returnType, String alias) {
    this.params = params;
    this.returnType = returnType;
    this.alias = alias;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** The parameters, keyed by name, in declaration order. */
  public ImmutableMap<String, VariableBinding> params() {
    return params;
  }

  /** The parameters in declaration order. */
  public ImmutableList<VariableBinding> paramList() {
    return params.values().asList();
  }

  public DataType returnType() {
    return returnType;
  }

  public String alias() {
    return alias;
  }

  @Override
  public String name() {
    String paramString =
        params.values().stream().map(VariableBinding::toString).collect(joining(", "));
    return "(" + paramString + ") -> " + returnType.name();
  }

  @Override
  public String targetName() {
    return declare(alias);
  }

  @Override
  public String declare(String symbol) {
    String paramTypes =
        params.values().stream().map(p -> p.type().targetName()).collect(joining(", "));
    return String.format("%s (*%s)(%s)", returnType.targetName(), symbol, paramTypes);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FunctionType other)) {
      return false;
    }
    return returnType.equals(other.returnType)
        && params.keySet().asList().equals(other.params.keySet().asList())
        && paramTypes().equals(other.paramTypes());
  }

  @Override
  public int hashCode() {
    return Objects.hash(params.keySet().asList(), paramTypes(), returnType);
  }

  private ImmutableList<DataType> paramTypes() {
    return params.values().stream().map(VariableBinding::type).collect(toImmutableList());
  }

  /** A Builder for FunctionTypes. */
  public static final class Builder {
    private final ImmutableMap.Builder<String, VariableBinding> params = ImmutableMap.builder();
    private DataType returnType = VoidType.INSTANCE;
    private String alias = DEFAULT_ALIAS;

    private Builder() {}

    /** Adds a parameter; parameter names must be distinct. */
    @CanIgnoreReturnValue
    public Builder param(String name, DataType type) {
      Preconditions.checkArgument(!(type instanceof Unresolved), "Parameter types must be known");
      params.put(name, new VariableBinding(name, type));
      return this;
    }

    /** Sets the return type; defaults to void. */
    @CanIgnoreReturnValue
    public Builder returns(DataType returnType) {
      this.returnType = Preconditions.checkNotNull(returnType);
      return this;
    }

    /** Sets the alias; defaults to {@link #DEFAULT_ALIAS}. */
    @CanIgnoreReturnValue
    public Builder alias(String alias) {
      this.alias = Preconditions.checkNotNull(alias);
      return this;
    }

    public FunctionType build() {
      return new FunctionType(params.buildOrThrow(), returnType, alias);
    }
  }
}
