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

package org.sesascript.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.sesascript.types.DataType;
import org.sesascript.types.FunctionType;
import org.sesascript.types.VariableBinding;

/**
 * A call to a function-valued variable, with one argument for each of the function's parameters.
 */
public final class CallStatement extends ValueStatement {
  private final VariableBinding function;

  /** Keyed by parameter name, in the order the parameters were declared. */
  private final ImmutableMap<String, ValueStatement> args;

  public CallStatement(VariableBinding function, ImmutableMap<String, ValueStatement> args) {
    Preconditions.checkArgument(function.type() instanceof FunctionType, function);
    Preconditions.checkArgument(
        args.keySet().equals(functionType(function).params().keySet()),
        "Arguments %s don't match %s",
        args.keySet(),
        function);
    this.function = function;
    this.args = args;
  }

  private static FunctionType functionType(VariableBinding function) {
    return (FunctionType) function.type();
  }

  public VariableBinding function() {
    return function;
  }

  public ImmutableMap<String, ValueStatement> args() {
    return args;
  }

  @Override
  public DataType type() {
    return functionType(function).returnType();
  }

  @Override
  public ImmutableList<ValueStatement> children() {
    return args.values().asList();
  }

  @Override
  public void emit(Emitter out) {
    out.append(function.symbol()).append("(");
    String separator = "";
    for (ValueStatement arg : args.values()) {
      out.append(separator);
      arg.emit(out);
      separator = ", ";
    }
    out.append(")");
  }
}
