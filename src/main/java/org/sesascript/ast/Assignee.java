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

import com.google.common.collect.ImmutableList;
import org.sesascript.types.VariableBinding;

/**
 * The left hand side of an {@link Assignment}. If this is the first assignment to the variable in
 * its scope it is also the variable's declaration, and is emitted with its type.
 */
public final class Assignee extends Node {
  private final VariableBinding binding;
  private final boolean isDeclaration;

  public Assignee(VariableBinding binding, boolean isDeclaration) {
    this.binding = binding;
    this.isDeclaration = isDeclaration;
  }

  public VariableBinding binding() {
    return binding;
  }

  public boolean isDeclaration() {
    return isDeclaration;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public void emit(Emitter out) {
    if (isDeclaration) {
      out.append(binding.type().declare(binding.symbol()));
    } else {
      out.append(binding.symbol());
    }
  }
}
