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

/**
 * The base class for all nodes of a Sesascript syntax tree. Nodes are immutable once constructed
 * and own their children; no node appears in more than one place in a tree.
 */
public abstract class Node {

  // All subclasses are in this package.
  Node() {}

  /** Returns this node's children, in source order. */
  public abstract ImmutableList<? extends Node> children();

  /**
   * Emits the C code for this node. Statements and expressions don't emit line breaks; that's up
   * to the enclosing {@link Block}.
   */
  public abstract void emit(Emitter out);

  /** Returns the C code for this node, as if it were emitted at depth zero. */
  public final String render() {
    Emitter out = new Emitter();
    emit(out);
    return out.toString();
  }

  @Override
  public String toString() {
    return render();
  }
}
