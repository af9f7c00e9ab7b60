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

/** A sequence of statements at the same indentation. */
public class Block extends Node {
  private final ImmutableList<Statement> statements;

  public Block(ImmutableList<Statement> statements) {
    this.statements = statements;
  }

  public ImmutableList<Statement> statements() {
    return statements;
  }

  @Override
  public ImmutableList<Statement> children() {
    return statements;
  }

  /** Emits each statement on its own line, one level deeper than the current depth. */
  @Override
  public void emit(Emitter out) {
    out.indent();
    for (Statement statement : statements) {
      out.startLine();
      statement.emit(out);
      out.append(";").endLine();
    }
    out.dedent();
  }
}
