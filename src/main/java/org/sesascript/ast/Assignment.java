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
import org.sesascript.types.DataType;
import org.sesascript.types.VoidType;

/** {@code assignee = value} */
public final class Assignment extends Statement {
  private final Assignee assignee;
  private final ValueStatement value;

  public Assignment(Assignee assignee, ValueStatement value) {
    this.assignee = assignee;
    this.value = value;
  }

  public Assignee assignee() {
    return assignee;
  }

  public ValueStatement value() {
    return value;
  }

  /** Assignments don't produce a value. */
  @Override
  public DataType type() {
    return VoidType.INSTANCE;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of(assignee, value);
  }

  @Override
  public void emit(Emitter out) {
    assignee.emit(out);
    out.append(" = ");
    value.emit(out);
  }
}
