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
import com.google.common.base.Strings;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

/**
 * Accumulates the C source text emitted by a tree of {@link Node}s, keeping track of the current
 * indentation depth.
 */
public final class Emitter {
  /** The number of spaces per indentation level. */
  public static final int INDENT_WIDTH = 4;

  private final StringBuilder out = new StringBuilder();
  private int depth;

  @CanIgnoreReturnValue
  public Emitter append(String text) {
    out.append(text);
    return this;
  }

  /** Emits the indentation for a new line at the current depth. */
  @CanIgnoreReturnValue
  public Emitter startLine() {
    out.append(Strings.repeat(" ", depth * INDENT_WIDTH));
    return this;
  }

  @CanIgnoreReturnValue
  public Emitter endLine() {
    out.append('\n');
    return this;
  }

  /** Emits {@code text} as a complete line at the current depth. */
  @CanIgnoreReturnValue
  public Emitter line(String text) {
    return startLine().append(text).endLine();
  }

  public void indent() {
    depth++;
  }

  public void dedent() {
    Preconditions.checkState(depth > 0, "Unbalanced dedent");
    depth--;
  }

  public int depth() {
    return depth;
  }

  @Override
  public String toString() {
    return out.toString();
  }
}
