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

package org.sesascript.util;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * A SpeculativeCursor is a position in a sequence of items that can be forked, so that a caller
 * can try to consume some items and then either keep or discard the result.
 *
 * <p>All cursors forked (directly or indirectly) from the same origin share a single source
 * iterator and a single append-only buffer; each item is pulled from the source at most once, the
 * first time any of them advances past the end of the buffer. Only the position is per-cursor.
 *
 * <p>The usual pattern is
 *
 * <pre>
 *   SpeculativeCursor&lt;Token&gt; attempt = cursor.fork(1);
 *   ... advance attempt as far as needed ...
 *   if (matched) {
 *     attempt.commit();
 *   }
 * </pre>
 *
 * A fork that is dropped without calling {@link #commit} has no effect on its parent.
 *
 * <p>Positions start at -1 ("iteration hasn't started"), so the first call to {@link #advance}
 * returns the first item.
 *
 * <p>SpeculativeCursors are not thread-safe.
 */
public final class SpeculativeCursor<T> {
  private final Iterator<? extends T> source;

  /** Shared with every cursor forked from the same origin; only ever appended to. */
  private final List<T> buffer;

  /** If non-null, the cursor that {@link #commit} will update. */
  private final @Nullable SpeculativeCursor<T> parent;

  private int position;

  private SpeculativeCursor(
      Iterator<? extends T> source,
      List<T> buffer,
      @Nullable SpeculativeCursor<T> parent,
      int position) {
    this.source = source;
    this.buffer = buffer;
    this.parent = parent;
    this.position = position;
  }

  /** Returns a new cursor over the items of {@code source}, positioned before the first one. */
  public static <T> SpeculativeCursor<T> over(Iterator<? extends T> source) {
    return new SpeculativeCursor<>(source, new ArrayList<>(), null, -1);
  }

  /** Returns a new cursor over the items of {@code source}, positioned before the first one. */
  public static <T> SpeculativeCursor<T> over(Iterable<? extends T> source) {
    return over(source.iterator());
  }

  /** Returns true if a call to {@link #advance} would succeed. */
  public boolean hasNext() {
    return position + 1 < buffer.size() || source.hasNext();
  }

  /**
   * Moves this cursor forward one item and returns the item at its new position.
   *
   * @throws NoSuchElementException if the source has been exhausted; the position is unchanged
   */
  @CanIgnoreReturnValue
  public T advance() {
    int next = position + 1;
    if (next >= buffer.size()) {
      assert next == buffer.size();
      if (!source.hasNext()) {
        throw new NoSuchElementException("Cursor exhausted at position " + position);
      }
      buffer.add(source.next());
    }
    position = next;
    return buffer.get(position);
  }

  /** Returns the item at this cursor's position. */
  public T current() {
    Preconditions.checkState(position >= 0, "Iteration hasn't started yet");
    return buffer.get(position);
  }

  /**
   * Moves this cursor back by {@code n} items, but not before the start of the buffer. Used to
   * "un-consume" a lookahead item.
   */
  public void rewind(int n) {
    Preconditions.checkArgument(n >= 0, "Can't rewind by %s", n);
    position = Math.max(-1, position - n);
  }

  /**
   * Equivalent to {@code fork(0)}; the first call to {@link #advance} on the result will return
   * {@link #current}.
   */
  public SpeculativeCursor<T> fork() {
    return fork(0);
  }

  /**
   * Returns a new cursor that shares this cursor's buffer and is positioned at {@code position() -
   * 1 + offset} (but not before the start). {@code fork(1)} continues from exactly where this cursor
   * is.
   */
  public SpeculativeCursor<T> fork(int offset) {
    return new SpeculativeCursor<>(source, buffer, this, Math.max(-1, position - 1 + offset));
  }

  /**
   * Sets the position of the cursor this was forked from to this cursor's position. Does nothing
   * if this cursor was not created by {@link #fork}.
   */
  public void commit() {
    if (parent != null) {
      parent.position = position;
    }
  }

  /** Returns this cursor's position; -1 if iteration hasn't started. */
  public int position() {
    return position;
  }

  /** Returns the number of items that have been pulled from the source so far. */
  public int buffered() {
    return buffer.size();
  }

  @Override
  public String toString() {
    return String.format("SpeculativeCursor@%s/%s", position, buffer.size());
  }
}
