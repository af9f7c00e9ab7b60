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

package org.sesascript.compiler;

import com.google.common.base.Preconditions;

/**
 * A Token is an immutable (kind, text) pair. For {@link TokenKind#STRING_LITERAL} tokens the text
 * excludes the enclosing quotes but includes any backslash escapes exactly as written.
 */
public record Token(TokenKind kind, String text) {

  public Token {
    Preconditions.checkNotNull(kind);
    Preconditions.checkNotNull(text);
  }

  /** Returns true if this token has the given kind and text. */
  public boolean is(TokenKind kind, String text) {
    return this.kind == kind && this.text.equals(text);
  }

  @Override
  public String toString() {
    return kind + "(" + text.replace("\n", "\\n") + ")";
  }
}
