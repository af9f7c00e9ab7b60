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

/** The kinds of {@link Token} produced by a {@link Tokenizer}. */
public enum TokenKind {
  OPERATOR,
  STRING_LITERAL,
  /** A single whitespace character other than a new line; runs of whitespace are not merged. */
  WHITESPACE,
  IDENTIFIER,
  NEW_LINE,
  /** Any single character that no other recognizer accepted. */
  UNKNOWN
}
