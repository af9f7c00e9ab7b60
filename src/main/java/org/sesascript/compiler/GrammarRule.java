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

import org.jspecify.annotations.Nullable;
import org.sesascript.ast.Node;
import org.sesascript.util.SpeculativeCursor;

/**
 * A GrammarRule tries to parse one kind of node.
 *
 * <p>It is called with a cursor whose next token should be the first token of the node. If it
 * succeeds it commits the cursor to the last token it used and returns the node; otherwise it
 * returns null and leaves the cursor where it was, so that the caller can try something else.
 */
@FunctionalInterface
public interface GrammarRule<T extends Node> {
  @Nullable T parse(SpeculativeCursor<Token> tokens, ParseContext context);
}
