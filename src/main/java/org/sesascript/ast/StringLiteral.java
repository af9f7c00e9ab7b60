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
import org.sesascript.compiler.Token;
import org.sesascript.compiler.TokenKind;
import org.sesascript.types.DataType;
import org.sesascript.types.StringType;

/**
 * A string constant. The text is emitted exactly as it appeared between the quotes in the source,
 * so any backslash escapes are passed through to the C compiler.
 */
public final class StringLiteral extends ValueStatement {
  private final Token token;

  public StringLiteral(Token token) {
    Preconditions.checkArgument(token.kind() == TokenKind.STRING_LITERAL, token);
    this.token = token;
  }

  public String text() {
    return token.text();
  }

  @Override
  public DataType type() {
    return StringType.INSTANCE;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public void emit(Emitter out) {
    out.append("\"").append(token.text()).append("\"");
  }
}
