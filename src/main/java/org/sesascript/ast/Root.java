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

/** The top-level block of a module; it is emitted as a complete C program. */
public final class Root extends Block {

  public Root(ImmutableList<Statement> statements) {
    super(statements);
  }

  @Override
  public void emit(Emitter out) {
    out.line("typedef char* str;");
    out.endLine();
    out.line("int main() {");
    super.emit(out);
    out.indent();
    out.line("return 0;");
    out.dedent();
    out.line("}");
  }
}
