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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EmitterTest {

  @Test
  public void indentation() {
    Emitter out = new Emitter();
    assertThat(out.depth()).isEqualTo(0);
    out.line("a {");
    out.indent();
    out.indent();
    assertThat(out.depth()).isEqualTo(2);
    out.startLine().append("b").append(";").endLine();
    out.dedent();
    out.line("c");
    out.dedent();
    assertThat(out.depth()).isEqualTo(0);
    out.line("}");
    assertThat(out.toString()).isEqualTo("a {\n        b;\n    c\n}\n");
  }

  @Test
  public void unbalancedDedent() {
    Emitter out = new Emitter();
    out.indent();
    out.dedent();
    assertThrows(IllegalStateException.class, out::dedent);
  }
}
