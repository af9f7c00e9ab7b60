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

package org.sesascript.types;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.sesascript.compiler.CompileError;

@RunWith(JUnit4.class)
public class DataTypeTest {

  private static final FunctionType PRINT =
      FunctionType.builder().param("message", StringType.INSTANCE).alias("print_t").build();

  @Test
  public void unresolvedUnifiesOnce() {
    Unresolved u = new Unresolved();
    assertThat(u.isBound()).isFalse();
    assertThat(DataType.unify(u, StringType.INSTANCE)).isSameInstanceAs(StringType.INSTANCE);
    assertThat(u.isBound()).isTrue();
    assertThat(u.finalType()).isSameInstanceAs(StringType.INSTANCE);
    // Once bound it behaves like the type it's bound to.
    assertThat(DataType.unify(u, VoidType.INSTANCE)).isNull();
    assertThat(DataType.unify(u, StringType.INSTANCE)).isSameInstanceAs(StringType.INSTANCE);
    assertThat(u.finalType()).isSameInstanceAs(StringType.INSTANCE);
  }

  @Test
  public void unresolvedOnTheRightIsAlsoBound() {
    Unresolved u = new Unresolved();
    assertThat(DataType.unify(PRINT, u)).isEqualTo(PRINT);
    assertThat(u.finalType()).isEqualTo(PRINT);
  }

  @Test
  public void finalTypeOfUnboundPlaceholderFails() {
    Unresolved u = new Unresolved();
    UnresolvedTypeError e = assertThrows(UnresolvedTypeError.class, u::finalType);
    assertThat(e).isInstanceOf(CompileError.class);
    assertThrows(UnresolvedTypeError.class, u::targetName);
    VariableBinding binding = new VariableBinding("x", u);
    assertThrows(UnresolvedTypeError.class, binding::finalizeType);
  }

  @Test
  public void leftPlaceholderCapturesRight() {
    Unresolved left = new Unresolved();
    Unresolved right = new Unresolved();
    assertThat(DataType.unify(left, right)).isSameInstanceAs(right);
    assertThat(left.isBound()).isTrue();
    assertThat(right.isBound()).isFalse();
    assertThrows(UnresolvedTypeError.class, left::finalType);
    DataType.unify(right, StringType.INSTANCE);
    assertThat(left.finalType()).isSameInstanceAs(StringType.INSTANCE);
  }

  @Test
  public void placeholdersDontFormCycles() {
    Unresolved a = new Unresolved();
    Unresolved b = new Unresolved();
    DataType.unify(a, b);
    assertThat(DataType.unify(b, a)).isSameInstanceAs(b);
    assertThat(b.isBound()).isFalse();
    assertThat(DataType.unify(a, a)).isSameInstanceAs(b);
    DataType.unify(b, VoidType.INSTANCE);
    assertThat(a.finalType()).isSameInstanceAs(VoidType.INSTANCE);
  }

  @Test
  public void concreteTypesCompareStructurally() {
    assertThat(DataType.unify(StringType.INSTANCE, StringType.INSTANCE)).isNotNull();
    assertThat(DataType.unify(StringType.INSTANCE, VoidType.INSTANCE)).isNull();
    assertThat(DataType.unify(StringType.INSTANCE, PRINT)).isNull();
    FunctionType samePrint =
        FunctionType.builder()
            .param("message", StringType.INSTANCE)
            .returns(VoidType.INSTANCE)
            .build();
    // The alias doesn't matter...
    assertThat(samePrint).isEqualTo(PRINT);
    assertThat(samePrint.hashCode()).isEqualTo(PRINT.hashCode());
    assertThat(DataType.unify(PRINT, samePrint)).isSameInstanceAs(PRINT);
    // ... but parameter names, parameter types and return types do.
    assertThat(FunctionType.builder().param("msg", StringType.INSTANCE).build())
        .isNotEqualTo(PRINT);
    assertThat(FunctionType.builder().param("message", VoidType.INSTANCE).build())
        .isNotEqualTo(PRINT);
    assertThat(
            FunctionType.builder()
                .param("message", StringType.INSTANCE)
                .returns(StringType.INSTANCE)
                .build())
        .isNotEqualTo(PRINT);
    assertThat(FunctionType.builder().build()).isNotEqualTo(PRINT);
    assertThat(PRINT).isNotEqualTo(StringType.INSTANCE);
  }

  @Test
  public void names() {
    assertThat(StringType.INSTANCE.name()).isEqualTo("str");
    assertThat(VoidType.INSTANCE.name()).isEqualTo("void");
    assertThat(new Unresolved().name()).isEqualTo("infer");
    assertThat(PRINT.name()).isEqualTo("(message: str) -> void");
    FunctionType two =
        FunctionType.builder()
            .param("a", StringType.INSTANCE)
            .param("b", StringType.INSTANCE)
            .returns(StringType.INSTANCE)
            .build();
    assertThat(two.toString()).isEqualTo("(a: str, b: str) -> str");
  }

  @Test
  public void targetNames() {
    assertThat(StringType.INSTANCE.targetName()).isEqualTo("char[]");
    assertThat(VoidType.INSTANCE.targetName()).isEqualTo("void");
    assertThat(PRINT.alias()).isEqualTo("print_t");
    assertThat(PRINT.targetName()).isEqualTo("void (*print_t)(char[])");
    assertThat(FunctionType.builder().build().alias()).isEqualTo(FunctionType.DEFAULT_ALIAS);
    assertThat(FunctionType.builder().build().targetName()).isEqualTo("void (*c_fn)()");
    assertThat(StringType.INSTANCE.declare("msg")).isEqualTo("char[] msg");
    assertThat(PRINT.declare("p")).isEqualTo("void (*p)(char[])");
    Unresolved u = new Unresolved();
    DataType.unify(u, StringType.INSTANCE);
    assertThat(u.targetName()).isEqualTo("char[]");
    assertThat(u.declare("s")).isEqualTo("char[] s");
  }

  @Test
  public void finalizeType() {
    Unresolved u = new Unresolved();
    VariableBinding binding = new VariableBinding("x", u);
    assertThat(binding.type()).isSameInstanceAs(u);
    DataType.unify(binding.type(), StringType.INSTANCE);
    assertThat(binding.finalizeType()).isSameInstanceAs(StringType.INSTANCE);
    assertThat(binding.type()).isSameInstanceAs(StringType.INSTANCE);
    assertThat(binding.toString()).isEqualTo("x: str");
  }

  @Test
  public void badFunctionTypes() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FunctionType.builder().param("a", new Unresolved()));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            FunctionType.builder()
                .param("a", StringType.INSTANCE)
                .param("a", StringType.INSTANCE)
                .build());
  }
}
