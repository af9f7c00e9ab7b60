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

/** The return type of functions that don't return anything, and the type of assignments. */
public final class VoidType extends DataType {
  public static final VoidType INSTANCE = new VoidType();

  private VoidType() {}

  @Override
  public String name() {
    return "void";
  }

  @Override
  public String targetName() {
    return "void";
  }
}
