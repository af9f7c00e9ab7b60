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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.sesascript.types.VariableBinding;

/**
 * The mutable state shared by all the grammar rules invoked while parsing a module. A single
 * ParseContext is created for each top-level parse and passed by reference to every rule.
 *
 * <p>Symbols are looked up in two tiers: variables declared by the module itself ({@link
 * #localVars}) take precedence over the enclosing (built-in or imported) variables. Both maps are
 * only ever added to; a rule that fails after adding an entry does not remove it, so rules should
 * only declare variables once they know they will succeed.
 */
public final class ParseContext {
  /** The name of the module that gets the built-in bindings. */
  public static final String MAIN_MODULE = "main";

  private final Map<String, VariableBinding> enclosingVars = new LinkedHashMap<>();
  private final Map<String, VariableBinding> localVars = new LinkedHashMap<>();
  private final int indentWidth;
  private final String moduleName;

  public ParseContext(String moduleName) {
    this(moduleName, 0);
  }

  /**
   * @param moduleName the name of the module being parsed
   * @param indentWidth the number of whitespace tokens that must precede each statement of the
   *     module's top-level block
   */
  public ParseContext(String moduleName, int indentWidth) {
    Preconditions.checkArgument(indentWidth >= 0);
    this.moduleName = Preconditions.checkNotNull(moduleName);
    this.indentWidth = indentWidth;
  }

  public String moduleName() {
    return moduleName;
  }

  public boolean isMainModule() {
    return moduleName.equals(MAIN_MODULE);
  }

  /** The indentation (in whitespace tokens, not columns) of the block being parsed. */
  public int indentWidth() {
    return indentWidth;
  }

  /** An unmodifiable view of the enclosing variables, in the order they were added. */
  public Map<String, VariableBinding> enclosingVars() {
    return Collections.unmodifiableMap(enclosingVars);
  }

  /** An unmodifiable view of the local variables, in the order they were declared. */
  public Map<String, VariableBinding> localVars() {
    return Collections.unmodifiableMap(localVars);
  }

  /** Makes the given bindings visible in the enclosing scope, replacing any with the same name. */
  public void addEnclosing(Iterable<VariableBinding> bindings) {
    for (VariableBinding binding : bindings) {
      enclosingVars.put(binding.symbol(), binding);
    }
  }

  /** Adds a new local variable. */
  public void declare(VariableBinding binding) {
    VariableBinding prev = localVars.putIfAbsent(binding.symbol(), binding);
    Preconditions.checkArgument(prev == null, "'%s' is already declared", binding.symbol());
  }

  /** Returns the local variable with the given name, or null if there is none. */
  public @Nullable VariableBinding lookupLocal(String symbol) {
    return localVars.get(symbol);
  }

  /**
   * Returns the local variable with the given name if there is one, otherwise the enclosing
   * variable with that name, or null if neither exists.
   */
  public @Nullable VariableBinding lookup(String symbol) {
    VariableBinding result = localVars.get(symbol);
    return (result != null) ? result : enclosingVars.get(symbol);
  }
}
