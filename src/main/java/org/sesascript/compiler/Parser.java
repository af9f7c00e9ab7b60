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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.function.Predicate;
import org.apache.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.sesascript.ast.Assignee;
import org.sesascript.ast.Assignment;
import org.sesascript.ast.Block;
import org.sesascript.ast.CallStatement;
import org.sesascript.ast.Node;
import org.sesascript.ast.Root;
import org.sesascript.ast.Statement;
import org.sesascript.ast.StringLiteral;
import org.sesascript.ast.ValueStatement;
import org.sesascript.ast.VariableReference;
import org.sesascript.types.DataType;
import org.sesascript.types.FunctionType;
import org.sesascript.types.Unresolved;
import org.sesascript.types.VariableBinding;
import org.sesascript.util.Logging;
import org.sesascript.util.SpeculativeCursor;

/**
 * A statics-only class containing the Sesascript grammar, as a set of {@link GrammarRule}s.
 *
 * <p>Each rule works on its own fork of the token cursor, and only commits it once the whole
 * production has matched; backtracking is just a matter of dropping the fork. Rules report failure
 * by returning null, never by throwing.
 *
 * <p>Where more than one production is possible the alternatives are tried in the order they
 * appear in {@link #STANDALONE_STATEMENTS} or {@link #VALUE_STATEMENTS}, and the first that
 * succeeds is used.
 */
public final class Parser {

  private static final Logger logger = Logging.getLogger();

  // Statics only
  private Parser() {}

  /** The statements that can appear on a line by themselves, in priority order. */
  static final ImmutableList<GrammarRule<? extends Statement>> STANDALONE_STATEMENTS =
      ImmutableList.of(Parser::assignment, Parser::valueStatement);

  /** The statements that produce a value, in priority order. */
  static final ImmutableList<GrammarRule<? extends ValueStatement>> VALUE_STATEMENTS =
      ImmutableList.of(Parser::stringLiteral, Parser::callStatement, Parser::variableReference);

  private static final Predicate<Token> IS_IDENTIFIER = t -> t.kind() == TokenKind.IDENTIFIER;

  /**
   * Parses a complete module. If this is the main module, the built-in bindings are first added to
   * the context's enclosing scope.
   *
   * <p>Returns null unless every token is consumed, i.e. if some line doesn't parse or is indented
   * differently from the module's top-level block.
   */
  public static @Nullable Root root(SpeculativeCursor<Token> tokens, ParseContext context) {
    if (context.isMainModule()) {
      context.addEnclosing(Builtins.create());
    }
    SpeculativeCursor<Token> cursor = tokens.fork(1);
    Block block = block(cursor, context);
    if (block == null) {
      return null;
    } else if (cursor.hasNext()) {
      if (logger.isTraceEnabled()) {
        logger.trace(
            String.format(
                "Unexpected indentation in module '%s' at token %s",
                context.moduleName(), cursor.position() + 1));
      }
      return null;
    }
    cursor.commit();
    return new Root(block.statements());
  }

  /**
   * Parses a sequence of lines, each containing a single statement preceded by exactly {@link
   * ParseContext#indentWidth} whitespace tokens. Blank lines are skipped.
   *
   * <p>The block ends at the end of the input or at the first line with different indentation,
   * which is left for the caller. Returns null if a line with the block's indentation doesn't
   * contain a valid statement followed only by whitespace.
   */
  public static @Nullable Block block(SpeculativeCursor<Token> tokens, ParseContext context) {
    ImmutableList.Builder<Statement> statements = ImmutableList.builder();
    SpeculativeCursor<Token> cursor = tokens.fork(1);
    while (cursor.hasNext()) {
      SpeculativeCursor<Token> line = cursor.fork(1);
      int indent = 0;
      Token first = null;
      while (line.hasNext()) {
        Token token = line.advance();
        if (token.kind() != TokenKind.WHITESPACE) {
          first = token;
          break;
        }
        indent++;
      }
      if (first == null) {
        // Nothing but whitespace from here to the end of the input.
        line.commit();
        break;
      } else if (first.kind() == TokenKind.NEW_LINE) {
        line.commit();
        continue;
      } else if (indent != context.indentWidth()) {
        if (logger.isTraceEnabled()) {
          logger.trace(
              String.format(
                  "Block with indentation %s ended by line with indentation %s",
                  context.indentWidth(), indent));
        }
        break;
      }
      line.rewind(1);
      Statement statement = statement(line, context);
      if (statement == null || !endOfLine(line)) {
        if (logger.isTraceEnabled()) {
          logger.trace(String.format("No statement matches line starting with %s", first));
        }
        return null;
      }
      statements.add(statement);
      line.commit();
    }
    cursor.commit();
    return new Block(statements.build());
  }

  /** Parses any of the {@link #STANDALONE_STATEMENTS}. */
  public static @Nullable Statement statement(
      SpeculativeCursor<Token> tokens, ParseContext context) {
    return firstMatch(STANDALONE_STATEMENTS, tokens, context);
  }

  /**
   * Parses {@code assignee = value}, where the value's type must match the type of the assignee.
   * If this is the first assignment to the assignee, the assignee's type is inferred from the value
   * and it is declared as a local variable.
   */
  public static @Nullable Assignment assignment(
      SpeculativeCursor<Token> tokens, ParseContext context) {
    SpeculativeCursor<Token> cursor = tokens.fork(1);
    Assignee assignee = assignee(cursor, context);
    if (assignee == null) {
      return null;
    }
    skipWhitespace(cursor);
    if (nextIf(cursor, t -> t.is(TokenKind.OPERATOR, "=")) == null) {
      return null;
    }
    skipWhitespace(cursor);
    ValueStatement value = valueStatement(cursor, context);
    if (value == null) {
      return null;
    }
    VariableBinding binding = assignee.binding();
    if (DataType.unify(binding.type(), value.type()) == null) {
      return null;
    }
    binding.finalizeType();
    if (context.lookupLocal(binding.symbol()) == null) {
      context.declare(binding);
    }
    cursor.commit();
    return new Assignment(assignee, value);
  }

  /**
   * Parses a single identifier. If it names an existing local variable the result refers to that
   * variable; otherwise it has a new binding of as-yet-unknown type and is marked as a declaration.
   */
  public static @Nullable Assignee assignee(SpeculativeCursor<Token> tokens, ParseContext context) {
    Token name = nextIf(tokens, IS_IDENTIFIER);
    if (name == null) {
      return null;
    }
    VariableBinding existing = context.lookupLocal(name.text());
    if (existing != null) {
      return new Assignee(existing, false);
    }
    return new Assignee(new VariableBinding(name.text(), new Unresolved()), true);
  }

  /** Parses any of the {@link #VALUE_STATEMENTS}. */
  public static @Nullable ValueStatement valueStatement(
      SpeculativeCursor<Token> tokens, ParseContext context) {
    return firstMatch(VALUE_STATEMENTS, tokens, context);
  }

  /** Parses a single string literal token. */
  public static @Nullable StringLiteral stringLiteral(
      SpeculativeCursor<Token> tokens, ParseContext context) {
    Token token = nextIf(tokens, t -> t.kind() == TokenKind.STRING_LITERAL);
    return (token == null) ? null : new StringLiteral(token);
  }

  /**
   * Parses {@code name(arg, ...)}, where {@code name} is a visible variable with a function type
   * and there is exactly one argument for each of its parameters, with matching types.
   */
  public static @Nullable CallStatement callStatement(
      SpeculativeCursor<Token> tokens, ParseContext context) {
    SpeculativeCursor<Token> cursor = tokens.fork(1);
    Token name = nextIf(cursor, IS_IDENTIFIER);
    if (name == null) {
      return null;
    }
    VariableBinding function = context.lookup(name.text());
    if (function == null || !(function.type() instanceof FunctionType type)) {
      return null;
    }
    skipWhitespace(cursor);
    if (!punctuation(cursor, "(")) {
      return null;
    }
    ImmutableList<VariableBinding> params = type.paramList();
    ImmutableMap.Builder<String, ValueStatement> args = ImmutableMap.builder();
    if (params.isEmpty()) {
      skipWhitespace(cursor);
      if (!punctuation(cursor, ")")) {
        return null;
      }
    }
    for (int i = 0; i < params.size(); i++) {
      VariableBinding param = params.get(i);
      skipWhitespace(cursor);
      Statement arg = statement(cursor, context);
      if (!(arg instanceof ValueStatement value)
          || DataType.unify(param.type(), value.type()) == null) {
        return null;
      }
      args.put(param.symbol(), value);
      skipWhitespace(cursor);
      if (!punctuation(cursor, (i == params.size() - 1) ? ")" : ",")) {
        return null;
      }
    }
    cursor.commit();
    return new CallStatement(function, args.buildOrThrow());
  }

  /** Parses an identifier that names a visible variable. */
  public static @Nullable VariableReference variableReference(
      SpeculativeCursor<Token> tokens, ParseContext context) {
    SpeculativeCursor<Token> cursor = tokens.fork(1);
    Token name = nextIf(cursor, IS_IDENTIFIER);
    if (name == null) {
      return null;
    }
    VariableBinding binding = context.lookup(name.text());
    if (binding == null) {
      return null;
    }
    cursor.commit();
    return new VariableReference(binding);
  }

  /** Returns the result of the first rule that matches, or null if none do. */
  private static <T extends Node> @Nullable T firstMatch(
      ImmutableList<GrammarRule<? extends T>> rules,
      SpeculativeCursor<Token> tokens,
      ParseContext context) {
    for (GrammarRule<? extends T> rule : rules) {
      T result = rule.parse(tokens, context);
      if (result != null) {
        return result;
      }
    }
    return null;
  }

  /**
   * If the next token satisfies {@code test}, advances {@code tokens} past it and returns it;
   * otherwise returns null and leaves {@code tokens} unchanged.
   */
  private static @Nullable Token nextIf(SpeculativeCursor<Token> tokens, Predicate<Token> test) {
    SpeculativeCursor<Token> cursor = tokens.fork(1);
    if (!cursor.hasNext()) {
      return null;
    }
    Token token = cursor.advance();
    if (!test.test(token)) {
      return null;
    }
    cursor.commit();
    return token;
  }

  /**
   * Punctuation characters such as parentheses and commas aren't operators, so they're tokenized
   * as {@link TokenKind#UNKNOWN}; accept either kind, but not e.g. a string literal with the same
   * text.
   */
  private static boolean punctuation(SpeculativeCursor<Token> tokens, String text) {
    return nextIf(
            tokens,
            t ->
                (t.kind() == TokenKind.UNKNOWN || t.kind() == TokenKind.OPERATOR)
                    && t.text().equals(text))
        != null;
  }

  /** Advances {@code tokens} past any whitespace tokens. */
  private static void skipWhitespace(SpeculativeCursor<Token> tokens) {
    SpeculativeCursor<Token> cursor = tokens.fork(1);
    while (cursor.hasNext()) {
      if (cursor.advance().kind() != TokenKind.WHITESPACE) {
        cursor.rewind(1);
        break;
      }
    }
    cursor.commit();
  }

  /**
   * If the remainder of the line is only whitespace, advances {@code tokens} past it (and the new
   * line, if there is one) and returns true.
   */
  private static boolean endOfLine(SpeculativeCursor<Token> tokens) {
    SpeculativeCursor<Token> cursor = tokens.fork(1);
    skipWhitespace(cursor);
    if (cursor.hasNext() && nextIf(cursor, t -> t.kind() == TokenKind.NEW_LINE) == null) {
      return false;
    }
    cursor.commit();
    return true;
  }
}
