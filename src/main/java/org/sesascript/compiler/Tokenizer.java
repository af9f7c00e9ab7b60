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

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import java.util.Iterator;
import org.jspecify.annotations.Nullable;
import org.sesascript.util.SpeculativeCursor;

/**
 * Splits source text into {@link Token}s.
 *
 * <p>For each character the Tokenizer tries a fixed list of {@link Recognizer}s in order and emits
 * the first token one of them returns. The order matters: string literals are recognized before
 * anything else so that quote characters are never taken as something else, and the final
 * recognizer accepts any single character as {@link TokenKind#UNKNOWN}.
 *
 * <p>A Tokenizer has no mutable state; the iterators returned by {@link #tokenize} are independent
 * of each other.
 */
public class Tokenizer {

  /**
   * A Recognizer is called with a cursor positioned on the first character of a possible token. If
   * it recognizes a token it returns it, after committing a fork positioned on the token's last
   * character; otherwise it returns null and leaves the cursor untouched.
   */
  @FunctionalInterface
  interface Recognizer {
    @Nullable Token recognize(SpeculativeCursor<Character> chars);
  }

  /** The operators recognized by the default Tokenizer. */
  public static final ImmutableSet<String> DEFAULT_OPERATORS = ImmutableSet.of("=");

  /** Characters that may start (and end) a string literal. */
  static final CharMatcher QUOTES = CharMatcher.anyOf("\"'`");

  /** Within a string literal, the next character is taken verbatim after this one. */
  static final char ESCAPE = '\\';

  /** New lines get their own token kind, so they aren't whitespace. */
  static final CharMatcher WHITESPACE = CharMatcher.whitespace().and(CharMatcher.isNot('\n'));

  static final CharMatcher IDENTIFIER_START =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('A', 'Z')).or(CharMatcher.anyOf("_$"));

  static final CharMatcher IDENTIFIER_PART = IDENTIFIER_START.or(CharMatcher.inRange('0', '9'));

  private final ImmutableSet<String> operators;
  private final int maxOperatorLength;
  private final ImmutableList<Recognizer> recognizers;

  public Tokenizer() {
    this(DEFAULT_OPERATORS);
  }

  public Tokenizer(ImmutableSet<String> operators) {
    Preconditions.checkArgument(!operators.isEmpty(), "No operators");
    Preconditions.checkArgument(!operators.contains(""), "Empty operator");
    this.operators = operators;
    this.maxOperatorLength = operators.stream().mapToInt(String::length).max().getAsInt();
    this.recognizers =
        ImmutableList.of(
            Tokenizer::stringLiteral,
            Tokenizer::whitespace,
            this::operator,
            Tokenizer::identifier,
            Tokenizer::newLine,
            Tokenizer::unknown);
  }

  /** Returns an Iterator that lazily tokenizes {@code source}. */
  public Iterator<Token> tokenize(String source) {
    SpeculativeCursor<Character> chars = SpeculativeCursor.over(Lists.charactersOf(source));
    return new AbstractIterator<Token>() {
      @Override
      protected Token computeNext() {
        if (!chars.hasNext()) {
          return endOfData();
        }
        chars.advance();
        for (Recognizer recognizer : recognizers) {
          Token token = recognizer.recognize(chars);
          if (token != null) {
            return token;
          }
        }
        // unknown() accepts anything
        throw new AssertionError();
      }
    };
  }

  /** Tokenizes all of {@code source}. */
  public ImmutableList<Token> tokenizeAll(String source) {
    return ImmutableList.copyOf(tokenize(source));
  }

  private static @Nullable Token stringLiteral(SpeculativeCursor<Character> chars) {
    char quote = chars.current();
    if (!QUOTES.matches(quote)) {
      return null;
    }
    SpeculativeCursor<Character> body = chars.fork(1);
    StringBuilder text = new StringBuilder();
    while (body.hasNext()) {
      char c = body.advance();
      if (c == quote) {
        body.commit();
        return new Token(TokenKind.STRING_LITERAL, text.toString());
      }
      text.append(c);
      if (c == ESCAPE) {
        if (!body.hasNext()) {
          break;
        }
        text.append(body.advance());
      }
    }
    // Unterminated
    return null;
  }

  private static @Nullable Token whitespace(SpeculativeCursor<Character> chars) {
    char c = chars.current();
    return WHITESPACE.matches(c) ? new Token(TokenKind.WHITESPACE, String.valueOf(c)) : null;
  }

  /** Tries the longest registered operator first. */
  private @Nullable Token operator(SpeculativeCursor<Character> chars) {
    SpeculativeCursor<Character> window = chars.fork();
    StringBuilder text = new StringBuilder();
    while (text.length() < maxOperatorLength && window.hasNext()) {
      text.append(window.advance());
    }
    for (int length = text.length(); length > 0; length--) {
      String candidate = text.substring(0, length);
      if (operators.contains(candidate)) {
        window.rewind(text.length() - length);
        window.commit();
        return new Token(TokenKind.OPERATOR, candidate);
      }
    }
    return null;
  }

  private static @Nullable Token identifier(SpeculativeCursor<Character> chars) {
    char first = chars.current();
    if (!IDENTIFIER_START.matches(first)) {
      return null;
    }
    StringBuilder text = new StringBuilder().append(first);
    SpeculativeCursor<Character> run = chars.fork(1);
    while (run.hasNext()) {
      char c = run.advance();
      if (!IDENTIFIER_PART.matches(c)) {
        run.rewind(1);
        break;
      }
      text.append(c);
    }
    run.commit();
    return new Token(TokenKind.IDENTIFIER, text.toString());
  }

  private static @Nullable Token newLine(SpeculativeCursor<Character> chars) {
    return chars.current() == '\n' ? new Token(TokenKind.NEW_LINE, "\n") : null;
  }

  private static Token unknown(SpeculativeCursor<Character> chars) {
    return new Token(TokenKind.UNKNOWN, String.valueOf(chars.current()));
  }
}
