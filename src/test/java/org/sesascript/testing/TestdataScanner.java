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

package org.sesascript.testing;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Splits each of the {@code .ss} files in a directory into test programs.
 *
 * <p>A file may contain any number of programs, each followed by a comment matching the given
 * pattern; group 1 of the pattern is the comment body that describes the expected result. Code
 * after the last comment (if not blank) is returned as a program with a null comment.
 */
public class TestdataScanner implements TestParameter.TestParameterValuesProvider {

  /**
   * A single program from a testdata file.
   *
   * @param name the file name and the line number on which the program starts
   * @param code the program's source code
   * @param comment the body of the comment following the program, or null if there was none
   */
  public record TestProgram(String name, String code, @Nullable String comment) {
    @Override
    public String toString() {
      return name;
    }
  }

  private final Path dir;
  private final Pattern commentPattern;

  protected TestdataScanner(Path dir, Pattern commentPattern) {
    this.dir = dir;
    this.commentPattern = commentPattern;
  }

  @Override
  public List<TestProgram> provideValues() {
    ImmutableList.Builder<TestProgram> result = ImmutableList.builder();
    try (Stream<Path> files = Files.list(dir)) {
      for (Path file : files.filter(f -> f.toString().endsWith(".ss")).sorted().toList()) {
        scan(file, Files.readString(file, StandardCharsets.UTF_8), result);
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return result.build();
  }

  private void scan(Path file, String text, ImmutableList.Builder<TestProgram> result) {
    String fileName = file.getFileName().toString();
    Matcher matcher = commentPattern.matcher(text);
    int start = 0;
    while (matcher.find()) {
      String code = text.substring(start, matcher.start());
      result.add(new TestProgram(name(fileName, text, start), code, matcher.group(1)));
      start = matcher.end();
    }
    String rest = text.substring(start);
    if (!rest.isBlank()) {
      result.add(new TestProgram(name(fileName, text, start), rest, null));
    }
  }

  /** Returns "fileName:line", where line is the (1-based) line containing {@code start}. */
  private static String name(String fileName, String text, int start) {
    int line = 1 + (int) text.substring(0, start).chars().filter(c -> c == '\n').count();
    return fileName + ":" + line;
  }
}
