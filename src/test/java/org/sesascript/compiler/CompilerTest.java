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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.sesascript.testing.TestdataScanner;
import org.sesascript.testing.TestdataScanner.TestProgram;

/**
 * Compiles Sesascript source code from each of the .ss files in the testdata directory, based on
 * comments in the files.
 */
@RunWith(TestParameterInjector.class)
public class CompilerTest {

  private static final Path TESTDATA = Path.of("src/test/java/org/sesascript/compiler/testdata");

  /**
   * Each .ss file is expected to have source code followed by a comment that begins "{@code /*
   * COMPILE}".
   *
   * <p>There are three variants for the COMPILE comment:
   *
   * <ul>
   *   <li>With nothing else before the end of the comment: the test passes if the program compiles
   *       successfully.
   *   <li>With an error message on the same line (e.g. "{@code COMPILE: Syntax error}"): the test
   *       passes if compilation fails with an error starting with the given message.
   *   <li>With a colon followed by the expected output on the following lines: the test passes if
   *       the program compiles to exactly that C code (ignoring leading and trailing blank lines).
   * </ul>
   *
   * <p>A single file may contain multiple programs, each followed by a COMPILE comment; each is
   * compiled independently.
   */
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("\n/\\* COMPILE(.*?)\\*/\\n*", Pattern.DOTALL);

  @Test
  public void compileTestProgram(
      @TestParameter(valuesProvider = AllPrograms.class) TestProgram testProgram) {
    String comment = checkNotNull(testProgram.comment(), "No COMPILE comment found");
    String errMsg = null;
    String expected = null;
    if (!comment.isBlank()) {
      assertWithMessage("Bad COMPILE comment").that(comment).startsWith(":");
      int endOfFirstLine = comment.indexOf('\n');
      if (endOfFirstLine < 0) {
        errMsg = comment.substring(1).trim();
      } else {
        assertWithMessage("Noise after colon in COMPILE comment")
            .that(comment.substring(1, endOfFirstLine).trim())
            .isEmpty();
        expected = comment.substring(endOfFirstLine + 1);
      }
    }
    try {
      String result = Compiler.compileOrThrow(testProgram.code(), ParseContext.MAIN_MODULE);
      assertWithMessage("Expected error, compiled OK").that(errMsg).isNull();
      System.out.format("** %s:\n%s\n", testProgram.name(), result);
      if (expected != null) {
        assertWithMessage("Compilation results don't match")
            .that(result.strip())
            .isEqualTo(expected.strip());
      }
    } catch (CompileError e) {
      errMsg = (errMsg == null) ? "(no error expected)" : errMsg;
      assertWithMessage("Unexpected error %s", e).that(e.getMessage()).startsWith(errMsg);
    }
  }

  @Test
  public void emptyProgram() {
    assertThat(Compiler.compile(""))
        .isEqualTo("typedef char* str;\n\nint main() {\n    return 0;\n}\n");
  }

  @Test
  public void onlyMainSeesBuiltins() {
    assertThat(Compiler.compile("printf('a')\n", "helpers")).isNull();
    assertThat(Compiler.compile("greeting = 'a'\n", "helpers"))
        .contains("char[] greeting = \"a\";");
    CompileError e =
        assertThrows(CompileError.class, () -> Compiler.compileOrThrow("printf('a')", "helpers"));
    assertThat(e).hasMessageThat().isEqualTo("Syntax error in module 'helpers'");
  }

  @Test
  public void parseReturnsTree() {
    assertThat(Compiler.parse("x = 'a'\nprintf(x)").statements()).hasSize(2);
    assertThat(Compiler.parse("x = ")).isNull();
  }

  /** Provides a TestProgram for each code chunk in a ".ss" file in our testdata directory. */
  public static final class AllPrograms extends TestdataScanner {
    public AllPrograms() {
      super(TESTDATA, COMMENT_PATTERN);
    }
  }
}
