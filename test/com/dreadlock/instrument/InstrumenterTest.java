/*
 * Copyright 2026 The Dreadlock Authors.
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

package com.dreadlock.instrument;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.dreadlock.scan.ScopeScanner;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Instrumenter}. */
@RunWith(JUnit4.class)
public final class InstrumenterTest {
  private static final Joiner LINE_JOINER = Joiner.on('\n');

  private final InstrumentOptions options = new InstrumentOptions();

  private InstrumentResult instrument(String... lines) {
    return instrumentText(LINE_JOINER.join(lines) + "\n");
  }

  private InstrumentResult instrumentText(String text) {
    return new Instrumenter(options).instrument("test.cc", new ScopeScanner().scan(text));
  }

  private void assertUnchanged(String... lines) {
    InstrumentResult result = instrument(lines);
    assertThat(result.isChanged()).isFalse();
    assertThat(result.getLines()).containsExactlyElementsIn(lines).inOrder();
  }

  @Test
  public void testLockHeldUntilScopeExit() {
    InstrumentResult result =
        instrument(
            "#include <mutex>",
            "",
            "void f() {",
            "    std::unique_lock<std::mutex> lock(m);",
            "    work();",
            "}");

    assertThat(result.getLines())
        .containsExactly(
            "#include <mutex>",
            "#include \"Dreadlock.h\"",
            "",
            "void f() {",
            "    DREADLOCK(m); // {{    std::unique_lock<std::mutex> lock(m);}}",
            "    work();",
            "    DREADLOCK_UNLOCK(m);  // aids Dreadlock's bookkeeping 1",
            "    DREADLOCK_DESTRUCT(m);  // aids Dreadlock's bookkeeping 1",
            "}")
        .inOrder();
    assertThat(result.isChanged()).isTrue();
    assertThat(result.getRewrittenSites()).isEqualTo(1);
    assertThat(result.getSyntheticStatements()).isEqualTo(2);
  }

  @Test
  public void testDeferredMemberMutex() {
    InstrumentResult result =
        instrument(
            "void f(Obj* obj) {",
            "  std::unique_lock<std::mutex> lock(obj->mtx, std::defer_lock);",
            "}");

    assertThat(result.getLines())
        .containsExactly(
            "#include \"Dreadlock.h\"",
            "void f(Obj* obj) {",
            "  DREADLOCK_DEFER_ID(obj->mtx, mtx); // {{  std::unique_lock<std::mutex>"
                + " lock(obj->mtx, std::defer_lock);}}",
            "    DREADLOCK_DESTRUCT_ID(obj->mtx, mtx);  // aids Dreadlock's bookkeeping 1",
            "}")
        .inOrder();
  }

  @Test
  public void testExplicitLockAndUnlock() {
    InstrumentResult result =
        instrument(
            "void f() {",
            "  std::unique_lock<std::mutex> lock(m, std::defer_lock);",
            "  lock.lock();",
            "  work();",
            "  lock.unlock();",
            "}");

    assertThat(result.getLines())
        .containsExactly(
            "#include \"Dreadlock.h\"",
            "void f() {",
            "  DREADLOCK_DEFER(m); // {{  std::unique_lock<std::mutex> lock(m, std::defer_lock);}}",
            "  DREADLOCK_LOCK(m); // {{  lock.lock();}}",
            "  work();",
            "  DREADLOCK_UNLOCK(m); // {{  lock.unlock();}}",
            "    DREADLOCK_DESTRUCT(m);  // aids Dreadlock's bookkeeping 1",
            "}")
        .inOrder();
    assertThat(result.getRewrittenSites()).isEqualTo(3);
  }

  @Test
  public void testLockedAgainBeforeExit() {
    InstrumentResult result =
        instrument(
            "void f() {",
            "  std::unique_lock<std::mutex> lock(m);",
            "  lock.unlock();",
            "  lock.lock();",
            "}");

    assertThat(result.getLines())
        .containsAtLeast(
            "    DREADLOCK_UNLOCK(m);  // aids Dreadlock's bookkeeping 1",
            "    DREADLOCK_DESTRUCT(m);  // aids Dreadlock's bookkeeping 1")
        .inOrder();
  }

  @Test
  public void testCleanupGoesBeforeReturn() {
    InstrumentResult result =
        instrument(
            "int f() {",
            "  std::unique_lock<std::mutex> lock(m);",
            "  return compute();",
            "}");

    assertThat(result.getLines())
        .containsExactly(
            "#include \"Dreadlock.h\"",
            "int f() {",
            "  DREADLOCK(m); // {{  std::unique_lock<std::mutex> lock(m);}}",
            "    DREADLOCK_UNLOCK(m);  // aids Dreadlock's bookkeeping 1",
            "    DREADLOCK_DESTRUCT(m);  // aids Dreadlock's bookkeeping 1",
            "  return compute();",
            "}")
        .inOrder();
  }

  @Test
  public void testIdentifierContainingReturnIsNotAReturn() {
    InstrumentResult result =
        instrument(
            "void f() {", //
            "  std::unique_lock<std::mutex> lock(m);",
            "  returned = 1;",
            "}");

    ImmutableList<String> lines = result.getLines();
    assertThat(lines.indexOf("  returned = 1;"))
        .isLessThan(lines.indexOf("    DREADLOCK_UNLOCK(m);  // aids Dreadlock's bookkeeping 1"));
  }

  @Test
  public void testNestedScopesCleanUpOwnLocksOnly() {
    InstrumentResult result =
        instrument(
            "void f() {",
            "  std::unique_lock<std::mutex> outer(a);",
            "  if (x) {",
            "    std::unique_lock<std::mutex> inner(b);",
            "    outer.unlock();",
            "  }",
            "}");

    assertThat(result.getLines())
        .containsExactly(
            "#include \"Dreadlock.h\"",
            "void f() {",
            "  DREADLOCK(a); // {{  std::unique_lock<std::mutex> outer(a);}}",
            "  if (x) {",
            "    DREADLOCK(b); // {{    std::unique_lock<std::mutex> inner(b);}}",
            "    DREADLOCK_UNLOCK(a); // {{    outer.unlock();}}",
            "        DREADLOCK_UNLOCK(b);  // aids Dreadlock's bookkeeping 2",
            "        DREADLOCK_DESTRUCT(b);  // aids Dreadlock's bookkeeping 2",
            "  }",
            "    DREADLOCK_UNLOCK(a);  // aids Dreadlock's bookkeeping 1",
            "    DREADLOCK_DESTRUCT(a);  // aids Dreadlock's bookkeeping 1",
            "}")
        .inOrder();
  }

  @Test
  public void testShadowedLockName() {
    InstrumentResult result =
        instrument(
            "void f() {",
            "  std::unique_lock<std::mutex> lock(a);",
            "  {",
            "    std::unique_lock<std::mutex> lock(b);",
            "    lock.unlock();",
            "  }",
            "  lock.unlock();",
            "}");

    assertThat(result.getLines())
        .containsExactly(
            "#include \"Dreadlock.h\"",
            "void f() {",
            "  DREADLOCK(a); // {{  std::unique_lock<std::mutex> lock(a);}}",
            "  {",
            "    DREADLOCK(b); // {{    std::unique_lock<std::mutex> lock(b);}}",
            "    DREADLOCK_UNLOCK(b); // {{    lock.unlock();}}",
            "        DREADLOCK_DESTRUCT(b);  // aids Dreadlock's bookkeeping 2",
            "  }",
            "  DREADLOCK_UNLOCK(a); // {{  lock.unlock();}}",
            "    DREADLOCK_DESTRUCT(a);  // aids Dreadlock's bookkeeping 1",
            "}")
        .inOrder();
  }

  @Test
  public void testExcludedMutexIsLeftAlone() {
    options.setExcludes(ImmutableList.of("m"));
    assertUnchanged(
        "void f() {", //
        "  std::unique_lock<std::mutex> lock(m);",
        "  lock.unlock();",
        "}");
  }

  @Test
  public void testExclusionIsPerMutex() {
    options.setExcludes(ImmutableList.of("a"));
    InstrumentResult result =
        instrument(
            "void f() {",
            "  std::unique_lock<std::mutex> la(a);",
            "  std::unique_lock<std::mutex> lb(b);",
            "}");

    assertThat(result.getLines()).contains("  std::unique_lock<std::mutex> la(a);");
    assertThat(result.getLines())
        .contains("    DREADLOCK_DESTRUCT(b);  // aids Dreadlock's bookkeeping 1");
    assertThat(result.getSyntheticStatements()).isEqualTo(2);
  }

  @Test
  public void testNoLocksMeansNoChange() {
    assertUnchanged(
        "#include <vector>", //
        "int f() {",
        "  return 1;",
        "}");
  }

  @Test
  public void testFileScopeDeclarationIsUntouched() {
    assertUnchanged("std::unique_lock<std::mutex> lock(m);");
  }

  @Test
  public void testSameLineScopeIsNotEntered() {
    assertUnchanged("void f() { std::unique_lock<std::mutex> lock(m); }");
  }

  @Test
  public void testCommentsAndLiteralsAreNotRewritten() {
    assertUnchanged(
        "void f() {",
        "  // std::unique_lock<std::mutex> lock(m);",
        "  /* std::unique_lock<std::mutex> lock(m); */",
        "  const char* s = \"std::unique_lock<std::mutex> lock(m);\";",
        "  log(\"lock.lock()\");",
        "}");
  }

  @Test
  public void testBraceInStringDoesNotCloseScope() {
    InstrumentResult result =
        instrument(
            "void f() {",
            "  const char* s = \"}\";",
            "  std::unique_lock<std::mutex> lock(m);",
            "}");

    assertThat(result.getLines())
        .containsExactly(
            "#include \"Dreadlock.h\"",
            "void f() {",
            "  const char* s = \"}\";",
            "  DREADLOCK(m); // {{  std::unique_lock<std::mutex> lock(m);}}",
            "    DREADLOCK_UNLOCK(m);  // aids Dreadlock's bookkeeping 1",
            "    DREADLOCK_DESTRUCT(m);  // aids Dreadlock's bookkeeping 1",
            "}")
        .inOrder();
  }

  @Test
  public void testEscapedBackslashBeforeEscapedQuote() {
    InstrumentResult result =
        instrument(
            "void f() {",
            "  std::unique_lock<std::mutex> lock(m);",
            "  log(\"path \\\\\\\"{\");",
            "}");

    assertThat(result.getLines())
        .containsExactly(
            "#include \"Dreadlock.h\"",
            "void f() {",
            "  DREADLOCK(m); // {{  std::unique_lock<std::mutex> lock(m);}}",
            "  log(\"path \\\\\\\"{\");",
            "    DREADLOCK_UNLOCK(m);  // aids Dreadlock's bookkeeping 1",
            "    DREADLOCK_DESTRUCT(m);  // aids Dreadlock's bookkeeping 1",
            "}")
        .inOrder();
  }

  @Test
  public void testCallOnUnknownVariableIsLeftAlone() {
    assertUnchanged(
        "void f() {", //
        "  guard.lock();",
        "  guard.unlock();",
        "}");
  }

  @Test
  public void testHeaderAfterLastLocalInclude() {
    InstrumentResult result =
        instrument(
            "#include \"a.h\"",
            "#include <mutex>",
            "#include \"b.h\"",
            "#include <vector>",
            "void f() {",
            "  std::unique_lock<std::mutex> lock(m);",
            "}");

    assertThat(result.getLines().subList(0, 5))
        .containsExactly(
            "#include \"a.h\"",
            "#include <mutex>",
            "#include \"b.h\"",
            "#include \"Dreadlock.h\"",
            "#include <vector>")
        .inOrder();
  }

  @Test
  public void testHeaderAfterLastSystemInclude() {
    InstrumentResult result =
        instrument(
            "#include <mutex>",
            "#include <vector>",
            "// #include \"commented.h\"",
            "void f() {",
            "  std::unique_lock<std::mutex> lock(m);",
            "}");

    assertThat(result.getLines().get(2)).isEqualTo("#include \"Dreadlock.h\"");
  }

  @Test
  public void testCustomIndent() {
    options.setIndent("\t");
    InstrumentResult result =
        instrument(
            "void f() {", //
            "  if (x) {",
            "    std::unique_lock<std::mutex> lock(m);",
            "  }",
            "}");

    assertThat(result.getLines())
        .contains("\t\tDREADLOCK_DESTRUCT(m);  // aids Dreadlock's bookkeeping 2");
  }

  @Test
  public void testAlignWithObservedIndent() {
    options.setAlign(true);
    InstrumentResult result =
        instrument(
            "void f() {",
            "  if (x) {",
            "     std::unique_lock<std::mutex> lock(m);",
            "  }",
            "}");

    assertThat(result.getLines())
        .containsAtLeast(
            "     DREADLOCK_UNLOCK(m);  // aids Dreadlock's bookkeeping 2",
            "     DREADLOCK_DESTRUCT(m);  // aids Dreadlock's bookkeeping 2")
        .inOrder();
  }

  @Test
  public void testAlignFallsBackToIndentWithoutPlainLine() {
    options.setAlign(true);
    InstrumentResult result =
        instrument(
            "void f() { std::unique_lock<std::mutex> lock(m);", //
            "}");

    assertThat(result.getLines())
        .contains("    DREADLOCK_DESTRUCT(m);  // aids Dreadlock's bookkeeping 1");
  }

  @Test
  public void testDisableRevert() {
    options.setDisableRevert(true);
    InstrumentResult result =
        instrument(
            "void f() {", //
            "  std::unique_lock<std::mutex> lock(m);",
            "}");

    assertThat(result.getLines()).contains("  DREADLOCK(m);");
    for (String line : result.getLines()) {
      assertThat(line).doesNotContain("{{");
    }
  }

  @Test
  public void testTrailingCodeAfterDeclarationIsKeptInMarkerOnly() {
    InstrumentResult result =
        instrument(
            "void f() {", //
            "  std::unique_lock<std::mutex> lock(m); work();",
            "}");

    assertThat(result.getLines())
        .contains("  DREADLOCK(m); // {{  std::unique_lock<std::mutex> lock(m); work();}}");
  }

  @Test
  public void testMalformedMutex() {
    MalformedMutexException e =
        assertThrows(
            MalformedMutexException.class,
            () ->
                instrument(
                    "void f() {", //
                    "  std::unique_lock<std::mutex> lock(*ptr);",
                    "}"));
    assertThat(e.getSourceName()).isEqualTo("test.cc");
    assertThat(e.getLineNumber()).isEqualTo(2);
    assertThat(e.getExpression()).isEqualTo("*ptr");
  }

  @Test
  public void testMalformedMutexAtFileScope() {
    MalformedMutexException e =
        assertThrows(
            MalformedMutexException.class,
            () -> instrument("std::unique_lock<std::mutex> lk(*pm);", "int x;"));
    assertThat(e.getLineNumber()).isEqualTo(1);
    assertThat(e.getExpression()).isEqualTo("*pm");
  }

  @Test
  public void testInstrumentingTwiceChangesNothing() {
    String once =
        instrument(
                "#include <mutex>",
                "int f(Obj* obj) {",
                "  std::unique_lock<std::mutex> lock(obj->mtx, std::defer_lock);",
                "  lock.lock();",
                "  if (x) {",
                "    std::unique_lock<std::mutex> other(m);",
                "  }",
                "  return 0;",
                "}")
            .toText();

    InstrumentResult twice = instrumentText(once);
    assertThat(twice.isChanged()).isFalse();
    assertThat(twice.toText()).isEqualTo(once);
  }

  @Test
  public void testFinalLineWithoutNewline() {
    InstrumentResult result = instrumentText("int x;");
    assertThat(result.getLines()).containsExactly("int x;");
    assertThat(result.toText()).isEqualTo("int x;\n");
  }
}
