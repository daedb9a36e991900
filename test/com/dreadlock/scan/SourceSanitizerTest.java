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

package com.dreadlock.scan;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;
import static org.junit.Assume.assumeTrue;

import com.dreadlock.scan.SourceSanitizer.SanitizedSource;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link SourceSanitizer}, using standard tools in place of clang-format. */
@RunWith(JUnit4.class)
public final class SourceSanitizerTest {
  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private File writeSource(String content) throws IOException {
    File source = folder.newFile("input.cpp");
    Files.asCharSink(source, UTF_8).write(content);
    return source;
  }

  @Test
  public void testFormatterOutputIsReadBack() throws IOException {
    assumeTrue(new File("/bin/cat").canExecute());
    File source = writeSource("void f() {\n}\n");

    File formatted;
    try (SanitizedSource sanitized = new SourceSanitizer("/bin/cat").sanitize(source)) {
      formatted = sanitized.getFile();
      assertThat(formatted.exists()).isTrue();
      assertThat(formatted.getName()).endsWith(".cpp");
      assertThat(sanitized.read()).isEqualTo("void f() {\n}\n");
    }
    assertThat(formatted.exists()).isFalse();
  }

  @Test
  public void testWindowsLineEndingsAreFolded() throws IOException {
    assumeTrue(new File("/bin/cat").canExecute());
    File source = writeSource("void f() {\r\n  g();\r\n}\r\n");

    try (SanitizedSource sanitized = new SourceSanitizer("/bin/cat").sanitize(source)) {
      assertThat(sanitized.read()).isEqualTo("void f() {\n  g();\n}\n");
      assertThat(sanitized.read()).isEqualTo(SourceFiles.read(source));
    }
  }

  @Test
  public void testSourceIsNotModified() throws IOException {
    assumeTrue(new File("/bin/cat").canExecute());
    File source = writeSource("int x;\n");
    try (SanitizedSource sanitized = new SourceSanitizer("/bin/cat").sanitize(source)) {
      assertThat(sanitized.getFile()).isNotEqualTo(source);
    }
    assertThat(Files.asCharSource(source, UTF_8).read()).isEqualTo("int x;\n");
  }

  @Test
  public void testFailingFormatter() throws IOException {
    assumeTrue(new File("/bin/false").canExecute());
    File source = writeSource("int x;\n");
    IOException e =
        assertThrows(IOException.class, () -> new SourceSanitizer("/bin/false").sanitize(source));
    assertThat(e).hasMessageThat().contains("exited with status");
  }

  @Test
  public void testMissingFormatter() throws IOException {
    File source = writeSource("int x;\n");
    File missing = new File(folder.getRoot(), "no-such-formatter");
    assertThrows(
        IOException.class, () -> new SourceSanitizer(missing.getPath()).sanitize(source));
  }
}
