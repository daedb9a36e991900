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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Ascii;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.util.Collection;
import java.util.Map;

/** Options for instrumenting and reverting files. */
public class InstrumentOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final String DEFAULT_INDENT = "    ";

  /** Environment variable naming the formatter used by {@link #setSanitize sanitize}. */
  public static final String FORMATTER_ENV = "CLANG_FORMAT_EXE";

  private String indent = DEFAULT_INDENT;

  /** Align synthetic statements with the first indented line of their scope. */
  private boolean align = false;

  /** Leave out the revert markers, making the rewrite one-way. */
  private boolean disableRevert = false;

  /** Mutex expressions, and file names, that are never instrumented. */
  private ImmutableSet<String> excludes = ImmutableSet.of();

  private boolean dryRun = false;

  private boolean overwrite = false;

  private boolean debug = false;

  /** Run each file through an external formatter before scanning it. */
  private boolean sanitize = false;

  private String formatterPath = "clang-format";

  public InstrumentOptions() {}

  public String getIndent() {
    return indent;
  }

  /** Sets the indent used per scope level for synthetic statements. */
  public void setIndent(String indent) {
    checkArgument(!indent.isEmpty(), "Indent must not be empty");
    this.indent = indent;
  }

  public boolean isAlign() {
    return align;
  }

  public void setAlign(boolean align) {
    this.align = align;
  }

  public boolean isDisableRevert() {
    return disableRevert;
  }

  public void setDisableRevert(boolean disableRevert) {
    this.disableRevert = disableRevert;
  }

  public ImmutableSet<String> getExcludes() {
    return excludes;
  }

  public void setExcludes(Collection<String> excludes) {
    this.excludes = ImmutableSet.copyOf(excludes);
  }

  /** Whether {@code mutexExpression} names an excluded mutex. */
  public boolean isExcludedMutex(String mutexExpression) {
    return excludes.contains(mutexExpression);
  }

  /** Whether {@code path} names an excluded file. File names compare case-insensitively. */
  public boolean isExcludedFile(String path) {
    for (String exclude : excludes) {
      if (Ascii.equalsIgnoreCase(exclude, path)) {
        return true;
      }
    }
    return false;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public void setDryRun(boolean dryRun) {
    this.dryRun = dryRun;
  }

  public boolean isOverwrite() {
    return overwrite;
  }

  public void setOverwrite(boolean overwrite) {
    this.overwrite = overwrite;
  }

  public boolean isDebug() {
    return debug;
  }

  public void setDebug(boolean debug) {
    this.debug = debug;
  }

  public boolean isSanitize() {
    return sanitize;
  }

  public void setSanitize(boolean sanitize) {
    this.sanitize = sanitize;
  }

  public String getFormatterPath() {
    return formatterPath;
  }

  public void setFormatterPath(String formatterPath) {
    this.formatterPath = checkNotNull(formatterPath);
  }

  /**
   * Turns an indent given on the command line into the indent text. Both {@code \t} written out
   * and {@code <tab>} stand for a tab character.
   *
   * @throws IllegalArgumentException if the result is empty
   */
  public static String parseIndent(String value) {
    String indent = value.replace("\\t", "\t").replace("<tab>", "\t");
    checkArgument(!indent.isEmpty(), "Indent must not be empty");
    return indent;
  }

  /**
   * Returns the formatter to run: the {@value #FORMATTER_ENV} environment variable when set,
   * otherwise clang-format from the path.
   */
  public static String resolveFormatterPath(Map<String, String> environment, String osName) {
    String configured = environment.get(FORMATTER_ENV);
    if (configured != null && !configured.isEmpty()) {
      return configured;
    }
    return Ascii.toLowerCase(osName).startsWith("windows") ? "clang-format.exe" : "clang-format";
  }

  /**
   * Expands exclude values: a value naming an existing file contributes the names listed in that
   * file, one per line; any other value is taken as a name.
   */
  public static ImmutableList<String> expandExcludes(Iterable<String> values) throws IOException {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (String value : values) {
      File file = new File(value);
      if (file.isFile()) {
        for (String line : Files.asCharSource(file, UTF_8).readLines()) {
          String name = CharMatcher.whitespace().trimTrailingFrom(line);
          if (!name.isEmpty()) {
            result.add(name);
          }
        }
      } else {
        result.add(value);
      }
    }
    return result.build();
  }
}
