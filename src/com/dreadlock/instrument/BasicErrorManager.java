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

import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.Objects;
import java.util.TreeSet;

/**
 * An error manager that sorts and de-duplicates everything reported to it, and writes it out when
 * {@link #generateReport()} is called.
 *
 * <p>This error manager does not produce any output itself; subclasses override {@link
 * #println(CheckLevel, DreadlockError)} and {@link #printSummary()}.
 */
public abstract class BasicErrorManager implements ErrorManager {

  private final TreeSet<ErrorWithLevel> messages = new TreeSet<>(new LeveledErrorComparator());
  private int errorCount = 0;
  private int warningCount = 0;

  @Override
  public void report(CheckLevel level, DreadlockError error) {
    if (!level.isOn()) {
      return;
    }
    if (messages.add(new ErrorWithLevel(error, level))) {
      if (level == CheckLevel.ERROR) {
        errorCount++;
      } else {
        warningCount++;
      }
    }
  }

  @Override
  public int getErrorCount() {
    return errorCount;
  }

  @Override
  public int getWarningCount() {
    return warningCount;
  }

  @Override
  public void generateReport() {
    // Copied so that println may report more diagnostics.
    for (ErrorWithLevel message : ImmutableList.copyOf(messages)) {
      println(message.level, message.error);
    }
    printSummary();
  }

  /**
   * Print a message with a trailing new line. This method is called by the {@link
   * #generateReport()} method when generating messages.
   */
  public abstract void println(CheckLevel level, DreadlockError error);

  /** Print the summary of the run: the number of errors and warnings. */
  protected abstract void printSummary();

  /**
   * Orders diagnostics by level (errors first), source name, line number and description.
   * Diagnostics without a source or line sort before those with one.
   */
  static final class LeveledErrorComparator implements Comparator<ErrorWithLevel> {
    private static final int P1_LT_P2 = -1;
    private static final int P1_GT_P2 = 1;

    @Override
    public int compare(ErrorWithLevel p1, ErrorWithLevel p2) {
      // null is the smallest value
      if (p2 == null) {
        return p1 == null ? 0 : P1_GT_P2;
      }
      if (p1 == null) {
        return P1_LT_P2;
      }

      if (p1.level != p2.level) {
        return p1.level.compareTo(p2.level);
      }

      String source1 = p1.error.sourceName();
      String source2 = p2.error.sourceName();
      if (source1 != null && source2 != null) {
        int sourceCompare = source1.compareTo(source2);
        if (sourceCompare != 0) {
          return sourceCompare;
        }
      } else if (source1 == null && source2 != null) {
        return P1_LT_P2;
      } else if (source1 != null && source2 == null) {
        return P1_GT_P2;
      }

      int lineno1 = p1.error.lineNumber();
      int lineno2 = p2.error.lineNumber();
      if (lineno1 != lineno2) {
        return Integer.compare(lineno1, lineno2);
      }

      int typeCompare = p1.error.type().compareTo(p2.error.type());
      if (typeCompare != 0) {
        return typeCompare;
      }
      return p1.error.description().compareTo(p2.error.description());
    }
  }

  static final class ErrorWithLevel {
    final DreadlockError error;
    final CheckLevel level;

    ErrorWithLevel(DreadlockError error, CheckLevel level) {
      this.error = error;
      this.level = level;
    }

    @Override
    public int hashCode() {
      return Objects.hash(level, error.description(), error.sourceName(), error.lineNumber());
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ErrorWithLevel)) {
        return false;
      }
      ErrorWithLevel e = (ErrorWithLevel) obj;
      return level == e.level
          && Objects.equals(error.description(), e.error.description())
          && Objects.equals(error.sourceName(), e.error.sourceName())
          && error.lineNumber() == e.error.lineNumber();
    }
  }
}
