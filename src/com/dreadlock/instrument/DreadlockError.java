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

import static com.google.common.base.Strings.isNullOrEmpty;
import static java.util.Objects.requireNonNull;

import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A diagnostic about one input file.
 *
 * @param type the type of the diagnostic
 * @param description the formatted message
 * @param sourceName the file the diagnostic is about, if any
 * @param lineNumber one-based line number, or -1 when the diagnostic concerns the whole file
 */
public record DreadlockError(
    DiagnosticType type, String description, @Nullable String sourceName, int lineNumber)
    implements Serializable {

  static final int UNKNOWN_LINE = -1;

  public DreadlockError {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
  }

  /** Creates an error that is not tied to a file. */
  public static DreadlockError make(DiagnosticType type, Object... arguments) {
    return new DreadlockError(type, type.format(arguments), null, UNKNOWN_LINE);
  }

  /** Creates an error about a whole file. */
  public static DreadlockError forFile(
      String sourceName, DiagnosticType type, Object... arguments) {
    return new DreadlockError(type, type.format(arguments), sourceName, UNKNOWN_LINE);
  }

  /** Creates an error about one line of a file. */
  public static DreadlockError forLine(
      String sourceName, int lineNumber, DiagnosticType type, Object... arguments) {
    return new DreadlockError(type, type.format(arguments), sourceName, lineNumber);
  }

  /** Returns the level this error is reported at unless the caller overrides it. */
  public CheckLevel defaultLevel() {
    return type.level;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (!isNullOrEmpty(sourceName)) {
      sb.append(sourceName);
      if (lineNumber != UNKNOWN_LINE) {
        sb.append(':').append(lineNumber);
      }
      sb.append(": ");
    }
    return sb.append(type.key).append(". ").append(description).toString();
  }
}
