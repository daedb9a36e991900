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

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the mutex named by a lock declaration cannot be turned into a bookkeeping token.
 * Processing of the file stops; leaving a lock uninstrumented would hide it from deadlock
 * detection.
 */
public final class MalformedMutexException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final @Nullable String sourceName;
  private final int lineNumber;
  private final String expression;

  MalformedMutexException(
      @Nullable String sourceName, int lineNumber, String expression, Throwable cause) {
    super(
        (sourceName == null ? "" : sourceName + ":" + lineNumber + ": ")
            + "cannot instrument mutex '"
            + expression
            + "': "
            + cause.getMessage(),
        cause);
    this.sourceName = sourceName;
    this.lineNumber = lineNumber;
    this.expression = expression;
  }

  public @Nullable String getSourceName() {
    return sourceName;
  }

  /** Returns the one-based line of the declaration. */
  public int getLineNumber() {
    return lineNumber;
  }

  /** Returns the constructor arguments of the declaration as written. */
  public String getExpression() {
    return expression;
  }
}
