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
 * The comment appended to a rewritten line that keeps the original line, so that the rewrite can
 * be undone exactly: {@code DREADLOCK(m); // {{  std::unique_lock<std::mutex> l(m);}}}.
 */
final class RevertMarker {

  static final String OPEN = "{{";
  static final String CLOSE = "}}";

  private static final String COMMENT = " // ";

  /** Returns the marker comment holding {@code originalLine}. */
  static String format(String originalLine) {
    return COMMENT + OPEN + originalLine + CLOSE;
  }

  /**
   * Returns the original line kept in the marker of {@code line}, or null if the line has none.
   * The marker is looked for after {@code macroIndex}, and closes at the last {@link #CLOSE} of
   * the line, so original text holding braces is recovered intact.
   */
  static @Nullable String extract(String line, int macroIndex) {
    int open = line.indexOf(OPEN, macroIndex);
    if (open < 0) {
      return null;
    }
    int close = line.lastIndexOf(CLOSE);
    if (close < open + OPEN.length()) {
      return null;
    }
    return line.substring(open + OPEN.length(), close);
  }

  private RevertMarker() {}
}
