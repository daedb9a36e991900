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

import com.google.auto.value.AutoValue;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/** The outcome of reverting one file. */
@AutoValue
public abstract class RevertResult {

  private static final Joiner LINE_JOINER = Joiner.on('\n');

  static RevertResult create(ImmutableList<String> lines, int revertedLines, int droppedLines) {
    return new AutoValue_RevertResult(lines, revertedLines, droppedLines);
  }

  /** Returns the restored lines, without newlines. */
  public abstract ImmutableList<String> getLines();

  /** Returns how many lines were restored from their revert markers. */
  public abstract int getRevertedLines();

  /** Returns how many synthetic statements and header includes were removed. */
  public abstract int getDroppedLines();

  /**
   * Whether the file held any revert marker. Without one nothing can be restored, for instance
   * because the file was instrumented with revert markers disabled.
   */
  public boolean foundMarkers() {
    return getRevertedLines() > 0;
  }

  /** Returns the restored file text, ending with a newline. */
  public String toText() {
    return LINE_JOINER.join(getLines()) + "\n";
  }
}
