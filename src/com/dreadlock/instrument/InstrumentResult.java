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

/** The outcome of instrumenting one file. */
@AutoValue
public abstract class InstrumentResult {

  private static final Joiner LINE_JOINER = Joiner.on('\n');

  static InstrumentResult create(
      ImmutableList<String> lines, boolean changed, int rewrittenSites, int syntheticStatements) {
    return new AutoValue_InstrumentResult(lines, changed, rewrittenSites, syntheticStatements);
  }

  /** Returns the output lines, without newlines. */
  public abstract ImmutableList<String> getLines();

  /** Whether any line was rewritten or added. */
  public abstract boolean isChanged();

  /** Returns how many declarations and lock/unlock calls were rewritten. */
  public abstract int getRewrittenSites();

  /** Returns how many unlock/destruct statements were added at scope exits. */
  public abstract int getSyntheticStatements();

  /** Returns the output as file text, ending with a newline. */
  public String toText() {
    return LINE_JOINER.join(getLines()) + "\n";
  }
}
