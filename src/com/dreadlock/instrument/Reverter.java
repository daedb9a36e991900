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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Undoes instrumentation using only the text of the instrumented file. The Dreadlock header
 * include is dropped, rewritten lines are replaced by the original kept in their revert marker,
 * and synthetic statements, which have no marker, are dropped. Every other line is kept as is.
 */
public final class Reverter {

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  /** Reverts the text of a file. A final newline does not count as an empty last line. */
  public RevertResult revert(String text) {
    List<String> lines = LINE_SPLITTER.splitToList(text);
    if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
      lines = lines.subList(0, lines.size() - 1);
    }
    return revert(lines);
  }

  public RevertResult revert(List<String> lines) {
    ImmutableList.Builder<String> output = ImmutableList.builder();
    int reverted = 0;
    int dropped = 0;
    for (String line : lines) {
      if (DreadlockMacros.isHeaderInclude(line)) {
        dropped++;
        continue;
      }
      int macroIndex = line.indexOf(DreadlockMacros.PREFIX);
      if (macroIndex < 0) {
        output.add(line);
        continue;
      }
      String original = RevertMarker.extract(line, macroIndex);
      if (original == null) {
        dropped++;
      } else {
        output.add(original);
        reverted++;
      }
    }
    return RevertResult.create(output.build(), reverted, dropped);
  }
}
