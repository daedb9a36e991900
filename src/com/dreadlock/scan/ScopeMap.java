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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;

/**
 * The result of scanning one file: its lines, its scope tree, the scope events of every line and
 * the positions that hold code rather than literal or comment text.
 */
public final class ScopeMap {

  private static final int DEBUG_COLUMN_WIDTH = 20;

  private final ImmutableList<String> lines;
  private final ImmutableList<Scope> scopes;
  private final ImmutableList<ImmutableList<ScopeEvent>> events;
  private final ImmutableList<BitSet> codePositions;

  ScopeMap(ImmutableList<String> lines, ImmutableList<Scope> scopes, List<BitSet> codePositions) {
    checkArgument(
        lines.size() == codePositions.size(),
        "%s lines but %s code masks",
        lines.size(),
        codePositions.size());
    this.lines = lines;
    this.scopes = scopes;
    this.events = flatten(lines.size(), scopes);
    ImmutableList.Builder<BitSet> masks = ImmutableList.builder();
    for (BitSet mask : codePositions) {
      masks.add((BitSet) mask.clone());
    }
    this.codePositions = masks.build();
  }

  /** Returns the lines of the file, without their newlines. */
  public ImmutableList<String> getLines() {
    return lines;
  }

  public int getLineCount() {
    return lines.size();
  }

  /** Returns the top-level scopes of the file, in source order. */
  public ImmutableList<Scope> getScopes() {
    return scopes;
  }

  /** Returns the scope events of one line, outer scopes before the scopes nested in them. */
  public ImmutableList<ScopeEvent> eventsOn(int line) {
    checkElementIndex(line, events.size());
    return events.get(line);
  }

  /** Whether any scope boundary lies on the line. */
  public boolean hasEvents(int line) {
    return !eventsOn(line).isEmpty();
  }

  /**
   * Whether the character at {@code column} of {@code line} is code, that is outside any string
   * or character literal and any comment.
   */
  public boolean isCode(int line, int column) {
    checkElementIndex(line, codePositions.size());
    return column >= 0 && codePositions.get(line).get(column);
  }

  /** Renders the line table the way {@code --debug} shows it. */
  public String toDebugString() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < lines.size(); i++) {
      String prefix = Strings.padEnd(i + ": " + events.get(i), DEBUG_COLUMN_WIDTH, ' ');
      sb.append(prefix).append(hasEvents(i) ? "!> " : "-> ").append(lines.get(i)).append('\n');
    }
    return sb.toString();
  }

  private static ImmutableList<ImmutableList<ScopeEvent>> flatten(
      int lineCount, ImmutableList<Scope> scopes) {
    List<List<ScopeEvent>> table = new ArrayList<>(lineCount);
    for (int i = 0; i < lineCount; i++) {
      table.add(new ArrayList<>());
    }
    for (Scope scope : scopes) {
      flatten(scope, table);
    }
    ImmutableList.Builder<ImmutableList<ScopeEvent>> result = ImmutableList.builder();
    for (List<ScopeEvent> lineEvents : table) {
      result.add(ImmutableList.copyOf(lineEvents));
    }
    return result.build();
  }

  private static void flatten(Scope scope, List<List<ScopeEvent>> table) {
    Position start = scope.getStart();
    Position end = scope.getEnd();
    if (scope.isSameLine()) {
      table.get(start.getLine()).add(ScopeEvent.sameLine(start.getColumn(), end.getColumn()));
    } else {
      table.get(start.getLine()).add(ScopeEvent.open(start.getColumn()));
      table.get(end.getLine()).add(ScopeEvent.close(end.getColumn()));
    }
    for (Scope child : scope.getChildren()) {
      flatten(child, table);
    }
  }
}
