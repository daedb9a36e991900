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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Follows lock variables through the brace scopes of a file. Holds one symbol table per open
 * scope; the stack is as deep as the current brace nesting.
 *
 * <p>Entering a scope pushes a copy of the enclosing table in which every record is marked
 * inherited. Leaving a scope pops exactly one table and hands back the records the scope owns.
 */
final class LockStateTracker {

  private final Deque<Map<String, LockRecord>> tables = new ArrayDeque<>();

  /** Indent of the first plain line seen at each depth; index 0 is file scope. */
  private final List<String> indents = new ArrayList<>();

  LockStateTracker() {
    indents.add("");
  }

  /** Returns the current brace nesting depth. */
  int depth() {
    return tables.size();
  }

  /** Whether a symbol table is live, that is whether the scan is inside some scope. */
  boolean inScope() {
    return !tables.isEmpty();
  }

  void enterScope() {
    Map<String, LockRecord> table = new LinkedHashMap<>();
    Map<String, LockRecord> enclosing = tables.peek();
    if (enclosing != null) {
      for (Map.Entry<String, LockRecord> entry : enclosing.entrySet()) {
        table.put(entry.getKey(), entry.getValue().inheritedCopy());
      }
    }
    tables.push(table);
    indents.add("");
  }

  /**
   * Leaves the current scope and returns the records that need cleanup: those declared in this
   * scope and not excluded, in declaration order.
   */
  ImmutableList<LockRecord> exitScope() {
    checkState(inScope(), "No scope to exit");
    Map<String, LockRecord> table = tables.pop();
    indents.remove(indents.size() - 1);
    ImmutableList.Builder<LockRecord> owned = ImmutableList.builder();
    for (LockRecord record : table.values()) {
      if (record.needsCleanup()) {
        owned.add(record);
      }
    }
    return owned.build();
  }

  /** Registers {@code record} under {@code name}, shadowing any inherited record of that name. */
  void declare(String name, LockRecord record) {
    checkState(inScope(), "Lock '%s' declared outside any scope", name);
    tables.peek().put(checkNotNull(name), checkNotNull(record));
  }

  /** Returns the record visible under {@code name} in the current scope, or null. */
  @Nullable LockRecord lookup(String name) {
    Map<String, LockRecord> table = tables.peek();
    return table == null ? null : table.get(name);
  }

  /** Remembers the leading whitespace of {@code line} if none was recorded for this depth yet. */
  void observeIndent(String line) {
    int depth = depth();
    if (line.isEmpty() || !indents.get(depth).isEmpty()) {
      return;
    }
    int end = CharMatcher.whitespace().negate().indexIn(line);
    indents.set(depth, end < 0 ? line : line.substring(0, end));
  }

  /** Returns the indent recorded for the current depth, possibly empty. */
  String observedIndent() {
    return indents.get(depth());
  }
}
