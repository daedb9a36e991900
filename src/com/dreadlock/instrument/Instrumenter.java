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

import com.dreadlock.scan.ScopeEvent;
import com.dreadlock.scan.ScopeMap;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites {@code std::unique_lock} usage into Dreadlock macro calls, one line at a time, in
 * lockstep with the scope events of the file.
 *
 * <p>Declarations, {@code lock()} and {@code unlock()} calls on tracked lock variables are
 * replaced by the matching macro. When a scope closes, every lock the scope declared gets a
 * synthetic {@code DREADLOCK_UNLOCK} (if still held) and a {@code DREADLOCK_DESTRUCT}; if the last
 * emitted line returns, the synthetic statements go before it.
 *
 * <p>Only code positions are considered: text inside comments and literals is never rewritten.
 * Statements spanning several lines are not recognized.
 */
public final class Instrumenter {

  private static final Logger logger = Logger.getLogger(Instrumenter.class.getName());

  private static final Pattern DECLARATION =
      Pattern.compile("std::unique_lock\\s*<.+?>\\s+(\\w+)\\s*\\((.+?)\\)\\s*;");
  private static final Pattern LOCK_CALL = Pattern.compile("\\b(\\w+)\\s*\\.\\s*lock\\s*\\(\\s*\\)");
  private static final Pattern UNLOCK_CALL =
      Pattern.compile("\\b(\\w+)\\s*\\.\\s*unlock\\s*\\(\\s*\\)");
  private static final Pattern LOCAL_INCLUDE = Pattern.compile("\\s*#include\\s*\"");
  private static final Pattern SYSTEM_INCLUDE = Pattern.compile("\\s*#include\\s*<");
  private static final Pattern RETURN = Pattern.compile("\\breturn\\b");

  private final InstrumentOptions options;

  public Instrumenter(InstrumentOptions options) {
    this.options = checkNotNull(options);
  }

  /**
   * Instruments the scanned file.
   *
   * @param sourceName name of the file, for diagnostics
   * @throws MalformedMutexException if a declaration names a mutex that cannot be instrumented
   */
  public InstrumentResult instrument(String sourceName, ScopeMap map) {
    return new Pass(sourceName, map).run();
  }

  /** State of one instrumentation pass over one file. */
  private final class Pass {
    private final String sourceName;
    private final ScopeMap map;
    private final LockStateTracker tracker = new LockStateTracker();
    private final List<String> output = new ArrayList<>();

    private int lastLocalInclude = -1;
    private int lastSystemInclude = -1;
    private boolean changed = false;
    private int rewrittenSites = 0;
    private int syntheticStatements = 0;

    Pass(String sourceName, ScopeMap map) {
      this.sourceName = sourceName;
      this.map = map;
    }

    InstrumentResult run() {
      ImmutableList<String> lines = map.getLines();
      for (int i = 0; i < lines.size(); i++) {
        String line = lines.get(i);
        for (ScopeEvent event : map.eventsOn(i)) {
          applyScopeEvent(event);
        }
        trackIncludes(i, line);
        if (!map.hasEvents(i)) {
          tracker.observeIndent(line);
        }
        output.add(rewrite(i, line));
      }
      if (changed) {
        insertHeader();
      }
      return InstrumentResult.create(
          ImmutableList.copyOf(output), changed, rewrittenSites, syntheticStatements);
    }

    private void applyScopeEvent(ScopeEvent event) {
      if (event.isOpen()) {
        tracker.enterScope();
      } else if (event.isClose()) {
        emitCleanup();
      }
      // Scopes that open and close on one line are not tracked.
    }

    private void emitCleanup() {
      int depth = tracker.depth();
      String indent = Strings.repeat(options.getIndent(), depth);
      if (options.isAlign() && !tracker.observedIndent().isEmpty()) {
        indent = tracker.observedIndent();
      }
      String comment = DreadlockMacros.bookkeepingComment(depth);
      for (LockRecord record : tracker.exitScope()) {
        if (record.isLocked()) {
          emitSynthetic(indent + DreadlockMacros.unlock(record) + comment);
        }
        emitSynthetic(indent + DreadlockMacros.destruct(record) + comment);
        changed = true;
      }
    }

    /** Appends a synthetic statement, or puts it before the last line if that line returns. */
    private void emitSynthetic(String statement) {
      int last = output.size() - 1;
      if (last >= 0 && RETURN.matcher(output.get(last)).find()) {
        output.add(last, statement);
      } else {
        output.add(statement);
      }
      syntheticStatements++;
      logger.fine(sourceName + ": added " + statement.trim());
    }

    private void trackIncludes(int lineIndex, String line) {
      if (findInCode(LOCAL_INCLUDE.matcher(line), lineIndex)) {
        lastLocalInclude = output.size();
      }
      if (findInCode(SYSTEM_INCLUDE.matcher(line), lineIndex)) {
        lastSystemInclude = output.size();
      }
    }

    private String rewrite(int lineIndex, String line) {
      Matcher declaration = DECLARATION.matcher(line);
      if (findInCode(declaration, lineIndex)) {
        MutexExpression mutex = parseMutex(lineIndex, declaration.group(2));
        if (!tracker.inScope()) {
          logger.fine(sourceName + ":" + (lineIndex + 1) + ": lock declared at file scope");
          return line;
        }
        return rewriteDeclaration(lineIndex, line, declaration, mutex);
      }
      if (!tracker.inScope()) {
        return line;
      }
      Matcher lock = LOCK_CALL.matcher(line);
      if (findInCode(lock, lineIndex)) {
        return rewriteCall(line, lock, true);
      }
      Matcher unlock = UNLOCK_CALL.matcher(line);
      if (findInCode(unlock, lineIndex)) {
        return rewriteCall(line, unlock, false);
      }
      return line;
    }

    /** Parses the mutex of a declaration; a malformed one stops the pass. */
    private MutexExpression parseMutex(int lineIndex, String arguments) {
      try {
        return MutexExpression.parse(arguments);
      } catch (IllegalArgumentException e) {
        throw new MalformedMutexException(sourceName, lineIndex + 1, arguments, e);
      }
    }

    private String rewriteDeclaration(
        int lineIndex, String line, Matcher declaration, MutexExpression mutex) {
      String lockName = declaration.group(1);
      boolean excluded =
          DreadlockMacros.containsMacro(line) || options.isExcludedMutex(mutex.getExpression());
      LockRecord record = new LockRecord(mutex, excluded);
      tracker.declare(lockName, record);
      if (excluded) {
        logger.fine(sourceName + ":" + (lineIndex + 1) + ": skipping excluded lock " + lockName);
        return line;
      }
      return replaceTail(line, declaration.start(), DreadlockMacros.declaration(record));
    }

    private String rewriteCall(String line, Matcher call, boolean locking) {
      LockRecord record = tracker.lookup(call.group(1));
      if (record == null || record.isExcluded()) {
        return line;
      }
      record.setLocked(locking);
      String statement =
          locking ? DreadlockMacros.lock(record) : DreadlockMacros.unlock(record);
      return replaceTail(line, call.start(1), statement);
    }

    /** Replaces {@code line} from {@code start} on with {@code statement} and a revert marker. */
    private String replaceTail(String line, int start, String statement) {
      changed = true;
      rewrittenSites++;
      logger.fine(sourceName + ": " + line.trim() + " -> " + statement);
      String marker = options.isDisableRevert() ? "" : RevertMarker.format(line);
      return line.substring(0, start) + statement + marker;
    }

    /** Finds the first match of {@code matcher} that starts at a code position. */
    private boolean findInCode(Matcher matcher, int lineIndex) {
      int from = 0;
      while (from < matcher.regionEnd() && matcher.find(from)) {
        if (map.isCode(lineIndex, matcher.start())) {
          return true;
        }
        from = matcher.start() + 1;
      }
      return false;
    }

    private void insertHeader() {
      int index = 0;
      if (lastLocalInclude != -1) {
        index = lastLocalInclude + 1;
      } else if (lastSystemInclude != -1) {
        index = lastSystemInclude + 1;
      }
      output.add(index, DreadlockMacros.HEADER_INCLUDE);
    }
  }
}
