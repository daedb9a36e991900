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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds the brace scope tree of a C/C++ file in a single left-to-right pass over its characters.
 * Braces inside string and character literals and inside comments do not count.
 *
 * <p>Scopes still open at the end of the text are dropped, and closing braces without an open
 * scope are ignored, so malformed input yields an incomplete tree rather than an error.
 */
public final class ScopeScanner {

  private static final Logger logger = Logger.getLogger(ScopeScanner.class.getName());

  /** Scans {@code text} and returns its lines, scope tree and per-line scope events. */
  public ScopeMap scan(String text) {
    LexicalState state = new LexicalState();
    Deque<OpenScope> stack = new ArrayDeque<>();
    ImmutableList.Builder<Scope> topLevel = ImmutableList.builder();

    ImmutableList.Builder<String> lines = ImmutableList.builder();
    List<BitSet> codePositions = new ArrayList<>();
    StringBuilder line = new StringBuilder();
    BitSet code = new BitSet();
    int lineNumber = 0;
    int column = 0;

    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      state.accept(c);
      if (c == '\n') {
        lines.add(line.toString());
        codePositions.add(code);
        line.setLength(0);
        code = new BitSet();
        lineNumber++;
        column = 0;
      } else {
        if (c == '{' && state.isStructural()) {
          stack.push(new OpenScope(Position.create(lineNumber, column)));
        } else if (c == '}' && state.isStructural() && !stack.isEmpty()) {
          Scope closed = stack.pop().close(Position.create(lineNumber, column));
          if (stack.isEmpty()) {
            topLevel.add(closed);
          } else {
            stack.peek().children.add(closed);
          }
        }
        if (state.isCode()) {
          code.set(column);
        }
        line.append(c);
        column++;
      }
      state.advance(c);
    }
    if (line.length() > 0) {
      lines.add(line.toString());
      codePositions.add(code);
    }
    if (!stack.isEmpty()) {
      logger.fine(stack.size() + " scope(s) left open at end of input were discarded");
    }
    return new ScopeMap(lines.build(), topLevel.build(), codePositions);
  }

  private static final class OpenScope {
    final Position start;
    final List<Scope> children = new ArrayList<>();

    OpenScope(Position start) {
      this.start = start;
    }

    Scope close(Position end) {
      return Scope.create(start, end, ImmutableList.copyOf(children));
    }
  }
}
