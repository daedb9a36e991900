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

/**
 * Character classifier for C/C++ text. Tracks whether the scan is inside a string or character
 * literal, a line comment or a block comment, and whether a backslash escape is still pending.
 *
 * <p>The state is updated one character at a time: {@link #accept} classifies the character, the
 * caller inspects the state, then {@link #advance} retires the character. An escape stays pending
 * for exactly two character positions, so that {@code "\\"} closes its string on the quote
 * while {@code "\\\""} does not.
 */
final class LexicalState {

  private static final int ESCAPE_SPAN = 2;

  private boolean inString = false;
  private char stringDelimiter = 0;
  private boolean inLineComment = false;
  private boolean inBlockComment = false;
  private int escapeCountdown = 0;
  private char lastChar = 0;

  /** Applies the classification rules for {@code c}, in precedence order. */
  void accept(char c) {
    switch (c) {
      case '\n':
        inLineComment = false;
        break;
      case '\\':
        if (inString) {
          // A backslash that is itself escaped does not escape the next character.
          escapeCountdown = escapeCountdown == 0 ? ESCAPE_SPAN : 0;
        }
        break;
      case '/':
        if (lastChar == '/') {
          if (!inComment() && !inString && escapeCountdown == 0) {
            inLineComment = true;
          }
        } else if (lastChar == '*') {
          if (inBlockComment && !inString) {
            inBlockComment = false;
          }
        }
        break;
      case '*':
        if (lastChar == '/' && !inComment() && !inString) {
          inBlockComment = true;
        }
        break;
      case '"':
      case '\'':
        if (!inComment() && escapeCountdown == 0) {
          if (inString) {
            if (stringDelimiter == c) {
              inString = false;
            }
          } else {
            stringDelimiter = c;
            inString = true;
          }
        }
        break;
      default:
        break;
    }
  }

  /** Retires {@code c}: counts down a pending escape and remembers the character. */
  void advance(char c) {
    if (c != '\n' && escapeCountdown != 0) {
      escapeCountdown--;
    }
    lastChar = c;
  }

  /** Whether a brace at the current character opens or closes a scope. */
  boolean isStructural() {
    return isCode() && escapeCountdown == 0;
  }

  /** Whether the current character lies outside every literal and comment. */
  boolean isCode() {
    return !inString && !inComment();
  }

  boolean inString() {
    return inString;
  }

  boolean inLineComment() {
    return inLineComment;
  }

  boolean inBlockComment() {
    return inBlockComment;
  }

  boolean escapePending() {
    return escapeCountdown != 0;
  }

  private boolean inComment() {
    return inLineComment || inBlockComment;
  }
}
