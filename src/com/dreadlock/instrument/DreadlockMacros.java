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

import java.util.regex.Pattern;

/**
 * The macro vocabulary of the Dreadlock runtime library. Generated code only ever calls these
 * macros, so their names and argument shapes must not change.
 */
public final class DreadlockMacros {

  /** Prefix shared by every macro; its presence marks a line as instrumented. */
  public static final String PREFIX = "DREADLOCK";

  /** The directive added to every instrumented file. */
  public static final String HEADER_INCLUDE = "#include \"Dreadlock.h\"";

  static final Pattern HEADER_INCLUDE_PATTERN = Pattern.compile("\\s*#include\\s*\"Dreadlock\\.h\"");

  private static final String BOOKKEEPING_COMMENT = "  // aids Dreadlock's bookkeeping ";

  /** The macro families. Each has a plain form and an {@code _ID} form. */
  enum Macro {
    DECLARE(PREFIX),
    DECLARE_DEFERRED(PREFIX + "_DEFER"),
    LOCK(PREFIX + "_LOCK"),
    UNLOCK(PREFIX + "_UNLOCK"),
    DESTRUCT(PREFIX + "_DESTRUCT");

    private final String name;

    Macro(String name) {
      this.name = name;
    }

    /** Returns the invocation statement for {@code record}, including its semicolon. */
    String invoke(LockRecord record) {
      return invoke(record.getMutexExpression(), record.getSyntheticId());
    }

    String invoke(String mutexExpression, String syntheticId) {
      if (syntheticId.isEmpty()) {
        return name + "(" + mutexExpression + ");";
      }
      return name + "_ID(" + mutexExpression + ", " + syntheticId + ");";
    }
  }

  /** Returns the statement that replaces the declaration of {@code record}. */
  static String declaration(LockRecord record) {
    return (record.isDeferred() ? Macro.DECLARE_DEFERRED : Macro.DECLARE).invoke(record);
  }

  static String lock(LockRecord record) {
    return Macro.LOCK.invoke(record);
  }

  static String unlock(LockRecord record) {
    return Macro.UNLOCK.invoke(record);
  }

  static String destruct(LockRecord record) {
    return Macro.DESTRUCT.invoke(record);
  }

  /** Returns the comment that marks a statement the instrumenter synthesized at scope exit. */
  static String bookkeepingComment(int depth) {
    return BOOKKEEPING_COMMENT + depth;
  }

  /** Whether the line calls any Dreadlock macro. */
  static boolean containsMacro(String line) {
    return line.contains(PREFIX);
  }

  static boolean isHeaderInclude(String line) {
    return HEADER_INCLUDE_PATTERN.matcher(line).find();
  }

  private DreadlockMacros() {}
}
