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

import com.google.auto.value.AutoValue;
import com.google.auto.value.AutoValue.CopyAnnotations;
import com.google.errorprone.annotations.Immutable;

/**
 * A scope boundary on one line. A scope that opens and closes on the same line is a single
 * paired event; a scope spanning lines produces an open event on its first line and a close event
 * on its last.
 */
@AutoValue
@CopyAnnotations
@Immutable
public abstract class ScopeEvent {

  /** Column value for the side of the event that is not on this line. */
  public static final int ABSENT = -1;

  public static ScopeEvent open(int column) {
    return create(column, ABSENT);
  }

  public static ScopeEvent close(int column) {
    return create(ABSENT, column);
  }

  public static ScopeEvent sameLine(int openColumn, int closeColumn) {
    return create(openColumn, closeColumn);
  }

  private static ScopeEvent create(int openColumn, int closeColumn) {
    checkArgument(openColumn >= 0 || closeColumn >= 0, "Event without any column");
    return new AutoValue_ScopeEvent(openColumn, closeColumn);
  }

  /** Returns the column of the opening brace, or {@link #ABSENT}. */
  public abstract int getOpenColumn();

  /** Returns the column of the closing brace, or {@link #ABSENT}. */
  public abstract int getCloseColumn();

  public boolean isSameLine() {
    return getOpenColumn() != ABSENT && getCloseColumn() != ABSENT;
  }

  public boolean isOpen() {
    return getOpenColumn() != ABSENT && getCloseColumn() == ABSENT;
  }

  public boolean isClose() {
    return getOpenColumn() == ABSENT && getCloseColumn() != ABSENT;
  }

  @Override
  public final String toString() {
    return "(" + getOpenColumn() + ", " + getCloseColumn() + ")";
  }
}
