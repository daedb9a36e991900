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

import com.google.auto.value.AutoValue;
import com.google.auto.value.AutoValue.CopyAnnotations;
import com.google.errorprone.annotations.Immutable;
import java.util.Comparator;

/** A zero-based line and column within a source file. */
@AutoValue
@CopyAnnotations
@Immutable
public abstract class Position implements Comparable<Position> {

  public static Position create(int line, int column) {
    return new AutoValue_Position(line, column);
  }

  /** Returns the zero-based line index. */
  public abstract int getLine();

  /** Returns the zero-based column, counted in characters of the line without its newline. */
  public abstract int getColumn();

  @Override
  public final int compareTo(Position other) {
    return SOURCE_ORDER.compare(this, other);
  }

  @Override
  public final String toString() {
    return getLine() + ":" + getColumn();
  }

  private static final Comparator<Position> SOURCE_ORDER =
      Comparator.comparingInt(Position::getLine).thenComparingInt(Position::getColumn);
}
