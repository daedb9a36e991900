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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;

/**
 * A brace-delimited nesting level of the source text, from its opening {@code '{'} to the
 * matching {@code '}'}.
 */
@AutoValue
@CopyAnnotations
@Immutable
public abstract class Scope {

  static Scope create(Position start, Position end, ImmutableList<Scope> children) {
    return new AutoValue_Scope(start, end, children);
  }

  /** Returns the position of the opening brace. */
  public abstract Position getStart();

  /** Returns the position of the closing brace. */
  public abstract Position getEnd();

  /** Returns the scopes nested directly inside this one, in source order. */
  public abstract ImmutableList<Scope> getChildren();

  /** Whether the opening and closing braces sit on the same line. */
  public boolean isSameLine() {
    return getStart().getLine() == getEnd().getLine();
  }
}
