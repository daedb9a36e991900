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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.auto.value.AutoValue.CopyAnnotations;
import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.Immutable;
import java.util.List;
import java.util.regex.Pattern;

/** The mutex argument of a {@code std::unique_lock} declaration. */
@AutoValue
@CopyAnnotations
@Immutable
public abstract class MutexExpression {

  static final String DEFER_LOCK = "std::defer_lock";

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Splitter ARGUMENT_SPLITTER = Splitter.on(',').trimResults();
  private static final Splitter MEMBER_SPLITTER =
      Splitter.on(Pattern.compile("->|\\.")).trimResults();

  /**
   * Parses the constructor arguments of a lock declaration, such as {@code obj->mtx,
   * std::defer_lock}. The first argument names the mutex.
   *
   * @throws IllegalArgumentException if the mutex is neither an identifier nor a member access
   *     ending in an identifier
   */
  public static MutexExpression parse(String arguments) {
    boolean deferred = arguments.contains(DEFER_LOCK);
    String expression = ARGUMENT_SPLITTER.split(arguments).iterator().next();
    checkArgument(!expression.isEmpty(), "Empty mutex argument in '%s'", arguments);
    return new AutoValue_MutexExpression(expression, syntheticIdOf(expression), deferred);
  }

  /** Whether {@code name} is a C/C++ identifier. */
  public static boolean isIdentifier(String name) {
    return IDENTIFIER.matcher(name).matches();
  }

  private static String syntheticIdOf(String expression) {
    if (isIdentifier(expression)) {
      return "";
    }
    checkArgument(
        expression.contains("->") || expression.contains("."),
        "Cannot find delimiter in mutex name '%s'",
        expression);
    List<String> segments = MEMBER_SPLITTER.splitToList(expression);
    String id = Iterables.getLast(segments);
    checkArgument(isIdentifier(id), "Member '%s' of '%s' is not an identifier", id, expression);
    return id;
  }

  /** Returns the mutex as written, without surrounding whitespace. */
  public abstract String getExpression();

  /** Returns the trailing member name when the expression is a member access, else "". */
  public abstract String getSyntheticId();

  /** Whether the arguments ask for deferred acquisition. */
  public abstract boolean isDeferred();
}
