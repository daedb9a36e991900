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

import com.google.common.base.MoreObjects;

/**
 * What is known about one lock variable in one scope: the mutex it wraps, whether it currently
 * holds that mutex, and whether this scope owns the declaration.
 *
 * <p>Entering a nested scope copies every record of the enclosing scope with {@link #isInherited()}
 * set, so changes made inside the nested scope never reach the enclosing one. Only the scope that
 * owns a record emits its cleanup.
 */
public final class LockRecord {
  private final String mutexExpression;
  private final String syntheticId;
  private final boolean deferred;
  private final boolean inherited;
  private final boolean excluded;
  private boolean locked;

  LockRecord(MutexExpression mutex, boolean excluded) {
    this(
        mutex.getExpression(),
        mutex.getSyntheticId(),
        mutex.isDeferred(),
        !mutex.isDeferred(),
        /* inherited= */ false,
        excluded);
  }

  private LockRecord(
      String mutexExpression,
      String syntheticId,
      boolean deferred,
      boolean locked,
      boolean inherited,
      boolean excluded) {
    this.mutexExpression = checkNotNull(mutexExpression);
    this.syntheticId = checkNotNull(syntheticId);
    this.deferred = deferred;
    this.locked = locked;
    this.inherited = inherited;
    this.excluded = excluded;
  }

  /** Returns an independent copy for a nested scope. */
  LockRecord inheritedCopy() {
    return new LockRecord(mutexExpression, syntheticId, deferred, locked, true, excluded);
  }

  /** Returns the expression naming the wrapped mutex, such as {@code m} or {@code obj->m}. */
  public String getMutexExpression() {
    return mutexExpression;
  }

  /**
   * Returns the member name used to tell the mutex apart when its expression is not a plain
   * identifier, or the empty string.
   */
  public String getSyntheticId() {
    return syntheticId;
  }

  public boolean hasSyntheticId() {
    return !syntheticId.isEmpty();
  }

  /** Whether the lock was constructed without acquiring the mutex. */
  public boolean isDeferred() {
    return deferred;
  }

  /** Whether the mutex is known to be held at the current point of the scan. */
  public boolean isLocked() {
    return locked;
  }

  void setLocked(boolean locked) {
    this.locked = locked;
  }

  /** Whether the record was copied from an enclosing scope. */
  public boolean isInherited() {
    return inherited;
  }

  /** Whether the lock is left alone: its mutex is excluded or the line was already instrumented. */
  public boolean isExcluded() {
    return excluded;
  }

  /** Whether leaving this record's scope must emit cleanup statements. */
  boolean needsCleanup() {
    return !inherited && !excluded;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("mutex", mutexExpression)
        .add("id", syntheticId)
        .add("locked", locked)
        .add("deferred", deferred)
        .add("inherited", inherited)
        .add("excluded", excluded)
        .toString();
  }
}
