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

/** Collects the diagnostics of a run and reports them at the end. */
public interface ErrorManager {

  /** Records a diagnostic at the given level. Diagnostics at {@link CheckLevel#OFF} are dropped. */
  void report(CheckLevel level, DreadlockError error);

  /** Writes every recorded diagnostic followed by a summary. */
  void generateReport();

  int getErrorCount();

  int getWarningCount();
}
