/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.persistence.session;

/** Lifecycle of an entity tracked by a {@link PersistenceSession}. */
public enum EntryState {
  /** Not tracked anymore, nothing is written for it. */
  DETACHED,

  /** Loaded or written, no pending changes. */
  UNCHANGED,

  /** Will be inserted by the next flush. */
  ADDED,

  /** Will be updated by the next flush. */
  MODIFIED,

  /** Will be deleted by the next flush. */
  DELETED;

  /**
   * @return {@code true} if the next flush has to write something for this state
   */
  public boolean isPending() {
    return this == ADDED || this == MODIFIED || this == DELETED;
  }
}
