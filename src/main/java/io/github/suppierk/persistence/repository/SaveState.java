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

package io.github.suppierk.persistence.repository;

import io.github.suppierk.persistence.session.PersistenceSession;

/**
 * Decides what a repository mutation does once the change is tracked by the session.
 *
 * <ul>
 *   <li>{@link LocalSave} flushes the session immediately.
 *   <li>{@link PartOfUnitOfWork} leaves the flush to the enclosing unit of work.
 * </ul>
 */
public sealed interface SaveState permits SaveState.LocalSave, SaveState.PartOfUnitOfWork {
  /**
   * @return state which flushes after every mutation
   */
  static SaveState localSave() {
    return LocalSave.INSTANCE;
  }

  /**
   * @return state which defers the flush to the unit of work
   */
  static SaveState partOfUnitOfWork() {
    return PartOfUnitOfWork.INSTANCE;
  }

  /**
   * @param session tracking the change
   * @return {@code true} if the change is considered saved
   */
  boolean save(final PersistenceSession session);

  /** Flushes and reports whether any row was affected. */
  final class LocalSave implements SaveState {
    private static final SaveState INSTANCE = new LocalSave();

    private LocalSave() {
      // Cannot be instantiated from the outside
    }

    @Override
    public boolean save(final PersistenceSession session) {
      return session.flush() > 0;
    }

    @Override
    public String toString() {
      return "LocalSave";
    }
  }

  /** Does nothing, the change is written by the unit of work commit. */
  final class PartOfUnitOfWork implements SaveState {
    private static final SaveState INSTANCE = new PartOfUnitOfWork();

    private PartOfUnitOfWork() {
      // Cannot be instantiated from the outside
    }

    @Override
    public boolean save(final PersistenceSession session) {
      return true;
    }

    @Override
    public String toString() {
      return "PartOfUnitOfWork";
    }
  }
}
