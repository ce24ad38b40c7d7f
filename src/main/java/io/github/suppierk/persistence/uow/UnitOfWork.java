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

package io.github.suppierk.persistence.uow;

import io.github.suppierk.persistence.model.BaseEntity;
import io.github.suppierk.persistence.repository.Repository;
import io.github.suppierk.persistence.repository.SaveState;
import io.github.suppierk.persistence.session.PersistenceSession;
import io.vavr.CheckedFunction0;
import io.vavr.CheckedRunnable;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Transaction boundary over one {@link PersistenceSession}: repositories in {@link
 * SaveState#partOfUnitOfWork()} track changes, the unit of work writes them together.
 */
public interface UnitOfWork extends AutoCloseable {
  /**
   * Flushes the session.
   *
   * @return {@code true} if every pending change was written, failures are logged
   */
  boolean commit();

  /**
   * Discards pending changes: modified and deleted entities become unchanged, added entities stop
   * being tracked. Values of in-memory entities are not reverted and event buffers of aggregates
   * are kept, so the same aggregates can be saved again later.
   */
  void rollback();

  /**
   * Runs the action and commits.
   *
   * @param action to run
   * @param onFailed invoked with the session if the action threw or the commit failed
   * @return {@code true} if both the action and the commit succeeded
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  boolean execute(final CheckedRunnable action, final Consumer<PersistenceSession> onFailed);

  /**
   * Runs the action and commits.
   *
   * @param action to run
   * @param onFailed producing the result if the action threw or the commit failed
   * @param <R> is the type of the result
   * @return result of the action or of {@code onFailed}
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  <R> R executeResult(
      final CheckedFunction0<R> action, final Function<PersistenceSession, R> onFailed);

  /**
   * @return session owned by this unit of work
   */
  PersistenceSession session();

  /**
   * @param entityType of the entity
   * @param <E> is the type of the entity
   * @return repository sharing the session in {@link SaveState#partOfUnitOfWork()}
   */
  <E extends BaseEntity> Repository<E> repository(final Class<E> entityType);

  /** Closes the session. */
  @Override
  void close();
}
