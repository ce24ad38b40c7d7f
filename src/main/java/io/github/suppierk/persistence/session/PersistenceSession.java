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

import io.github.suppierk.persistence.model.BaseEntity;
import io.github.suppierk.persistence.model.EntityId;
import java.util.List;
import java.util.Optional;

/**
 * Storage backend contract: a change-tracking session which writes every pending change in one
 * transaction on {@link #flush()}.
 *
 * <p>Sessions are request-scoped and must not be shared across threads. A session operation
 * invoked on an interrupted thread fails with {@link
 * io.github.suppierk.persistence.PersistenceException} and leaves the interrupt flag set.
 */
public interface PersistenceSession extends AutoCloseable {
  /**
   * Starts tracking the entity as {@link EntryState#ADDED}, assigning a new ID if it has none.
   *
   * @param entity to insert on the next flush
   * @param <E> is the type of the entity
   */
  <E extends BaseEntity> void add(final E entity);

  /**
   * Marks the entity as {@link EntryState#MODIFIED}, entities which are not inserted yet stay
   * {@link EntryState#ADDED}.
   *
   * @param entity to update on the next flush
   * @param <E> is the type of the entity
   */
  <E extends BaseEntity> void update(final E entity);

  /**
   * Marks the entity as {@link EntryState#DELETED}, entities which are not inserted yet stop being
   * tracked.
   *
   * @param entity to delete on the next flush
   * @param <E> is the type of the entity
   */
  <E extends BaseEntity> void remove(final E entity);

  /**
   * Looks up the identity map first, then the database.
   *
   * @param type of the entity
   * @param id of the entity
   * @param <E> is the type of the entity
   * @return entity if it exists and is not pending deletion
   */
  <E extends BaseEntity> Optional<E> find(final Class<E> type, final EntityId id);

  /**
   * @param type of the entity
   * @param <E> is the type of the entity
   * @return a new query over all rows of the type
   */
  <E extends BaseEntity> EntityQuery<E> query(final Class<E> type);

  /**
   * Writes pending changes in one transaction and runs the domain event save pipeline.
   *
   * @return number of rows affected
   * @throws io.github.suppierk.persistence.PersistenceException if the write failed, pending
   *     changes and event buffers are left as they were
   * @throws io.github.suppierk.persistence.event.DomainEventDispatchException if a handler failed
   *     after the changes were committed
   */
  int flush();

  /**
   * @return tracked entries in tracking order
   */
  List<TrackedEntry> entries();

  /**
   * @return {@code true} until the session is closed
   */
  boolean isOpen();

  /** Stops tracking everything, closing the session twice is permitted. */
  @Override
  void close();
}
