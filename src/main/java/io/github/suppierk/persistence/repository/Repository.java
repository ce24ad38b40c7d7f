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

import io.github.suppierk.persistence.model.BaseEntity;
import io.github.suppierk.persistence.model.EntityId;
import io.github.suppierk.persistence.session.EntityQuery;
import io.github.suppierk.persistence.specification.Specification;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.jooq.Condition;

/**
 * Create, update, delete and query surface for one entity type.
 *
 * <p>Mutations track the change in the session and then delegate to the current {@link SaveState}.
 * Backend failures never escape: they are logged and reported as {@code false}, empty results or
 * zero. {@code null} arguments are rejected with {@link IllegalArgumentException}.
 *
 * <p>A repository never owns the session it works with: it does not close, commit or roll it back.
 *
 * @param <E> is the type of the entity
 */
public interface Repository<E extends BaseEntity> {
  boolean insert(final E entity);

  boolean insert(final Collection<E> entities);

  boolean update(final E entity);

  boolean update(final Collection<E> entities);

  /**
   * Finds the entity and removes it if it exists, then saves.
   *
   * @param id of the entity
   * @return save result, with {@link SaveState#localSave()} {@code false} if nothing was found
   */
  boolean delete(final EntityId id);

  boolean delete(final E entity);

  boolean delete(final Collection<E> entities);

  /**
   * @param condition selecting entities to remove
   * @return save result
   */
  boolean delete(final Condition condition);

  /**
   * @return result of the current {@link SaveState}
   */
  boolean save();

  /**
   * @return current save state
   */
  SaveState state();

  /**
   * @param state to use
   * @return a repository sharing the same session with the requested state
   */
  Repository<E> withState(final SaveState state);

  /**
   * Inserts a new entity unless one matching the condition exists, at most one insert is
   * attempted.
   *
   * @param exists condition looking up the existing entity
   * @param onExists result to return if an entity exists
   * @param create supplying the entity to insert
   * @param onFinal receiving the inserted entity or empty if the insert failed
   * @param <R> is the type of the result
   * @return result of {@code onExists} or {@code onFinal}
   * @throws RuntimeException raised while looking up the existing entity
   * @throws IllegalStateException if {@code create} supplied {@code null}
   */
  <R> R insertIfNotExists(
      final Condition exists,
      final Supplier<R> onExists,
      final Supplier<E> create,
      final Function<Optional<E>, R> onFinal);

  /**
   * Updates the entity if it exists.
   *
   * @param id of the entity
   * @param onNotFound result to return if there is no such entity
   * @param onFinal receiving the updated entity or empty if the update failed
   * @param update applied to the found entity
   * @param <R> is the type of the result
   * @return result of {@code onNotFound} or {@code onFinal}
   * @throws RuntimeException raised while looking up the entity
   * @throws IllegalStateException if {@code update} returned {@code null}
   */
  <R> R updateOrNotFound(
      final EntityId id,
      final Supplier<R> onNotFound,
      final Function<Optional<E>, R> onFinal,
      final UnaryOperator<E> update);

  Optional<E> findById(final EntityId id);

  List<E> list(final Specification<E> specification);

  Optional<E> first(final Specification<E> specification);

  int count(final Specification<E> specification);

  /**
   * @return query over all entities of this type, failures are not intercepted
   */
  EntityQuery<E> query();
}
