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

import io.github.suppierk.persistence.PersistenceException;
import io.github.suppierk.persistence.Suspicious;
import io.github.suppierk.persistence.model.BaseEntity;
import io.github.suppierk.persistence.model.EntityId;
import io.github.suppierk.persistence.session.EntityQuery;
import io.github.suppierk.persistence.session.PersistenceSession;
import io.github.suppierk.persistence.specification.Specification;
import io.github.suppierk.persistence.specification.SpecificationEvaluator;
import io.vavr.CheckedFunction0;
import io.vavr.control.Try;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import org.jooq.Condition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Repository} implementation working on top of any {@link PersistenceSession}.
 *
 * <p>The usage of {@link Try} will "hide" exceptions raised by the session - but not get rid of
 * them: each one is logged along with its stacktrace before it is converted to the result.
 *
 * @param <E> is the type of the entity
 */
public class GenericRepository<E extends BaseEntity> extends Suspicious implements Repository<E> {
  private static final Logger LOGGER = LoggerFactory.getLogger(GenericRepository.class);

  private final Class<E> entityType;
  private final PersistenceSession session;
  private final SaveState state;

  /**
   * Creates a repository which saves every mutation immediately.
   *
   * @param entityType of the entity
   * @param session to work with
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public GenericRepository(final Class<E> entityType, final PersistenceSession session) {
    this(entityType, session, SaveState.localSave());
  }

  /**
   * @param entityType of the entity
   * @param session to work with
   * @param state to save mutations with
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public GenericRepository(
      final Class<E> entityType, final PersistenceSession session, final SaveState state) {
    this.entityType = throwIllegalArgumentIfNull(entityType, "Entity type");
    this.session = throwIllegalArgumentIfNull(session, "Persistence session");
    this.state = throwIllegalArgumentIfNull(state, "Save state");
  }

  @Override
  public boolean insert(final E entity) {
    final E nonNullEntity = throwIllegalArgumentIfNull(entity, "Entity");

    return attempt(
        "insert",
        () -> {
          session.add(nonNullEntity);
          return state.save(session);
        });
  }

  @Override
  public boolean insert(final Collection<E> entities) {
    final Collection<E> nonNullEntities = nonNullElements(entities);

    return attempt(
        "insert",
        () -> {
          nonNullEntities.forEach(session::add);
          return state.save(session);
        });
  }

  @Override
  public boolean update(final E entity) {
    final E nonNullEntity = throwIllegalArgumentIfNull(entity, "Entity");

    return attempt(
        "update",
        () -> {
          session.update(nonNullEntity);
          return state.save(session);
        });
  }

  @Override
  public boolean update(final Collection<E> entities) {
    final Collection<E> nonNullEntities = nonNullElements(entities);

    return attempt(
        "update",
        () -> {
          nonNullEntities.forEach(session::update);
          return state.save(session);
        });
  }

  @Override
  public boolean delete(final EntityId id) {
    final EntityId nonNullId = throwIllegalArgumentIfNull(id, "Entity ID");

    return attempt(
        "delete",
        () -> {
          session.find(entityType, nonNullId).ifPresent(session::remove);
          return state.save(session);
        });
  }

  @Override
  public boolean delete(final E entity) {
    final E nonNullEntity = throwIllegalArgumentIfNull(entity, "Entity");

    return attempt(
        "delete",
        () -> {
          session.remove(nonNullEntity);
          return state.save(session);
        });
  }

  @Override
  public boolean delete(final Collection<E> entities) {
    final Collection<E> nonNullEntities = nonNullElements(entities);

    return attempt(
        "delete",
        () -> {
          nonNullEntities.forEach(session::remove);
          return state.save(session);
        });
  }

  @Override
  public boolean delete(final Condition condition) {
    final Condition nonNullCondition = throwIllegalArgumentIfNull(condition, "Condition");

    return attempt(
        "delete",
        () -> {
          session.query(entityType).where(nonNullCondition).fetch().forEach(session::remove);
          return state.save(session);
        });
  }

  @Override
  public boolean save() {
    return attempt("save", () -> state.save(session));
  }

  @Override
  public SaveState state() {
    return state;
  }

  @Override
  public Repository<E> withState(final SaveState state) {
    return new GenericRepository<>(entityType, session, state);
  }

  @Override
  public <R> R insertIfNotExists(
      final Condition exists,
      final Supplier<R> onExists,
      final Supplier<E> create,
      final Function<Optional<E>, R> onFinal) {
    final Condition nonNullExists = throwIllegalArgumentIfNull(exists, "Existence condition");
    final Supplier<R> nonNullOnExists = throwIllegalArgumentIfNull(onExists, "On exists");
    final Supplier<E> nonNullCreate = throwIllegalArgumentIfNull(create, "Create");
    final Function<Optional<E>, R> nonNullOnFinal = throwIllegalArgumentIfNull(onFinal, "On final");

    final Optional<E> existing =
        lookup(() -> session.query(entityType).where(nonNullExists).fetchFirst());

    if (existing.isPresent()) {
      return nonNullOnExists.get();
    }

    final E created = throwIllegalStateIfNull(nonNullCreate.get(), "Created entity");

    return nonNullOnFinal.apply(insert(created) ? Optional.of(created) : Optional.empty());
  }

  @Override
  public <R> R updateOrNotFound(
      final EntityId id,
      final Supplier<R> onNotFound,
      final Function<Optional<E>, R> onFinal,
      final UnaryOperator<E> update) {
    final EntityId nonNullId = throwIllegalArgumentIfNull(id, "Entity ID");
    final Supplier<R> nonNullOnNotFound = throwIllegalArgumentIfNull(onNotFound, "On not found");
    final Function<Optional<E>, R> nonNullOnFinal = throwIllegalArgumentIfNull(onFinal, "On final");
    final UnaryOperator<E> nonNullUpdate = throwIllegalArgumentIfNull(update, "Update");

    final Optional<E> existing = lookup(() -> session.find(entityType, nonNullId));

    if (existing.isEmpty()) {
      return nonNullOnNotFound.get();
    }

    final E updated =
        throwIllegalStateIfNull(nonNullUpdate.apply(existing.get()), "Updated entity");

    return nonNullOnFinal.apply(update(updated) ? Optional.of(updated) : Optional.empty());
  }

  @Override
  public Optional<E> findById(final EntityId id) {
    final EntityId nonNullId = throwIllegalArgumentIfNull(id, "Entity ID");

    return Try.of(() -> session.find(entityType, nonNullId))
        .onFailure(e -> logFailure("find", e))
        .getOrElse(Optional.empty());
  }

  @Override
  public List<E> list(final Specification<E> specification) {
    final Specification<E> nonNullSpecification =
        throwIllegalArgumentIfNull(specification, "Specification");

    return Try.of(() -> SpecificationEvaluator.evaluate(query(), nonNullSpecification).fetch())
        .onFailure(e -> logFailure("list", e))
        .getOrElse(List.of());
  }

  @Override
  public Optional<E> first(final Specification<E> specification) {
    final Specification<E> nonNullSpecification =
        throwIllegalArgumentIfNull(specification, "Specification");

    return Try.of(
            () -> SpecificationEvaluator.evaluate(query(), nonNullSpecification).fetchFirst())
        .onFailure(e -> logFailure("find first", e))
        .getOrElse(Optional.empty());
  }

  @Override
  public int count(final Specification<E> specification) {
    final Specification<E> nonNullSpecification =
        throwIllegalArgumentIfNull(specification, "Specification");

    return Try.of(() -> SpecificationEvaluator.evaluate(query(), nonNullSpecification).count())
        .onFailure(e -> logFailure("count", e))
        .getOrElse(0);
  }

  @Override
  public EntityQuery<E> query() {
    return session.query(entityType);
  }

  private boolean attempt(final String operation, final CheckedFunction0<Boolean> action) {
    return Try.of(action).onFailure(e -> logFailure(operation, e)).getOrElse(false);
  }

  private <T> T lookup(final CheckedFunction0<T> lookup) {
    return Try.of(lookup)
        .onFailure(e -> logFailure("look up", e))
        .getOrElseThrow(
            e -> e instanceof RuntimeException runtime ? runtime : new PersistenceException(e));
  }

  private Collection<E> nonNullElements(final Collection<E> entities) {
    final Collection<E> nonNullEntities = throwIllegalArgumentIfNull(entities, "Entities");

    for (E entity : nonNullEntities) {
      throwIllegalArgumentIfNull(entity, "Entity");
    }

    return nonNullEntities;
  }

  private void logFailure(final String operation, final Throwable e) {
    LOGGER.error("Unable to {} {}", operation, entityType.getSimpleName(), e);
  }
}
