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

package io.github.suppierk.persistence.jooq;

import io.github.suppierk.persistence.PersistenceException;
import io.github.suppierk.persistence.Suspicious;
import io.github.suppierk.persistence.event.DomainEventPipeline;
import io.github.suppierk.persistence.model.BaseEntity;
import io.github.suppierk.persistence.model.EntityId;
import io.github.suppierk.persistence.session.ChangeTracker;
import io.github.suppierk.persistence.session.EntityQuery;
import io.github.suppierk.persistence.session.EntryState;
import io.github.suppierk.persistence.session.PersistenceSession;
import io.github.suppierk.persistence.session.TrackedEntry;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jooq.Configuration;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.exception.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PersistenceSession} writing through jOOQ.
 *
 * <p>{@link #flush()} performs, in tracking order, an insert for every added entity, an update for
 * every modified one and a delete for every deleted one, followed by storing harvested domain
 * events in the outbox, all inside one {@link DSLContext#transactionResult} call. Timestamps are
 * taken from the configured {@link Clock} once per flush and truncated to microseconds.
 */
public final class JooqPersistenceSession extends Suspicious implements PersistenceSession {
  private static final Logger LOGGER = LoggerFactory.getLogger(JooqPersistenceSession.class);

  private final DSLContext dsl;
  private final EntityMappings mappings;
  private final DomainEventPipeline pipeline;
  private final Clock clock;
  private final ChangeTracker tracker;
  private boolean open;

  /**
   * @param dsl to read and write with
   * @param mappings of every entity type the session works with
   * @param pipeline to run on every flush
   * @param clock to take timestamps from
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public JooqPersistenceSession(
      final DSLContext dsl,
      final EntityMappings mappings,
      final DomainEventPipeline pipeline,
      final Clock clock) {
    this.dsl = throwIllegalArgumentIfNull(dsl, "DSL context");
    this.mappings = throwIllegalArgumentIfNull(mappings, "Entity mappings");
    this.pipeline = throwIllegalArgumentIfNull(pipeline, "Domain event pipeline");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
    this.tracker = new ChangeTracker();
    this.open = true;
  }

  @Override
  public <E extends BaseEntity> void add(final E entity) {
    final E nonNullEntity = throwIllegalArgumentIfNull(entity, "Entity");
    ensureUsable();

    final var entityType = mappings.mappingFor(nonNullEntity.getClass()).entityType();

    if (nonNullEntity.id() == null) {
      nonNullEntity.assignId(EntityId.newId());
    }

    final var existing = tracker.find(entityType, nonNullEntity.id()).map(TrackedEntry::state);

    if (existing.isEmpty() || existing.get() == EntryState.ADDED) {
      tracker.track(entityType, nonNullEntity, EntryState.ADDED);
    } else if (existing.get() == EntryState.DELETED) {
      tracker.track(entityType, nonNullEntity, EntryState.MODIFIED);
    } else {
      throw new IllegalStateException(
          "%s %s is already stored".formatted(entityType.getSimpleName(), nonNullEntity.id()));
    }
  }

  @Override
  public <E extends BaseEntity> void update(final E entity) {
    final E nonNullEntity = requireId(entity);
    ensureUsable();

    final var entityType = mappings.mappingFor(nonNullEntity.getClass()).entityType();
    final var existing = tracker.find(entityType, nonNullEntity.id()).map(TrackedEntry::state);

    if (existing.isPresent() && existing.get() == EntryState.ADDED) {
      tracker.track(entityType, nonNullEntity, EntryState.ADDED);
    } else {
      tracker.track(entityType, nonNullEntity, EntryState.MODIFIED);
    }
  }

  @Override
  public <E extends BaseEntity> void remove(final E entity) {
    final E nonNullEntity = requireId(entity);
    ensureUsable();

    final var entityType = mappings.mappingFor(nonNullEntity.getClass()).entityType();
    final var existing = tracker.find(entityType, nonNullEntity.id());

    if (existing.isPresent() && existing.get().state() == EntryState.ADDED) {
      existing.get().setState(EntryState.DETACHED);
    } else {
      tracker.track(entityType, nonNullEntity, EntryState.DELETED);
    }
  }

  @Override
  public <E extends BaseEntity> Optional<E> find(final Class<E> type, final EntityId id) {
    final Class<E> nonNullType = throwIllegalArgumentIfNull(type, "Entity type");
    final EntityId nonNullId = throwIllegalArgumentIfNull(id, "Entity ID");
    ensureUsable();

    final EntityMapping<E> mapping = mappings.mappingFor(nonNullType);
    final var existing = tracker.find(mapping.entityType(), nonNullId);

    if (existing.isPresent()) {
      return existing.get().state() == EntryState.DELETED
          ? Optional.empty()
          : Optional.of(nonNullType.cast(existing.get().entity()));
    }

    return query(nonNullType).where(mapping.id().eq(nonNullId.value())).fetchFirst();
  }

  @Override
  public <E extends BaseEntity> EntityQuery<E> query(final Class<E> type) {
    final Class<E> nonNullType = throwIllegalArgumentIfNull(type, "Entity type");
    ensureUsable();

    return new JooqEntityQuery<>(this, mappings.mappingFor(nonNullType));
  }

  @Override
  public int flush() {
    ensureUsable();

    final List<TrackedEntry> pending = tracker.pending();
    final DomainEventPipeline.Harvest harvest = pipeline.collect(tracker.entities());

    if (pending.isEmpty() && harvest.isEmpty()) {
      return 0;
    }

    final LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);

    LOGGER.debug(
        "Flushing {} change(s) and {} domain event(s)", pending.size(), harvest.events().size());

    final int affected;
    try {
      affected =
          dsl.transactionResult(
              (final Configuration trx) -> {
                int rows = 0;

                for (TrackedEntry entry : pending) {
                  rows += write(trx.dsl(), entry, now);
                }

                harvest.store(trx.dsl());
                return rows;
              });
    } catch (DataAccessException e) {
      throw new PersistenceException("Unable to flush session", e);
    }

    for (TrackedEntry entry : pending) {
      if (entry.state() == EntryState.ADDED) {
        entry.entity().stampCreated(now);
        entry.entity().stampUpdated(null);
      } else if (entry.state() == EntryState.MODIFIED) {
        entry.entity().stampUpdated(now);
      }
    }

    tracker.acceptChanges();
    harvest.clearAndDispatch();

    return affected;
  }

  @Override
  public List<TrackedEntry> entries() {
    return tracker.entries();
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    open = false;
    tracker.clear();
  }

  DSLContext dsl() {
    return dsl;
  }

  /**
   * @return identifiers of the given entity type which are pending deletion in this session
   */
  List<UUID> deletedIds(final Class<?> entityType) {
    final List<UUID> ids = new ArrayList<>();

    for (TrackedEntry entry : tracker.pending()) {
      if (entry.state() == EntryState.DELETED && entry.entityType().equals(entityType)) {
        ids.add(entry.id().value());
      }
    }

    return ids;
  }

  /**
   * Routes a loaded row through the identity map.
   *
   * @return tracked instance, a new tracked instance, or empty if the row is pending deletion
   */
  <E extends BaseEntity> Optional<E> attach(final EntityMapping<E> mapping, final Record record) {
    final EntityId id = EntityId.of(record.get(mapping.id()));
    final var existing = tracker.find(mapping.entityType(), id);

    if (existing.isPresent()) {
      return existing.get().state() == EntryState.DELETED
          ? Optional.empty()
          : Optional.of(mapping.entityType().cast(existing.get().entity()));
    }

    final E entity = mapping.read(record);
    tracker.track(mapping.entityType(), entity, EntryState.UNCHANGED);
    return Optional.of(entity);
  }

  void ensureUsable() {
    if (!open) {
      throw new PersistenceException("Session is closed");
    }

    if (Thread.currentThread().isInterrupted()) {
      throw new PersistenceException("Session operation was cancelled");
    }
  }

  private int write(final DSLContext trxDsl, final TrackedEntry entry, final LocalDateTime now) {
    final EntityMapping<BaseEntity> mapping = mappings.mappingFor(entry.entityType());
    final BaseEntity entity = entry.entity();
    final UUID id = entity.id().value();

    return switch (entry.state()) {
      case ADDED -> trxDsl
          .insertInto(mapping.table())
          .set(mapping.insertValues(entity, now))
          .execute();
      case MODIFIED -> requireRow(
          entry,
          trxDsl
              .update(mapping.table())
              .set(mapping.updateValues(entity, now))
              .where(mapping.id().eq(id))
              .execute());
      case DELETED -> requireRow(
          entry, trxDsl.deleteFrom(mapping.table()).where(mapping.id().eq(id)).execute());
      default -> 0;
    };
  }

  private int requireRow(final TrackedEntry entry, final int rows) {
    if (rows == 0) {
      throw new PersistenceException(
          "%s %s does not exist anymore, unable to write %s change"
              .formatted(entry.entityType().getSimpleName(), entry.id(), entry.state()));
    }

    return rows;
  }

  private <E extends BaseEntity> E requireId(final E entity) {
    final E nonNullEntity = throwIllegalArgumentIfNull(entity, "Entity");

    if (nonNullEntity.id() == null) {
      throw new IllegalArgumentException(
          "%s without ID cannot be tracked".formatted(nonNullEntity.getClass().getSimpleName()));
    }

    return nonNullEntity;
  }
}
