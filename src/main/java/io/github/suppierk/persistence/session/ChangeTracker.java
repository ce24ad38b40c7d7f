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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Identity map and change tracker backing a {@link PersistenceSession}.
 *
 * <p>Keeps tracking order, which is the order used to write changes and to harvest domain events.
 * Not thread-safe.
 */
public final class ChangeTracker {
  private final Map<Key, TrackedEntry> entries;

  public ChangeTracker() {
    this.entries = new LinkedHashMap<>();
  }

  /**
   * Starts tracking the entity or moves the existing entry for the same row to a new state,
   * replacing the tracked instance.
   *
   * @param entityType mapped type of the entity
   * @param entity to track, must have an ID
   * @param state to track the entity in
   * @return tracked entry
   * @throws IllegalArgumentException if any argument is {@code null} or entity has no ID
   */
  public TrackedEntry track(
      final Class<? extends BaseEntity> entityType,
      final BaseEntity entity,
      final EntryState state) {
    if (entityType == null || entity == null || state == null) {
      throw new IllegalArgumentException("Entity type, entity and state cannot be null");
    }

    if (entity.id() == null) {
      throw new IllegalArgumentException(
          "%s without ID cannot be tracked".formatted(entityType.getSimpleName()));
    }

    final var key = new Key(entityType, entity.id());
    final var existing = entries.get(key);

    if (existing == null || existing.state() == EntryState.DETACHED) {
      final var entry = new TrackedEntry(entityType, entity, state);
      entries.remove(key);
      entries.put(key, entry);
      return entry;
    }

    existing.replace(entity, state);
    return existing;
  }

  /**
   * @param entityType mapped type of the entity
   * @param id of the entity
   * @return entry which is still tracked
   */
  public Optional<TrackedEntry> find(
      final Class<? extends BaseEntity> entityType, final EntityId id) {
    final var entry = entries.get(new Key(entityType, id));

    if (entry == null || entry.state() == EntryState.DETACHED) {
      return Optional.empty();
    }

    return Optional.of(entry);
  }

  /**
   * Drops detached entries and returns the rest.
   *
   * @return tracked entries in tracking order
   */
  public List<TrackedEntry> entries() {
    prune();
    return List.copyOf(entries.values());
  }

  /**
   * @return entries which have to be written by the next flush, in tracking order
   */
  public List<TrackedEntry> pending() {
    final List<TrackedEntry> pending = new ArrayList<>();

    for (TrackedEntry entry : entries.values()) {
      if (entry.state().isPending()) {
        pending.add(entry);
      }
    }

    return pending;
  }

  /**
   * @return instances of entries which are still tracked, in tracking order
   */
  public List<BaseEntity> entities() {
    final List<BaseEntity> entities = new ArrayList<>();

    for (TrackedEntry entry : entries.values()) {
      if (entry.state() != EntryState.DETACHED) {
        entities.add(entry.entity());
      }
    }

    return entities;
  }

  /** Marks written entries as {@link EntryState#UNCHANGED}, deleted ones stop being tracked. */
  public void acceptChanges() {
    for (TrackedEntry entry : entries.values()) {
      switch (entry.state()) {
        case ADDED, MODIFIED -> entry.setState(EntryState.UNCHANGED);
        case DELETED -> entry.setState(EntryState.DETACHED);
        default -> {
          // Nothing was written
        }
      }
    }

    prune();
  }

  /** Stops tracking everything. */
  public void clear() {
    entries.clear();
  }

  private void prune() {
    final Iterator<TrackedEntry> iterator = entries.values().iterator();

    while (iterator.hasNext()) {
      if (iterator.next().state() == EntryState.DETACHED) {
        iterator.remove();
      }
    }
  }

  private record Key(Class<?> entityType, EntityId id) {}
}
