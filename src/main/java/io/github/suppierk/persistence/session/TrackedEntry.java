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

/**
 * Entity as seen by the change tracker of a {@link PersistenceSession}.
 *
 * <p>Entries are keyed by the mapped entity type and the entity ID, so there is at most one entry
 * for each row within a session.
 */
public final class TrackedEntry {
  private final Class<? extends BaseEntity> entityType;
  private final EntityId id;
  private BaseEntity entity;
  private EntryState state;

  TrackedEntry(
      final Class<? extends BaseEntity> entityType,
      final BaseEntity entity,
      final EntryState state) {
    this.entityType = entityType;
    this.id = entity.id();
    this.entity = entity;
    this.state = state;
  }

  /**
   * @return mapped type which was used to track the entity
   */
  public Class<? extends BaseEntity> entityType() {
    return entityType;
  }

  /**
   * @return identity of the tracked row
   */
  public EntityId id() {
    return id;
  }

  /**
   * @return currently tracked instance
   */
  public BaseEntity entity() {
    return entity;
  }

  /**
   * @return current state
   */
  public EntryState state() {
    return state;
  }

  /**
   * Moves the entry to another state, {@link EntryState#DETACHED} stops tracking it.
   *
   * @param state to move to
   * @throws IllegalArgumentException if state is {@code null}
   */
  public void setState(final EntryState state) {
    if (state == null) {
      throw new IllegalArgumentException("Entry state cannot be null");
    }

    this.state = state;
  }

  void replace(final BaseEntity entity, final EntryState state) {
    this.entity = entity;
    this.state = state;
  }

  @Override
  public String toString() {
    return "%s[%s] %s".formatted(entityType.getSimpleName(), id, state);
  }
}
