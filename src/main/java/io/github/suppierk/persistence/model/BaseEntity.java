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

package io.github.suppierk.persistence.model;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Common attributes shared by all persisted objects.
 *
 * <p>Timestamps belong to the persistence layer: {@link #stampCreated(LocalDateTime)} and {@link
 * #stampUpdated(LocalDateTime)} are invoked by the session when rows are written or read, domain
 * logic should never call them.
 *
 * <p>Entities use reference equality, compare {@link #id()}s to check whether two instances
 * describe the same entity.
 */
public abstract class BaseEntity {
  private EntityId id;
  private LocalDateTime createdOn;
  private LocalDateTime updatedOn;

  protected BaseEntity() {
    // Identity is assigned later
  }

  protected BaseEntity(final EntityId id) {
    assignId(id);
  }

  /**
   * @return identity of this entity or {@code null} if it was never assigned
   */
  public final EntityId id() {
    return id;
  }

  /**
   * @return the time when the row was first written, {@code null} until then
   */
  public final LocalDateTime createdOn() {
    return createdOn;
  }

  /**
   * @return the time when the row was last updated
   */
  public final Optional<LocalDateTime> updatedOn() {
    return Optional.ofNullable(updatedOn);
  }

  /**
   * Identity is immutable once assigned, re-assigning the same value is permitted.
   *
   * @param id to assign
   * @throws IllegalArgumentException if id is {@code null}
   * @throws IllegalStateException if a different identity was already assigned
   */
  public final void assignId(final EntityId id) {
    if (id == null) {
      throw new IllegalArgumentException("Entity ID cannot be null");
    }

    if (this.id != null && !this.id.equals(id)) {
      throw new IllegalStateException(
          "%s already has ID %s".formatted(getClass().getSimpleName(), this.id));
    }

    this.id = id;
  }

  /**
   * @param createdOn as stored by the persistence layer
   */
  public final void stampCreated(final LocalDateTime createdOn) {
    this.createdOn = createdOn;
  }

  /**
   * @param updatedOn as stored by the persistence layer, {@code null} if the row was never updated
   */
  public final void stampUpdated(final LocalDateTime updatedOn) {
    this.updatedOn = updatedOn;
  }
}
