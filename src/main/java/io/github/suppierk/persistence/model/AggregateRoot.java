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

import java.util.ArrayList;
import java.util.List;

/**
 * An entity which is the consistency boundary for a cluster of related objects and the sole source
 * of {@link DomainEvent}s for that cluster.
 *
 * <p>Events are appended by domain logic during a business operation and drained exactly once by
 * the save pipeline after the change was committed. When the commit fails the buffer is left as is,
 * so that the next successful commit dispatches the same events.
 */
public abstract class AggregateRoot extends BaseEntity {
  private final List<DomainEvent> events;

  protected AggregateRoot() {
    super();
    this.events = new ArrayList<>();
  }

  protected AggregateRoot(final EntityId id) {
    super(id);
    this.events = new ArrayList<>();
  }

  /**
   * @return read-only snapshot of pending events in append order
   */
  public final List<DomainEvent> events() {
    return List.copyOf(events);
  }

  /**
   * @return {@code true} if there is at least one pending event
   */
  public final boolean hasEvents() {
    return !events.isEmpty();
  }

  /** Drains the buffer, must only be invoked by the save pipeline. */
  public final void clearEvents() {
    events.clear();
  }

  /**
   * @param event to append to the buffer
   * @throws IllegalArgumentException if event is {@code null}
   */
  protected final void addEvent(final DomainEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Domain event cannot be null");
    }

    events.add(event);
  }
}
