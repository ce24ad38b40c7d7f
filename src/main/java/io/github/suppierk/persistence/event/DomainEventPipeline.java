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

package io.github.suppierk.persistence.event;

import io.github.suppierk.persistence.Suspicious;
import io.github.suppierk.persistence.model.AggregateRoot;
import io.github.suppierk.persistence.model.DomainEvent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.jooq.DSLContext;

/**
 * Save pipeline moving {@link DomainEvent}s from tracked {@link AggregateRoot}s to the {@link
 * DomainEventOutbox} and the {@link DomainEventDispatcher}.
 *
 * <p>A session flush uses the pipeline in three steps:
 *
 * <ol>
 *   <li>{@link #collect(Collection)} before the transaction starts, which flattens pending events
 *       aggregate by aggregate while keeping the append order of each aggregate.
 *   <li>{@link Harvest#store(DSLContext)} inside the transaction.
 *   <li>{@link Harvest#clearAndDispatch()} once the transaction has committed.
 * </ol>
 *
 * <p>Buffers are only cleared at the last step: when the transaction fails the events stay where
 * they were and the next successful flush dispatches them.
 */
public final class DomainEventPipeline extends Suspicious {
  private final DomainEventDispatcher dispatcher;
  private final DomainEventOutbox outbox;

  /**
   * @param dispatcher to deliver events with after commit
   * @param outbox to store events with during commit
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public DomainEventPipeline(
      final DomainEventDispatcher dispatcher, final DomainEventOutbox outbox) {
    this.dispatcher = throwIllegalArgumentIfNull(dispatcher, "Domain event dispatcher");
    this.outbox = throwIllegalArgumentIfNull(outbox, "Domain event outbox");
  }

  /**
   * @return a pipeline which drains buffers without delivering events anywhere
   */
  public static DomainEventPipeline noOp() {
    return new DomainEventPipeline(DomainEventDispatcher.noOp(), DomainEventOutbox.empty());
  }

  /**
   * @param trackedEntities in the order they are tracked by the session, entities which are not
   *     {@link AggregateRoot}s are skipped
   * @return harvested events, buffers are left intact
   * @throws IllegalArgumentException if entities are {@code null}
   */
  public Harvest collect(final Collection<?> trackedEntities) {
    final Collection<?> nonNullEntities = throwIllegalArgumentIfNull(trackedEntities, "Entities");

    final List<AggregateRoot> aggregates = new ArrayList<>();
    final List<DomainEvent> events = new ArrayList<>();

    for (Object entity : nonNullEntities) {
      if (entity instanceof AggregateRoot aggregate && aggregate.hasEvents()) {
        aggregates.add(aggregate);
        events.addAll(aggregate.events());
      }
    }

    return new Harvest(List.copyOf(aggregates), List.copyOf(events));
  }

  /** Events collected from aggregates for one flush. */
  public final class Harvest {
    private final List<AggregateRoot> aggregates;
    private final List<DomainEvent> events;
    private boolean released;

    private Harvest(final List<AggregateRoot> aggregates, final List<DomainEvent> events) {
      this.aggregates = aggregates;
      this.events = events;
      this.released = false;
    }

    /**
     * @return collected events, aggregate by aggregate, in append order
     */
    public List<DomainEvent> events() {
      return events;
    }

    /**
     * @return {@code true} if no aggregate had pending events
     */
    public boolean isEmpty() {
      return events.isEmpty();
    }

    /**
     * @param readWriteDsl transactional context of the current flush
     */
    public void store(final DSLContext readWriteDsl) {
      for (DomainEvent event : events) {
        outbox.store(readWriteDsl, event);
      }
    }

    /**
     * Clears buffers of every harvested aggregate and dispatches the events, must be invoked only
     * after the transaction committed.
     *
     * @throws IllegalStateException if invoked more than once
     * @throws DomainEventDispatchException if a handler failed, buffers stay cleared
     */
    public void clearAndDispatch() {
      if (released) {
        throw new IllegalStateException("Harvested events were already dispatched");
      }

      released = true;

      for (AggregateRoot aggregate : aggregates) {
        aggregate.clearEvents();
      }

      if (!events.isEmpty()) {
        dispatcher.dispatch(events);
      }
    }
  }
}
