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

import io.github.suppierk.persistence.model.DomainEvent;
import org.jooq.DSLContext;

/**
 * Abstract contract for an entity which is able to store harvested {@link DomainEvent}s as a part
 * of the same transaction which writes the changes that produced them.
 *
 * <p>In-process dispatch happens after the commit and is not retried: a handler failure leaves the
 * write durable while the event is lost. Implementations of this interface should store the event
 * and deliver it later on a schedule, which makes delivery independent of the request that raised
 * the event.
 *
 * @see <a href="https://microservices.io/patterns/data/transactional-outbox.html">Transactional
 *     outbox</a>
 */
public interface DomainEventOutbox {
  /**
   * @return an instance of outbox which does not perform any operations
   */
  static DomainEventOutbox empty() {
    return NoOp.INSTANCE;
  }

  /**
   * Saves {@link DomainEvent} to its own table for delivery.
   *
   * @param readWriteDsl is a transactional context with writing capability at the time when the
   *     flush takes place
   * @param event to store
   * @param <E> is a generic {@link DomainEvent} type
   */
  <E extends DomainEvent> void store(final DSLContext readWriteDsl, final E event);

  /** Default implementation of the fake outbox */
  final class NoOp implements DomainEventOutbox {
    private static final DomainEventOutbox INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public <E extends DomainEvent> void store(final DSLContext readWriteDsl, final E event) {
      // Do nothing
    }
  }
}
