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
import java.util.List;

/** Delivers buffered {@link DomainEvent}s to their handlers. */
@FunctionalInterface
public interface DomainEventDispatcher {
  /**
   * @return an instance of dispatcher which does not perform any operations
   */
  static DomainEventDispatcher noOp() {
    return NoOp.INSTANCE;
  }

  /**
   * Delivers events in the given order.
   *
   * @param events to deliver
   * @throws DomainEventDispatchException if one of the handlers failed, events and handlers
   *     preceding the failing one were already delivered
   */
  void dispatch(final List<? extends DomainEvent> events);

  /** Default implementation of the fake dispatcher */
  final class NoOp implements DomainEventDispatcher {
    private static final DomainEventDispatcher INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void dispatch(final List<? extends DomainEvent> events) {
      // Do nothing
    }
  }
}
