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
import io.github.suppierk.persistence.model.DomainEvent;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DomainEventDispatcher} driven by a {@link DomainEventHandlers} registration table.
 *
 * <p>Every {@link #dispatch(List)} call:
 *
 * <ul>
 *   <li>Opens one fresh {@link DispatchScope} for the whole batch.
 *   <li>For each event in order, creates the handlers registered for its exact class and invokes
 *       them one after another.
 *   <li>Closes the scope once the batch is over, including when a handler failed.
 * </ul>
 *
 * <p>Handlers are created per call and never cached.
 */
public final class ScopedDomainEventDispatcher extends Suspicious implements DomainEventDispatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(ScopedDomainEventDispatcher.class);

  private final DomainEventHandlers handlers;
  private final Supplier<DispatchScope> scopeFactory;

  /**
   * @param handlers registration table
   * @throws IllegalArgumentException if handlers are {@code null}
   */
  public ScopedDomainEventDispatcher(final DomainEventHandlers handlers) {
    this(handlers, DispatchScope::new);
  }

  /**
   * @param handlers registration table
   * @param scopeFactory creating a new scope for every batch
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  public ScopedDomainEventDispatcher(
      final DomainEventHandlers handlers, final Supplier<DispatchScope> scopeFactory) {
    this.handlers = throwIllegalArgumentIfNull(handlers, "Domain event handlers");
    this.scopeFactory = throwIllegalArgumentIfNull(scopeFactory, "Dispatch scope factory");
  }

  /** {@inheritDoc} */
  @Override
  public void dispatch(final List<? extends DomainEvent> events) {
    final List<? extends DomainEvent> nonNullEvents =
        throwIllegalArgumentIfNull(events, "Domain events");

    LOGGER.debug("Dispatching {} domain event(s)", nonNullEvents.size());

    try (DispatchScope scope = throwIllegalStateIfNull(scopeFactory.get(), "Dispatch scope")) {
      for (DomainEvent event : nonNullEvents) {
        final DomainEvent nonNullEvent = throwIllegalStateIfNull(event, "Domain event");

        final var factories = handlers.factoriesFor(nonNullEvent.getClass());

        for (DomainEventHandlerFactory<?> factory : factories) {
          invoke(factory, scope, nonNullEvent);
        }
      }
    }
  }

  @SuppressWarnings("unchecked")
  private void invoke(
      final DomainEventHandlerFactory<?> factory,
      final DispatchScope scope,
      final DomainEvent event) {
    final DomainEventHandler<DomainEvent> handler =
        (DomainEventHandler<DomainEvent>)
            throwIllegalStateIfNull(factory.create(scope), "Domain event handler");

    try {
      handler.handle(event);
    } catch (Exception e) {
      LOGGER.error("Handler failed for {}", event.getClass().getSimpleName(), e);
      throw new DomainEventDispatchException(event, e);
    }
  }
}
