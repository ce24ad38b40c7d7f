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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registration table mapping an exact {@link DomainEvent} class to the ordered list of factories of
 * its handlers.
 *
 * <p>The table is assembled once at startup and is immutable afterwards. Lookups never consider
 * super types or interfaces: a handler registered for {@code OrderEvent} will not receive {@code
 * OrderPlaced}.
 */
public final class DomainEventHandlers {
  private static final DomainEventHandlers EMPTY = new DomainEventHandlers(Map.of());

  private final Map<Class<?>, List<DomainEventHandlerFactory<?>>> factories;

  private DomainEventHandlers(final Map<Class<?>, List<DomainEventHandlerFactory<?>>> factories) {
    this.factories = factories;
  }

  /**
   * @return a table without any handlers
   */
  public static DomainEventHandlers empty() {
    return EMPTY;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @param eventClass exact class of the event
   * @return handler factories in registration order, empty if none were registered
   */
  @SuppressWarnings("squid:S1452")
  public List<DomainEventHandlerFactory<?>> factoriesFor(final Class<?> eventClass) {
    return factories.getOrDefault(eventClass, List.of());
  }

  /**
   * @return {@code true} if no handlers were registered
   */
  public boolean isEmpty() {
    return factories.isEmpty();
  }

  /** Collects registrations in their declaration order. */
  public static final class Builder extends Suspicious {
    private final Map<Class<?>, List<DomainEventHandlerFactory<?>>> factories;

    private Builder() {
      this.factories = new LinkedHashMap<>();
    }

    /**
     * Registers a handler instance shared by all dispatch batches.
     *
     * @param eventClass exact class of the event
     * @param handler to invoke
     * @param <E> is the type of the event
     * @return this builder
     * @throws IllegalArgumentException if any argument is {@code null}
     */
    public <E extends DomainEvent> Builder register(
        final Class<E> eventClass, final DomainEventHandler<E> handler) {
      final DomainEventHandler<E> nonNullHandler =
          throwIllegalArgumentIfNull(handler, "Domain event handler");
      return registerScoped(eventClass, scope -> nonNullHandler);
    }

    /**
     * Registers a handler factory invoked once per dispatch batch.
     *
     * @param eventClass exact class of the event
     * @param factory to create the handler with
     * @param <E> is the type of the event
     * @return this builder
     * @throws IllegalArgumentException if any argument is {@code null}
     */
    public <E extends DomainEvent> Builder registerScoped(
        final Class<E> eventClass, final DomainEventHandlerFactory<E> factory) {
      final Class<E> nonNullEventClass = throwIllegalArgumentIfNull(eventClass, "Event class");
      final DomainEventHandlerFactory<E> nonNullFactory =
          throwIllegalArgumentIfNull(factory, "Domain event handler factory");

      factories.computeIfAbsent(nonNullEventClass, key -> new ArrayList<>()).add(nonNullFactory);
      return this;
    }

    /**
     * @return immutable registration table
     */
    public DomainEventHandlers build() {
      final Map<Class<?>, List<DomainEventHandlerFactory<?>>> copy = new LinkedHashMap<>();
      factories.forEach((eventClass, list) -> copy.put(eventClass, List.copyOf(list)));
      return new DomainEventHandlers(Map.copyOf(copy));
    }
  }
}
