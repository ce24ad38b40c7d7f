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

/**
 * Creates a {@link DomainEventHandler} for every dispatch batch, which lets handlers depend on
 * collaborators living in the {@link DispatchScope} of that batch.
 *
 * @param <E> the type of the event
 */
@FunctionalInterface
public interface DomainEventHandlerFactory<E extends DomainEvent> {
  /**
   * @param scope of the current dispatch batch
   * @return a handler, must not be {@code null}
   */
  DomainEventHandler<E> create(final DispatchScope scope);
}
