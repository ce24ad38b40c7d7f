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
 * Reacts to a committed {@link DomainEvent} of one exact type.
 *
 * @param <E> the type of the event
 */
@FunctionalInterface
public interface DomainEventHandler<E extends DomainEvent> {
  /**
   * Invoked sequentially with the other handlers of the same dispatch batch, never concurrently.
   *
   * @param event to handle
   * @throws Exception if handling failed, the failure is propagated to the caller of the dispatch
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  void handle(final E event) throws Exception;
}
