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
import java.io.Serial;

/** Thrown when a {@link DomainEventHandler} failed to handle an event. */
public class DomainEventDispatchException extends RuntimeException {
  @Serial private static final long serialVersionUID = 2480113956614328017L;

  private final DomainEvent event;

  /**
   * @param event which could not be handled
   * @param cause the failure raised by the handler
   */
  public DomainEventDispatchException(final DomainEvent event, final Throwable cause) {
    super(
        "Unable to handle %s"
            .formatted(event == null ? "domain event" : event.getClass().getSimpleName()),
        cause);
    this.event = event;
  }

  /**
   * @return the event which could not be handled
   */
  public DomainEvent getEvent() {
    return event;
  }
}
