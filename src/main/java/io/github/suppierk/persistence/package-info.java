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

/**
 * Persistence layer for aggregate-oriented domain models.
 *
 * <p>Here is how the parts relate to each other when an order is placed:
 *
 * <ul>
 *   <li>The order is a {@link io.github.suppierk.persistence.model.AggregateRoot} which records
 *       an {@code OrderPlaced} {@link io.github.suppierk.persistence.model.DomainEvent} in its
 *       buffer.
 *   <li>A {@link io.github.suppierk.persistence.repository.Repository} hands the order to the
 *       {@link io.github.suppierk.persistence.session.PersistenceSession}, and its {@link
 *       io.github.suppierk.persistence.repository.SaveState} decides whether to flush right away
 *       or leave it to the enclosing {@link io.github.suppierk.persistence.uow.UnitOfWork}.
 *   <li>On flush the {@link io.github.suppierk.persistence.event.DomainEventPipeline} harvests the
 *       buffer, the session writes the order in one transaction, and only once that transaction
 *       committed the buffer is cleared and the event is handed to the {@link
 *       io.github.suppierk.persistence.event.DomainEventDispatcher}.
 *   <li>Reading it back, a {@link io.github.suppierk.persistence.specification.Specification}
 *       describes filter, includes, order and paging, and the {@link
 *       io.github.suppierk.persistence.specification.SpecificationEvaluator} turns it into an
 *       executable {@link io.github.suppierk.persistence.session.EntityQuery}.
 * </ul>
 */
package io.github.suppierk.persistence;
