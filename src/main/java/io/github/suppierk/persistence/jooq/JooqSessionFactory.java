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

package io.github.suppierk.persistence.jooq;

import io.github.suppierk.persistence.Suspicious;
import io.github.suppierk.persistence.event.DomainEventDispatcher;
import io.github.suppierk.persistence.event.DomainEventOutbox;
import io.github.suppierk.persistence.event.DomainEventPipeline;
import io.github.suppierk.persistence.uow.DefaultUnitOfWork;
import io.github.suppierk.persistence.uow.UnitOfWork;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.jooq.DSLContext;

/**
 * Startup assembly of everything a {@link JooqPersistenceSession} needs.
 *
 * <p>The factory is immutable and can be shared, sessions and units of work it opens can not.
 *
 * <pre>{@code
 * final var factory =
 *     JooqSessionFactory.builder(dsl)
 *         .mapping(new OrderMapping())
 *         .dispatcher(new ScopedDomainEventDispatcher(handlers))
 *         .build();
 *
 * try (UnitOfWork uow = factory.openUnitOfWork()) {
 *   uow.execute(
 *       () -> {
 *         uow.repository(Order.class).insert(order);
 *       },
 *       session -> uow.rollback());
 * }
 * }</pre>
 */
public final class JooqSessionFactory {
  private final DSLContext dsl;
  private final EntityMappings mappings;
  private final DomainEventDispatcher dispatcher;
  private final DomainEventOutbox outbox;
  private final Clock clock;

  private JooqSessionFactory(final Builder builder) {
    this.dsl = builder.dsl;
    this.mappings = new EntityMappings(builder.mappings);
    this.dispatcher = builder.dispatcher;
    this.outbox = builder.outbox;
    this.clock = builder.clock;
  }

  /**
   * @param dsl to read and write with, its settings apply to every statement
   * @return a new builder
   * @throws IllegalArgumentException if dsl is {@code null}
   */
  public static Builder builder(final DSLContext dsl) {
    return new Builder(dsl);
  }

  /**
   * @return a new session
   */
  public JooqPersistenceSession openSession() {
    return new JooqPersistenceSession(
        dsl, mappings, new DomainEventPipeline(dispatcher, outbox), clock);
  }

  /**
   * @return a new unit of work owning a new session
   */
  public UnitOfWork openUnitOfWork() {
    return new DefaultUnitOfWork(openSession());
  }

  /** Builder of {@link JooqSessionFactory}. */
  public static final class Builder extends Suspicious {
    private final DSLContext dsl;
    private final List<EntityMapping<?>> mappings;
    private DomainEventDispatcher dispatcher;
    private DomainEventOutbox outbox;
    private Clock clock;

    private Builder(final DSLContext dsl) {
      this.dsl = throwIllegalArgumentIfNull(dsl, "DSL context");
      this.mappings = new ArrayList<>();
      this.dispatcher = DomainEventDispatcher.noOp();
      this.outbox = DomainEventOutbox.empty();
      this.clock = Clock.systemUTC();
    }

    public Builder mapping(final EntityMapping<?> mapping) {
      mappings.add(throwIllegalArgumentIfNull(mapping, "Entity mapping"));
      return this;
    }

    public Builder dispatcher(final DomainEventDispatcher dispatcher) {
      this.dispatcher = throwIllegalArgumentIfNull(dispatcher, "Domain event dispatcher");
      return this;
    }

    public Builder outbox(final DomainEventOutbox outbox) {
      this.outbox = throwIllegalArgumentIfNull(outbox, "Domain event outbox");
      return this;
    }

    public Builder clock(final Clock clock) {
      this.clock = throwIllegalArgumentIfNull(clock, "Clock");
      return this;
    }

    /**
     * @return a new factory
     * @throws IllegalStateException if the same entity type is mapped twice
     */
    public JooqSessionFactory build() {
      return new JooqSessionFactory(this);
    }
  }
}
