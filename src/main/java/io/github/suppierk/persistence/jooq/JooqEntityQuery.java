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
import io.github.suppierk.persistence.model.BaseEntity;
import io.github.suppierk.persistence.session.EntityQuery;
import io.github.suppierk.persistence.specification.Include;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jooq.Condition;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.SelectQuery;
import org.jooq.SortField;

/**
 * {@link EntityQuery} compiled into a jOOQ {@link SelectQuery} on every execution.
 *
 * <p>Rows of entities pending deletion in the session are excluded by the query itself, so paging
 * and {@link #count()} see the same rows {@link #fetch()} returns.
 *
 * @param <E> is the type of the queried entity
 */
final class JooqEntityQuery<E extends BaseEntity> extends Suspicious implements EntityQuery<E> {
  private final JooqPersistenceSession session;
  private final EntityMapping<E> mapping;
  private final List<Condition> conditions;
  private final List<Include<E>> includes;
  private final SortField<?> sort;
  private final Integer skip;
  private final Integer take;

  JooqEntityQuery(final JooqPersistenceSession session, final EntityMapping<E> mapping) {
    this(session, mapping, List.of(), List.of(), null, null, null);
  }

  private JooqEntityQuery(
      final JooqPersistenceSession session,
      final EntityMapping<E> mapping,
      final List<Condition> conditions,
      final List<Include<E>> includes,
      final SortField<?> sort,
      final Integer skip,
      final Integer take) {
    this.session = session;
    this.mapping = mapping;
    this.conditions = conditions;
    this.includes = includes;
    this.sort = sort;
    this.skip = skip;
    this.take = take;
  }

  @Override
  public EntityQuery<E> where(final Condition condition) {
    final List<Condition> extended = new ArrayList<>(conditions);
    extended.add(throwIllegalArgumentIfNull(condition, "Condition"));
    return new JooqEntityQuery<>(
        session, mapping, List.copyOf(extended), includes, sort, skip, take);
  }

  @Override
  public EntityQuery<E> include(final Include<E> include) {
    final List<Include<E>> extended = new ArrayList<>(includes);
    extended.add(throwIllegalArgumentIfNull(include, "Include"));
    return new JooqEntityQuery<>(
        session, mapping, conditions, List.copyOf(extended), sort, skip, take);
  }

  @Override
  public EntityQuery<E> include(final String path) {
    final String nonNullPath = throwIllegalArgumentIfNull(path, "Include path");

    return include(
        mapping
            .include(nonNullPath)
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "Unknown include '%s' for %s"
                            .formatted(nonNullPath, mapping.entityType().getSimpleName()))));
  }

  @Override
  public EntityQuery<E> orderBy(final Field<?> field) {
    final Field<?> nonNullField = throwIllegalArgumentIfNull(field, "Order field");
    return new JooqEntityQuery<>(
        session, mapping, conditions, includes, nonNullField.asc(), skip, take);
  }

  @Override
  public EntityQuery<E> orderByDescending(final Field<?> field) {
    final Field<?> nonNullField = throwIllegalArgumentIfNull(field, "Order field");
    return new JooqEntityQuery<>(
        session, mapping, conditions, includes, nonNullField.desc(), skip, take);
  }

  @Override
  public EntityQuery<E> skip(final int count) {
    if (count < 0) {
      throw new IllegalArgumentException("Skip cannot be negative, got %d".formatted(count));
    }

    return new JooqEntityQuery<>(session, mapping, conditions, includes, sort, count, take);
  }

  @Override
  public EntityQuery<E> take(final int count) {
    if (count <= 0) {
      throw new IllegalArgumentException("Take must be positive, got %d".formatted(count));
    }

    return new JooqEntityQuery<>(session, mapping, conditions, includes, sort, skip, count);
  }

  @Override
  public List<E> fetch() {
    session.ensureUsable();

    final List<E> roots = new ArrayList<>();
    for (Record record : select().fetch()) {
      session.attach(mapping, record).ifPresent(roots::add);
    }

    if (!roots.isEmpty()) {
      for (Include<E> include : includes) {
        include.load(session.dsl(), roots);
      }
    }

    return List.copyOf(roots);
  }

  @Override
  public Optional<E> fetchFirst() {
    return take(1).fetch().stream().findFirst();
  }

  @Override
  public int count() {
    session.ensureUsable();
    return session.dsl().fetchCount(select());
  }

  private SelectQuery<Record> select() {
    final SelectQuery<Record> select = session.dsl().selectQuery();
    select.addSelect(mapping.fields());
    select.addFrom(mapping.table());
    select.addConditions(conditions);

    final List<UUID> deletedIds = session.deletedIds(mapping.entityType());
    if (!deletedIds.isEmpty()) {
      select.addConditions(mapping.id().notIn(deletedIds));
    }

    if (sort != null) {
      select.addOrderBy(sort);
    }

    if (skip != null) {
      select.addOffset(skip);
    }

    if (take != null) {
      select.addLimit(take);
    }

    return select;
  }
}
