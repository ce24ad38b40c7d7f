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

package io.github.suppierk.persistence.session;

import io.github.suppierk.persistence.model.BaseEntity;
import io.github.suppierk.persistence.specification.Include;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.jooq.Condition;
import org.jooq.Field;

/**
 * Immutable query over one entity type, every method returns a new query.
 *
 * <p>Rows loaded by {@link #fetch()} and {@link #fetchFirst()} go through the identity map of the
 * session which created the query: an already tracked row yields the tracked instance, other rows
 * start being tracked as {@link EntryState#UNCHANGED}.
 *
 * @param <E> is the type of the queried entity
 */
public interface EntityQuery<E extends BaseEntity> {
  /**
   * @param condition to filter with, combined with previous filters using {@code AND}
   * @return a new query
   */
  EntityQuery<E> where(final Condition condition);

  /**
   * @param apply whether the condition should be used
   * @param condition to filter with when {@code apply} is {@code true}
   * @return a new query or this query
   */
  default EntityQuery<E> whereIf(final boolean apply, final Condition condition) {
    return apply ? where(condition) : this;
  }

  /**
   * @param field to match
   * @param values accepted for the field, an empty collection matches nothing
   * @param <T> is the type of the field
   * @return a new query
   * @throws IllegalArgumentException if any argument is {@code null}
   */
  default <T> EntityQuery<E> whereIn(final Field<T> field, final Collection<? extends T> values) {
    if (field == null || values == null) {
      throw new IllegalArgumentException("Field and values cannot be null");
    }

    return where(field.in(values));
  }

  /**
   * @param include to load after the root rows
   * @return a new query
   */
  EntityQuery<E> include(final Include<E> include);

  /**
   * @param path of an include registered for this entity type
   * @return a new query
   * @throws IllegalArgumentException if the path is unknown
   */
  EntityQuery<E> include(final String path);

  /**
   * @param field to sort ascending by, replaces previous ordering
   * @return a new query
   */
  EntityQuery<E> orderBy(final Field<?> field);

  /**
   * @param field to sort descending by, replaces previous ordering
   * @return a new query
   */
  EntityQuery<E> orderByDescending(final Field<?> field);

  default EntityQuery<E> orderByIf(final boolean apply, final Field<?> field) {
    return apply ? orderBy(field) : this;
  }

  default EntityQuery<E> orderByDescendingIf(final boolean apply, final Field<?> field) {
    return apply ? orderByDescending(field) : this;
  }

  /**
   * @param count of rows to skip
   * @return a new query
   * @throws IllegalArgumentException if count is negative
   */
  EntityQuery<E> skip(final int count);

  /**
   * @param count of rows to return at most
   * @return a new query
   * @throws IllegalArgumentException if count is not positive
   */
  EntityQuery<E> take(final int count);

  /**
   * @return matching entities in query order
   */
  List<E> fetch();

  /**
   * @return first matching entity
   */
  Optional<E> fetchFirst();

  /**
   * @return number of matching rows, includes are ignored
   */
  int count();
}
