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

package io.github.suppierk.persistence.specification;

import io.github.suppierk.persistence.model.BaseEntity;
import io.github.suppierk.persistence.session.EntityQuery;

/**
 * Compiles a {@link Specification} into an {@link EntityQuery}.
 *
 * <p>Parts are applied in this order: criteria, typed includes, include paths, ascending order or
 * otherwise descending order, then {@code skip} and {@code take} when paging is enabled. Paging
 * values of an enabled specification are trusted to be present.
 */
public final class SpecificationEvaluator {
  private SpecificationEvaluator() {
    // Cannot be instantiated
  }

  /**
   * @param input query to refine
   * @param specification to apply
   * @param <E> is the type of the queried entity
   * @return refined query, the input query is left as is
   * @throws IllegalArgumentException if any argument is {@code null}
   * @throws java.util.NoSuchElementException if paging is enabled without skip or take
   */
  public static <E extends BaseEntity> EntityQuery<E> evaluate(
      final EntityQuery<E> input, final Specification<E> specification) {
    if (input == null || specification == null) {
      throw new IllegalArgumentException("Query and specification cannot be null");
    }

    EntityQuery<E> query = input;

    final var criteria = specification.criteria();
    if (criteria.isPresent()) {
      query = query.where(criteria.get());
    }

    for (Include<E> include : specification.includes()) {
      query = query.include(include);
    }

    for (String path : specification.includePaths()) {
      query = query.include(path);
    }

    final var orderBy = specification.orderBy();
    final var orderByDescending = specification.orderByDescending();
    if (orderBy.isPresent()) {
      query = query.orderBy(orderBy.get());
    } else if (orderByDescending.isPresent()) {
      query = query.orderByDescending(orderByDescending.get());
    }

    if (specification.isPagingEnabled()) {
      query = query.skip(specification.skip().getAsInt()).take(specification.take().getAsInt());
    }

    return query;
  }
}
