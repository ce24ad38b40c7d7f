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

import io.github.suppierk.persistence.Suspicious;
import io.github.suppierk.persistence.model.BaseEntity;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.jooq.Condition;
import org.jooq.Field;

/**
 * Declarative description of a query over one entity type, turned into an executable query by
 * {@link SpecificationEvaluator}.
 *
 * <p>Paging values are only meaningful when {@link #isPagingEnabled()} is {@code true}.
 *
 * @param <E> is the type of the queried entity
 */
public interface Specification<E extends BaseEntity> {
  /**
   * @param type of the queried entity
   * @param <E> is the type of the queried entity
   * @return a new builder
   */
  static <E extends BaseEntity> Builder<E> builder(final Class<E> type) {
    if (type == null) {
      throw new IllegalArgumentException("Entity type cannot be null");
    }

    return new Builder<>();
  }

  Optional<Condition> criteria();

  List<Include<E>> includes();

  List<String> includePaths();

  Optional<Field<?>> orderBy();

  Optional<Field<?>> orderByDescending();

  OptionalInt skip();

  OptionalInt take();

  boolean isPagingEnabled();

  /**
   * Builder of immutable specifications.
   *
   * @param <E> is the type of the queried entity
   */
  final class Builder<E extends BaseEntity> extends Suspicious {
    private Condition criteria;
    private final List<Include<E>> includes;
    private final List<String> includePaths;
    private Field<?> orderBy;
    private Field<?> orderByDescending;
    private int skip;
    private int take;
    private boolean pagingEnabled;

    private Builder() {
      this.includes = new ArrayList<>();
      this.includePaths = new ArrayList<>();
    }

    /**
     * @param condition to filter with, combined with previous filters using {@code AND}
     * @return this builder
     */
    public Builder<E> where(final Condition condition) {
      final Condition nonNullCondition = throwIllegalArgumentIfNull(condition, "Condition");
      criteria = criteria == null ? nonNullCondition : criteria.and(nonNullCondition);
      return this;
    }

    public Builder<E> include(final Include<E> include) {
      includes.add(throwIllegalArgumentIfNull(include, "Include"));
      return this;
    }

    public Builder<E> include(final String path) {
      final String nonNullPath = throwIllegalArgumentIfNull(path, "Include path");

      if (nonNullPath.isBlank()) {
        throw new IllegalArgumentException("Include path cannot be blank");
      }

      includePaths.add(nonNullPath);
      return this;
    }

    /**
     * @param field to sort ascending by
     * @return this builder
     * @throws IllegalStateException if descending order was already set
     */
    public Builder<E> orderBy(final Field<?> field) {
      final Field<?> nonNullField = throwIllegalArgumentIfNull(field, "Order field");

      if (orderByDescending != null) {
        throw new IllegalStateException("Descending order is already set");
      }

      orderBy = nonNullField;
      return this;
    }

    /**
     * @param field to sort descending by
     * @return this builder
     * @throws IllegalStateException if ascending order was already set
     */
    public Builder<E> orderByDescending(final Field<?> field) {
      final Field<?> nonNullField = throwIllegalArgumentIfNull(field, "Order field");

      if (orderBy != null) {
        throw new IllegalStateException("Ascending order is already set");
      }

      orderByDescending = nonNullField;
      return this;
    }

    /**
     * Enables paging.
     *
     * @param skip number of rows to skip, zero or more
     * @param take number of rows to return, one or more
     * @return this builder
     * @throws IllegalArgumentException if any value is out of range
     */
    public Builder<E> page(final int skip, final int take) {
      if (skip < 0) {
        throw new IllegalArgumentException("Skip cannot be negative, got %d".formatted(skip));
      }

      if (take <= 0) {
        throw new IllegalArgumentException("Take must be positive, got %d".formatted(take));
      }

      this.skip = skip;
      this.take = take;
      this.pagingEnabled = true;
      return this;
    }

    public Specification<E> build() {
      return new Immutable<>(this);
    }
  }

  /** Value built by {@link Builder}. */
  final class Immutable<E extends BaseEntity> implements Specification<E> {
    private final Condition criteria;
    private final List<Include<E>> includes;
    private final List<String> includePaths;
    private final Field<?> orderBy;
    private final Field<?> orderByDescending;
    private final OptionalInt skip;
    private final OptionalInt take;

    private Immutable(final Builder<E> builder) {
      this.criteria = builder.criteria;
      this.includes = List.copyOf(builder.includes);
      this.includePaths = List.copyOf(builder.includePaths);
      this.orderBy = builder.orderBy;
      this.orderByDescending = builder.orderByDescending;
      this.skip = builder.pagingEnabled ? OptionalInt.of(builder.skip) : OptionalInt.empty();
      this.take = builder.pagingEnabled ? OptionalInt.of(builder.take) : OptionalInt.empty();
    }

    @Override
    public Optional<Condition> criteria() {
      return Optional.ofNullable(criteria);
    }

    @Override
    public List<Include<E>> includes() {
      return includes;
    }

    @Override
    public List<String> includePaths() {
      return includePaths;
    }

    @Override
    public Optional<Field<?>> orderBy() {
      return Optional.ofNullable(orderBy);
    }

    @Override
    public Optional<Field<?>> orderByDescending() {
      return Optional.ofNullable(orderByDescending);
    }

    @Override
    public OptionalInt skip() {
      return skip;
    }

    @Override
    public OptionalInt take() {
      return take;
    }

    @Override
    public boolean isPagingEnabled() {
      return skip.isPresent();
    }
  }
}
