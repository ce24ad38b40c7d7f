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

package io.github.suppierk.persistence.model;

import java.io.Serial;
import java.io.Serializable;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Base for immutable descriptive types which have no identity.
 *
 * <p>Two value objects are equal when they have the same concrete class and their {@link
 * #equalityComponents()} are equal element by element, so copies are interchangeable.
 *
 * <p>Implementations must be immutable and must always return components in the same order.
 */
public abstract class ValueObject implements Serializable {
  @Serial private static final long serialVersionUID = 5712866031874403365L;

  /**
   * @return ordered list of values which define equality of this object, {@code null} elements
   *     are permitted
   */
  protected abstract List<?> equalityComponents();

  @Override
  public final boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final Iterator<?> left = equalityComponents().iterator();
    final Iterator<?> right = ((ValueObject) o).equalityComponents().iterator();

    while (left.hasNext() && right.hasNext()) {
      if (!Objects.equals(left.next(), right.next())) {
        return false;
      }
    }

    return !left.hasNext() && !right.hasNext();
  }

  @Override
  public final int hashCode() {
    int hash = 0;

    for (Object component : equalityComponents()) {
      hash ^= Objects.hashCode(component);
    }

    return hash;
  }
}
