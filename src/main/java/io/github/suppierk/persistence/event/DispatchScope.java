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

import io.github.suppierk.persistence.Suspicious;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Isolated resolution scope of one dispatch batch.
 *
 * <p>Scoped collaborators are created on first request and shared by every handler of the batch.
 * When the scope is closed, every collaborator implementing {@link AutoCloseable} is closed in the
 * reverse order of creation.
 */
public final class DispatchScope extends Suspicious implements AutoCloseable {
  private final Map<Class<?>, Object> instances;
  private boolean closed;

  public DispatchScope() {
    this.instances = new LinkedHashMap<>();
    this.closed = false;
  }

  /**
   * @param type of the collaborator, used as the key within the scope
   * @param factory to create the collaborator if this scope does not have it yet
   * @param <T> is the type of the collaborator
   * @return the collaborator instance bound to this scope
   * @throws IllegalArgumentException if any argument is {@code null}
   * @throws IllegalStateException if the scope is closed or the factory returned {@code null}
   */
  public <T> T get(final Class<T> type, final Supplier<? extends T> factory) {
    final Class<T> nonNullType = throwIllegalArgumentIfNull(type, "Scoped type");
    final Supplier<? extends T> nonNullFactory =
        throwIllegalArgumentIfNull(factory, "Scoped instance factory");

    if (closed) {
      throw new IllegalStateException("Dispatch scope is closed");
    }

    final Object existing = instances.get(nonNullType);
    if (existing != null) {
      return nonNullType.cast(existing);
    }

    final T created =
        throwIllegalStateIfNull(
            nonNullFactory.get(), "Scoped %s".formatted(nonNullType.getSimpleName()));
    instances.put(nonNullType, created);
    return created;
  }

  /**
   * @return {@code true} if this scope was closed
   */
  public boolean isClosed() {
    return closed;
  }

  /**
   * Closes scoped collaborators, the first failure is rethrown with the others attached as
   * suppressed exceptions.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }

    closed = true;

    final List<Object> reversed = new ArrayList<>(instances.values());
    Collections.reverse(reversed);
    instances.clear();

    IllegalStateException failure = null;
    for (Object instance : reversed) {
      if (instance instanceof AutoCloseable closeable) {
        try {
          closeable.close();
        } catch (Exception e) {
          if (failure == null) {
            failure = new IllegalStateException("Unable to close dispatch scope", e);
          } else {
            failure.addSuppressed(e);
          }
        }
      }
    }

    if (failure != null) {
      throw failure;
    }
  }
}
