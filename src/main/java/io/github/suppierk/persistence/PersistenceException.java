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

package io.github.suppierk.persistence;

import java.io.Serial;

/**
 * A specific {@link Exception} to be thrown when a persistence session cannot honor its contract:
 * the session is closed, the calling thread was interrupted or a tracked row disappeared before
 * the change could be written.
 *
 * <p>A jOOQ {@link org.jooq.exception.DataAccessException} raised while flushing is wrapped into
 * this type and kept as its cause.
 */
public class PersistenceException extends RuntimeException {
  @Serial private static final long serialVersionUID = -4127339865021593470L;

  /** Constructs a new exception with {@code null} as its detail message. */
  public PersistenceException() {
    super();
  }

  /**
   * @param message the detail message
   */
  public PersistenceException(String message) {
    super(message);
  }

  /**
   * @param message the detail message
   * @param cause the cause, {@code null} is permitted and indicates that the cause is unknown
   */
  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * @param cause the cause, {@code null} is permitted and indicates that the cause is unknown
   */
  public PersistenceException(Throwable cause) {
    super(cause);
  }
}
