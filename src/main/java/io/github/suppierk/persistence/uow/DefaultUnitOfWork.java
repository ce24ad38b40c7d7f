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

package io.github.suppierk.persistence.uow;

import io.github.suppierk.persistence.Suspicious;
import io.github.suppierk.persistence.model.BaseEntity;
import io.github.suppierk.persistence.repository.GenericRepository;
import io.github.suppierk.persistence.repository.Repository;
import io.github.suppierk.persistence.repository.SaveState;
import io.github.suppierk.persistence.session.EntryState;
import io.github.suppierk.persistence.session.PersistenceSession;
import io.github.suppierk.persistence.session.TrackedEntry;
import io.vavr.CheckedFunction0;
import io.vavr.CheckedRunnable;
import io.vavr.control.Try;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link UnitOfWork} owning a single {@link PersistenceSession}. */
public final class DefaultUnitOfWork extends Suspicious implements UnitOfWork {
  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultUnitOfWork.class);

  private final PersistenceSession session;

  /**
   * @param session to own, it is closed together with this unit of work
   * @throws IllegalArgumentException if session is {@code null}
   */
  public DefaultUnitOfWork(final PersistenceSession session) {
    this.session = throwIllegalArgumentIfNull(session, "Persistence session");
  }

  @Override
  public boolean commit() {
    return Try.of(session::flush)
        .onFailure(e -> LOGGER.error("Unable to commit unit of work", e))
        .isSuccess();
  }

  @Override
  public void rollback() {
    for (TrackedEntry entry : session.entries()) {
      switch (entry.state()) {
        case MODIFIED, DELETED -> entry.setState(EntryState.UNCHANGED);
        case ADDED -> entry.setState(EntryState.DETACHED);
        default -> {
          // Nothing to discard
        }
      }
    }
  }

  @Override
  public boolean execute(
      final CheckedRunnable action, final Consumer<PersistenceSession> onFailed) {
    final CheckedRunnable nonNullAction = throwIllegalArgumentIfNull(action, "Action");
    final Consumer<PersistenceSession> nonNullOnFailed =
        throwIllegalArgumentIfNull(onFailed, "On failed");

    final boolean succeeded =
        Try.run(nonNullAction)
                .onFailure(e -> LOGGER.error("Unit of work action failed", e))
                .isSuccess()
            && commit();

    if (!succeeded) {
      nonNullOnFailed.accept(session);
    }

    return succeeded;
  }

  @Override
  public <R> R executeResult(
      final CheckedFunction0<R> action, final Function<PersistenceSession, R> onFailed) {
    final CheckedFunction0<R> nonNullAction = throwIllegalArgumentIfNull(action, "Action");
    final Function<PersistenceSession, R> nonNullOnFailed =
        throwIllegalArgumentIfNull(onFailed, "On failed");

    final Try<R> result =
        Try.of(nonNullAction).onFailure(e -> LOGGER.error("Unit of work action failed", e));

    if (result.isSuccess() && commit()) {
      return result.get();
    }

    return nonNullOnFailed.apply(session);
  }

  @Override
  public PersistenceSession session() {
    return session;
  }

  @Override
  public <E extends BaseEntity> Repository<E> repository(final Class<E> entityType) {
    return new GenericRepository<>(entityType, session, SaveState.partOfUnitOfWork());
  }

  @Override
  public void close() {
    session.close();
  }
}
