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

import java.io.Serializable;

/**
 * Represents something that happened inside an {@link AggregateRoot}.
 *
 * <p>The payload is domain-specific and opaque to the dispatch mechanism. Events might be stored in
 * an outbox or placed in a message queue - this is the reason this interface extends {@link
 * Serializable}.
 */
public interface DomainEvent extends Serializable {}
