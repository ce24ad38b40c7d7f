package io.github.suppierk.test;

import io.github.suppierk.persistence.model.DomainEvent;
import io.github.suppierk.persistence.model.EntityId;

public record OrderShipped(EntityId orderId) implements DomainEvent {}
