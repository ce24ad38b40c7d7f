package io.github.suppierk.persistence.event;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.persistence.model.DomainEvent;
import io.github.suppierk.persistence.model.EntityId;
import io.github.suppierk.test.OrderPlaced;
import io.github.suppierk.test.OrderShipped;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ScopedDomainEventDispatcherTest {
  static final EntityId ORDER_ID = EntityId.newId();

  @Nested
  class Construction {
    @Test
    void when_any_of_the_constructor_arguments_is_null_throw_illegal_argument_exception() {
      assertThrows(IllegalArgumentException.class, () -> new ScopedDomainEventDispatcher(null));
      assertThrows(
          IllegalArgumentException.class,
          () -> new ScopedDomainEventDispatcher(DomainEventHandlers.empty(), null));
      assertDoesNotThrow(() -> new ScopedDomainEventDispatcher(DomainEventHandlers.empty()));
    }

    @Test
    void when_registering_null_handler_illegal_argument_must_be_thrown() {
      final var builder = DomainEventHandlers.builder();

      assertThrows(
          IllegalArgumentException.class, () -> builder.register(OrderPlaced.class, null));
      assertThrows(
          IllegalArgumentException.class, () -> builder.register(null, event -> {}));
      assertTrue(builder.build().isEmpty());
    }
  }

  @Nested
  class Dispatch {
    @Test
    void events_must_be_handled_in_order_by_handlers_in_registration_order() {
      final List<String> handled = new ArrayList<>();
      final var dispatcher =
          new ScopedDomainEventDispatcher(
              DomainEventHandlers.builder()
                  .register(OrderPlaced.class, event -> handled.add("placed-1:" + event.customer()))
                  .register(OrderShipped.class, event -> handled.add("shipped"))
                  .register(OrderPlaced.class, event -> handled.add("placed-2:" + event.customer()))
                  .build());

      dispatcher.dispatch(
          List.of(
              new OrderPlaced(ORDER_ID, "alice"),
              new OrderShipped(ORDER_ID),
              new OrderPlaced(ORDER_ID, "bob")));

      assertEquals(
          List.of(
              "placed-1:alice", "placed-2:alice", "shipped", "placed-1:bob", "placed-2:bob"),
          handled);
    }

    @Test
    void events_must_be_matched_by_exact_class_only() {
      final AtomicInteger handled = new AtomicInteger();
      final var dispatcher =
          new ScopedDomainEventDispatcher(
              DomainEventHandlers.builder()
                  .register(BaseEvent.class, event -> handled.incrementAndGet())
                  .build());

      dispatcher.dispatch(List.of(new DerivedEvent()));
      assertEquals(0, handled.get());

      dispatcher.dispatch(List.of(new BaseEvent()));
      assertEquals(1, handled.get());
    }

    @Test
    void events_without_handlers_must_be_ignored() {
      final var dispatcher = new ScopedDomainEventDispatcher(DomainEventHandlers.empty());
      assertDoesNotThrow(() -> dispatcher.dispatch(List.of(new OrderShipped(ORDER_ID))));
      assertDoesNotThrow(() -> dispatcher.dispatch(List.of()));
    }

    @Test
    void null_event_must_be_rejected() {
      final var dispatcher = new ScopedDomainEventDispatcher(DomainEventHandlers.empty());

      assertThrows(IllegalArgumentException.class, () -> dispatcher.dispatch(null));
      assertThrows(
          IllegalStateException.class,
          () -> dispatcher.dispatch(Arrays.asList(new OrderShipped(ORDER_ID), null)));
    }
  }

  @Nested
  class Scoping {
    @Test
    void one_scope_must_be_shared_by_the_whole_batch_and_closed_afterwards() {
      final List<DispatchScope> scopes = new ArrayList<>();
      final List<DispatchScope> seen = new ArrayList<>();
      final var dispatcher =
          new ScopedDomainEventDispatcher(
              DomainEventHandlers.builder()
                  .registerScoped(
                      OrderPlaced.class,
                      scope -> {
                        seen.add(scope);
                        return event -> {};
                      })
                  .build(),
              () -> {
                final var scope = new DispatchScope();
                scopes.add(scope);
                return scope;
              });

      dispatcher.dispatch(
          List.of(new OrderPlaced(ORDER_ID, "alice"), new OrderPlaced(ORDER_ID, "bob")));
      dispatcher.dispatch(List.of(new OrderPlaced(ORDER_ID, "carol")));

      assertEquals(2, scopes.size());
      assertEquals(3, seen.size());
      assertSame(seen.get(0), seen.get(1));
      assertNotSame(seen.get(1), seen.get(2));
      assertTrue(scopes.get(0).isClosed());
      assertTrue(scopes.get(1).isClosed());
    }

    @Test
    void handlers_must_be_created_on_every_dispatch() {
      final AtomicInteger created = new AtomicInteger();
      final var dispatcher =
          new ScopedDomainEventDispatcher(
              DomainEventHandlers.builder()
                  .registerScoped(
                      OrderShipped.class,
                      scope -> {
                        created.incrementAndGet();
                        return event -> {};
                      })
                  .build());

      dispatcher.dispatch(List.of(new OrderShipped(ORDER_ID)));
      dispatcher.dispatch(List.of(new OrderShipped(ORDER_ID)));

      assertEquals(2, created.get());
    }

    @Test
    void scoped_collaborators_must_be_shared_within_a_batch() {
      final List<Counter> counters = new ArrayList<>();
      final var dispatcher =
          new ScopedDomainEventDispatcher(
              DomainEventHandlers.builder()
                  .registerScoped(
                      OrderShipped.class,
                      scope -> {
                        final var counter = scope.get(Counter.class, Counter::new);
                        counters.add(counter);
                        return event -> counter.value++;
                      })
                  .build());

      dispatcher.dispatch(List.of(new OrderShipped(ORDER_ID), new OrderShipped(ORDER_ID)));

      assertEquals(2, counters.size());
      assertSame(counters.get(0), counters.get(1));
      assertEquals(2, counters.get(0).value);
    }

    @Test
    void null_handler_from_factory_must_be_rejected() {
      final var dispatcher =
          new ScopedDomainEventDispatcher(
              DomainEventHandlers.builder()
                  .registerScoped(OrderShipped.class, scope -> null)
                  .build());

      assertThrows(
          IllegalStateException.class,
          () -> dispatcher.dispatch(List.of(new OrderShipped(ORDER_ID))));
    }
  }

  @Nested
  class Failures {
    @Test
    void handler_failure_must_stop_the_batch_and_be_wrapped() {
      final List<String> handled = new ArrayList<>();
      final List<DispatchScope> scopes = new ArrayList<>();
      final var failingEvent = new OrderShipped(ORDER_ID);
      final var dispatcher =
          new ScopedDomainEventDispatcher(
              DomainEventHandlers.builder()
                  .register(OrderPlaced.class, event -> handled.add(event.customer()))
                  .register(
                      OrderShipped.class,
                      event -> {
                        throw new Exception("cannot ship");
                      })
                  .build(),
              () -> {
                final var scope = new DispatchScope();
                scopes.add(scope);
                return scope;
              });

      final var exception =
          assertThrows(
              DomainEventDispatchException.class,
              () ->
                  dispatcher.dispatch(
                      List.of(
                          new OrderPlaced(ORDER_ID, "alice"),
                          failingEvent,
                          new OrderPlaced(ORDER_ID, "bob"))));

      assertEquals(List.of("alice"), handled);
      assertSame(failingEvent, exception.getEvent());
      assertEquals("cannot ship", exception.getCause().getMessage());
      assertTrue(scopes.get(0).isClosed());
    }

    @Test
    void no_op_dispatcher_must_ignore_events() {
      assertDoesNotThrow(
          () -> DomainEventDispatcher.noOp().dispatch(List.of(new OrderShipped(ORDER_ID))));
    }
  }

  static class BaseEvent implements DomainEvent {}

  static class DerivedEvent extends BaseEvent {}

  static final class Counter {
    int value;
  }
}
