package io.github.suppierk.persistence.repository;

import static io.github.suppierk.test.OrderMapping.CUSTOMER;
import static io.github.suppierk.test.OrderMapping.ID;
import static io.github.suppierk.test.OrderMapping.ORDERS;
import static io.github.suppierk.test.OrderMapping.PRIORITY;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.persistence.PersistenceException;
import io.github.suppierk.persistence.jooq.JooqPersistenceSession;
import io.github.suppierk.persistence.jooq.JooqSessionFactory;
import io.github.suppierk.persistence.model.EntityId;
import io.github.suppierk.persistence.specification.Specification;
import io.github.suppierk.test.Order;
import io.github.suppierk.test.OrderMapping;
import io.github.suppierk.test.TestDatabase;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GenericRepositoryTest {
  static final DSLContext DSL_CONTEXT = TestDatabase.create("generic_repository");
  static final JooqSessionFactory SESSION_FACTORY =
      JooqSessionFactory.builder(DSL_CONTEXT).mapping(new OrderMapping()).build();

  JooqPersistenceSession session;
  Repository<Order> repository;

  @BeforeEach
  void setUp() {
    TestDatabase.truncate(DSL_CONTEXT);
    session = SESSION_FACTORY.openSession();
    repository = new GenericRepository<>(Order.class, session);
  }

  @AfterEach
  void tearDown() {
    session.close();
  }

  static Order stored(String customer, int priority) {
    try (var otherSession = SESSION_FACTORY.openSession()) {
      final var order = Order.draft(customer, priority);
      otherSession.add(order);
      otherSession.flush();
      return order;
    }
  }

  static int rowsOf(EntityId id) {
    return DSL_CONTEXT.fetchCount(ORDERS, ID.eq(id.value()));
  }

  @Nested
  class Construction {
    @Test
    void when_any_of_the_constructor_arguments_is_null_throw_illegal_argument_exception() {
      assertThrows(IllegalArgumentException.class, () -> new GenericRepository<>(null, session));
      assertThrows(
          IllegalArgumentException.class, () -> new GenericRepository<>(Order.class, null));
      assertThrows(
          IllegalArgumentException.class,
          () -> new GenericRepository<>(Order.class, session, null));
      assertDoesNotThrow(
          () -> new GenericRepository<>(Order.class, session, SaveState.partOfUnitOfWork()));
    }

    @Test
    void default_state_must_be_local_save() {
      assertSame(SaveState.localSave(), repository.state());
    }

    @Test
    void switching_state_must_return_new_repository() {
      final var deferred = repository.withState(SaveState.partOfUnitOfWork());

      assertNotSame(repository, deferred);
      assertSame(SaveState.partOfUnitOfWork(), deferred.state());
      assertSame(SaveState.localSave(), repository.state());
    }

    @Test
    void null_arguments_must_be_rejected() {
      assertThrows(IllegalArgumentException.class, () -> repository.insert((Order) null));
      assertThrows(
          IllegalArgumentException.class, () -> repository.insert(Arrays.asList((Order) null)));
      assertThrows(IllegalArgumentException.class, () -> repository.update((Order) null));
      assertThrows(IllegalArgumentException.class, () -> repository.delete((EntityId) null));
      assertThrows(
          IllegalArgumentException.class, () -> repository.delete((Condition) null));
      assertThrows(IllegalArgumentException.class, () -> repository.list(null));
    }
  }

  @Nested
  class LocalSave {
    @Test
    void insert_must_write_immediately() {
      final var order = Order.draft("alice", 1);

      assertTrue(repository.insert(order));
      assertEquals(1, rowsOf(order.id()));
    }

    @Test
    void inserting_collection_must_write_every_entity() {
      assertTrue(repository.insert(List.of(Order.draft("alice", 1), Order.draft("bob", 2))));
      assertEquals(2, DSL_CONTEXT.fetchCount(ORDERS));
    }

    @Test
    void update_must_write_immediately() {
      final var order = stored("alice", 1);
      final var loaded = repository.findById(order.id()).orElseThrow();
      loaded.changeCustomer("bob");

      assertTrue(repository.update(loaded));
      assertEquals(1, DSL_CONTEXT.fetchCount(ORDERS, CUSTOMER.eq("bob")));
    }

    @Test
    void updating_vanished_row_must_report_false() {
      final var order = stored("alice", 1);
      final var loaded = repository.findById(order.id()).orElseThrow();
      DSL_CONTEXT.deleteFrom(ORDERS).execute();

      loaded.changeCustomer("bob");

      assertFalse(repository.update(loaded));
    }

    @Test
    void delete_by_id_must_remove_existing_row() {
      final var order = stored("alice", 1);

      assertTrue(repository.delete(order.id()));
      assertEquals(0, rowsOf(order.id()));
    }

    @Test
    void delete_by_missing_id_must_report_false() {
      assertFalse(repository.delete(EntityId.newId()));
    }

    @Test
    void delete_by_entity_and_collection_must_remove_rows() {
      final var first = stored("alice", 1);
      final var second = stored("bob", 2);
      final var third = stored("carol", 3);

      assertTrue(repository.delete(repository.findById(first.id()).orElseThrow()));
      assertTrue(
          repository.delete(
              List.of(
                  repository.findById(second.id()).orElseThrow(),
                  repository.findById(third.id()).orElseThrow())));
      assertEquals(0, DSL_CONTEXT.fetchCount(ORDERS));
    }

    @Test
    void delete_by_condition_must_remove_matching_rows() {
      stored("alice", 1);
      stored("bob", 2);
      stored("carol", 3);

      assertTrue(repository.delete(PRIORITY.ge(2)));
      assertEquals(1, DSL_CONTEXT.fetchCount(ORDERS));
    }

    @Test
    void save_without_changes_must_report_false() {
      assertFalse(repository.save());
    }
  }

  @Nested
  class PartOfUnitOfWork {
    @Test
    void mutations_must_wait_for_flush() {
      final var deferred = repository.withState(SaveState.partOfUnitOfWork());
      final var order = Order.draft("alice", 1);

      assertTrue(deferred.insert(order));
      assertEquals(0, rowsOf(order.id()));

      assertTrue(repository.save());
      assertEquals(1, rowsOf(order.id()));
    }

    @Test
    void save_must_not_touch_the_session() {
      final var deferred = repository.withState(SaveState.partOfUnitOfWork());
      session.close();

      assertTrue(deferred.save());
    }

    @Test
    void delete_by_missing_id_must_report_true() {
      final var deferred = repository.withState(SaveState.partOfUnitOfWork());
      assertTrue(deferred.delete(EntityId.newId()));
    }
  }

  @Nested
  class InsertIfNotExists {
    @Test
    void existing_entity_must_short_circuit() {
      stored("alice", 1);
      final AtomicBoolean created = new AtomicBoolean(false);

      final String result =
          repository.insertIfNotExists(
              CUSTOMER.eq("alice"),
              () -> "exists",
              () -> {
                created.set(true);
                return Order.draft("alice", 1);
              },
              inserted -> "inserted");

      assertEquals("exists", result);
      assertFalse(created.get());
      assertEquals(1, DSL_CONTEXT.fetchCount(ORDERS));
    }

    @Test
    void remaining_match_must_short_circuit_when_another_is_pending_deletion() {
      final var first = stored("same", 1);
      stored("same", 2);
      final var deferred = repository.withState(SaveState.partOfUnitOfWork());

      assertTrue(deferred.delete(deferred.findById(first.id()).orElseThrow()));

      final String result =
          deferred.insertIfNotExists(
              CUSTOMER.eq("same"),
              () -> "exists",
              () -> Order.draft("same", 3),
              inserted -> "inserted");

      assertEquals("exists", result);
      assertEquals(1, deferred.query().where(CUSTOMER.eq("same")).fetch().size());
      assertEquals(2, DSL_CONTEXT.fetchCount(ORDERS));
    }

    @Test
    void missing_entity_must_be_inserted() {
      final Optional<Order> result =
          repository.insertIfNotExists(
              CUSTOMER.eq("alice"),
              Optional::empty,
              () -> Order.draft("alice", 1),
              inserted -> inserted);

      assertTrue(result.isPresent());
      assertEquals(1, rowsOf(result.get().id()));
    }

    @Test
    void failed_insert_must_pass_empty_result() {
      final var existing = stored("alice", 1);
      final var conflicting = Order.draft("bob", 2);
      conflicting.assignId(existing.id());

      final Optional<Order> result =
          repository.insertIfNotExists(
              CUSTOMER.eq("bob"), Optional::empty, () -> conflicting, inserted -> inserted);

      assertTrue(result.isEmpty());
    }

    @Test
    void null_entity_from_factory_must_be_rejected() {
      assertThrows(
          IllegalStateException.class,
          () ->
              repository.insertIfNotExists(
                  CUSTOMER.eq("alice"), () -> "exists", () -> null, inserted -> "inserted"));
    }

    @Test
    void lookup_failure_must_propagate() {
      session.close();

      assertThrows(
          PersistenceException.class,
          () ->
              repository.insertIfNotExists(
                  CUSTOMER.eq("alice"),
                  () -> "exists",
                  () -> Order.draft("alice", 1),
                  inserted -> "inserted"));
    }
  }

  @Nested
  class UpdateOrNotFound {
    @Test
    void missing_entity_must_short_circuit() {
      final String result =
          repository.updateOrNotFound(
              EntityId.newId(),
              () -> "not found",
              updated -> "updated",
              order -> {
                throw new AssertionError("Update must not be invoked");
              });

      assertEquals("not found", result);
    }

    @Test
    void existing_entity_must_be_updated() {
      final var order = stored("alice", 1);

      final Optional<Order> result =
          repository.updateOrNotFound(
              order.id(),
              Optional::empty,
              updated -> updated,
              loaded -> {
                loaded.changeCustomer("bob");
                return loaded;
              });

      assertEquals("bob", result.orElseThrow().customer());
      assertEquals(1, DSL_CONTEXT.fetchCount(ORDERS, CUSTOMER.eq("bob")));
    }

    @Test
    void failed_update_must_pass_empty_result() {
      final var order = stored("alice", 1);

      final Optional<Order> result =
          repository.updateOrNotFound(
              order.id(),
              Optional::empty,
              updated -> updated,
              loaded -> {
                DSL_CONTEXT.deleteFrom(ORDERS).execute();
                loaded.changeCustomer("bob");
                return loaded;
              });

      assertTrue(result.isEmpty());
    }

    @Test
    void null_entity_from_update_must_be_rejected() {
      final var order = stored("alice", 1);

      assertThrows(
          IllegalStateException.class,
          () ->
              repository.updateOrNotFound(
                  order.id(), () -> "not found", updated -> "updated", loaded -> null));
    }

    @Test
    void lookup_failure_must_propagate() {
      session.close();

      assertThrows(
          PersistenceException.class,
          () ->
              repository.updateOrNotFound(
                  EntityId.newId(), () -> "not found", updated -> "updated", loaded -> loaded));
    }
  }

  @Nested
  class Queries {
    @Test
    void specification_queries_must_return_matching_entities() {
      stored("alice", 1);
      stored("bob", 2);
      stored("carol", 3);

      final var specification =
          Specification.builder(Order.class).where(PRIORITY.ge(2)).orderBy(PRIORITY).build();

      assertEquals(
          List.of("bob", "carol"),
          repository.list(specification).stream().map(Order::customer).toList());
      assertEquals("bob", repository.first(specification).orElseThrow().customer());
      assertEquals(2, repository.count(specification));
      assertEquals(3, repository.query().count());
    }

    @Test
    void failures_must_be_reported_as_empty_results() {
      stored("alice", 1);
      session.close();

      final var specification = Specification.builder(Order.class).build();

      assertFalse(repository.insert(Order.draft("bob", 2)));
      assertFalse(repository.save());
      assertTrue(repository.findById(EntityId.newId()).isEmpty());
      assertTrue(repository.list(specification).isEmpty());
      assertTrue(repository.first(specification).isEmpty());
      assertEquals(0, repository.count(specification));
    }
  }
}
