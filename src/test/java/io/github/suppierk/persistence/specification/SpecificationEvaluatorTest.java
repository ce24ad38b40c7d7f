package io.github.suppierk.persistence.specification;

import static io.github.suppierk.test.OrderMapping.CUSTOMER;
import static io.github.suppierk.test.OrderMapping.PRIORITY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.persistence.jooq.JooqSessionFactory;
import io.github.suppierk.persistence.session.EntityQuery;
import io.github.suppierk.test.Order;
import io.github.suppierk.test.OrderMapping;
import io.github.suppierk.test.TestDatabase;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalInt;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

class SpecificationEvaluatorTest {
  static final DSLContext DSL_CONTEXT = TestDatabase.create("specification_evaluator");
  static final JooqSessionFactory SESSION_FACTORY =
      JooqSessionFactory.builder(DSL_CONTEXT).mapping(new OrderMapping()).build();

  @Test
  void null_arguments_must_be_rejected() {
    final var query = new RecordingQuery(new ArrayList<>());

    assertThrows(
        IllegalArgumentException.class, () -> SpecificationEvaluator.evaluate(query, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> SpecificationEvaluator.evaluate(null, Specification.builder(Order.class).build()));
  }

  @Nested
  class Composition {
    @Test
    void parts_must_be_applied_in_fixed_order() {
      final List<String> calls = new ArrayList<>();
      final var specification =
          Specification.builder(Order.class)
              .page(5, 10)
              .orderByDescending(PRIORITY)
              .include("lines")
              .include(OrderMapping.LINES)
              .where(PRIORITY.gt(1))
              .build();

      SpecificationEvaluator.evaluate(new RecordingQuery(calls), specification);

      assertEquals(
          List.of(
              "where",
              "include:lines",
              "include-path:lines",
              "order-by-descending",
              "skip:5",
              "take:10"),
          calls);
    }

    @Test
    void empty_specification_must_leave_query_untouched() {
      final List<String> calls = new ArrayList<>();

      SpecificationEvaluator.evaluate(
          new RecordingQuery(calls), Specification.builder(Order.class).build());

      assertEquals(List.of(), calls);
    }

    @Test
    void ascending_order_must_win_for_foreign_specifications() {
      final List<String> calls = new ArrayList<>();

      SpecificationEvaluator.evaluate(new RecordingQuery(calls), new BothOrders(false));

      assertEquals(List.of("order-by"), calls);
    }

    @Test
    void paging_without_values_must_fail() {
      assertThrows(
          NoSuchElementException.class,
          () ->
              SpecificationEvaluator.evaluate(
                  new RecordingQuery(new ArrayList<>()), new BothOrders(true)));
    }
  }

  @Nested
  @TestInstance(TestInstance.Lifecycle.PER_CLASS)
  class Paging {
    @BeforeAll
    void seed() {
      TestDatabase.truncate(DSL_CONTEXT);

      try (var session = SESSION_FACTORY.openSession()) {
        for (int i = 1; i <= 25; i++) {
          session.add(Order.draft("customer-%02d".formatted(i), i));
        }

        session.flush();
      }
    }

    List<Integer> page(int skip) {
      try (var session = SESSION_FACTORY.openSession()) {
        final var specification =
            Specification.builder(Order.class).orderBy(PRIORITY).page(skip, 10).build();

        return SpecificationEvaluator.evaluate(session.query(Order.class), specification)
            .fetch()
            .stream()
            .map(Order::priority)
            .toList();
      }
    }

    @Test
    void pages_of_ten_over_twenty_five_rows_must_be_ten_ten_and_five() {
      final var first = page(0);
      final var second = page(10);
      final var third = page(20);

      assertEquals(10, first.size());
      assertEquals(10, second.size());
      assertEquals(5, third.size());
      assertEquals(1, first.get(0));
      assertEquals(11, second.get(0));
      assertEquals(25, third.get(4));
    }

    @Test
    void repeated_evaluation_must_return_identical_pages() {
      assertEquals(page(10), page(10));
    }

    @Test
    void criteria_and_descending_order_must_be_applied() {
      try (var session = SESSION_FACTORY.openSession()) {
        final var specification =
            Specification.builder(Order.class)
                .where(CUSTOMER.like("customer-1%"))
                .orderByDescending(PRIORITY)
                .build();

        final var query =
            SpecificationEvaluator.evaluate(session.query(Order.class), specification);

        assertEquals(10, query.count());
        assertEquals(19, query.fetchFirst().orElseThrow().priority());
      }
    }
  }

  /** Records the calls made by the evaluator. */
  static final class RecordingQuery implements EntityQuery<Order> {
    private final List<String> calls;

    RecordingQuery(List<String> calls) {
      this.calls = calls;
    }

    private EntityQuery<Order> record(String call) {
      calls.add(call);
      return this;
    }

    @Override
    public EntityQuery<Order> where(Condition condition) {
      return record("where");
    }

    @Override
    public EntityQuery<Order> include(Include<Order> include) {
      return record("include:" + include.path());
    }

    @Override
    public EntityQuery<Order> include(String path) {
      return record("include-path:" + path);
    }

    @Override
    public EntityQuery<Order> orderBy(Field<?> field) {
      return record("order-by");
    }

    @Override
    public EntityQuery<Order> orderByDescending(Field<?> field) {
      return record("order-by-descending");
    }

    @Override
    public EntityQuery<Order> skip(int count) {
      return record("skip:" + count);
    }

    @Override
    public EntityQuery<Order> take(int count) {
      return record("take:" + count);
    }

    @Override
    public List<Order> fetch() {
      return List.of();
    }

    @Override
    public Optional<Order> fetchFirst() {
      return Optional.empty();
    }

    @Override
    public int count() {
      return 0;
    }
  }

  /** Specification built outside of the builder, with both orders and optional broken paging. */
  record BothOrders(boolean isPagingEnabled) implements Specification<Order> {
    @Override
    public Optional<Condition> criteria() {
      return Optional.empty();
    }

    @Override
    public List<Include<Order>> includes() {
      return List.of();
    }

    @Override
    public List<String> includePaths() {
      return List.of();
    }

    @Override
    public Optional<Field<?>> orderBy() {
      return Optional.of(PRIORITY);
    }

    @Override
    public Optional<Field<?>> orderByDescending() {
      return Optional.of(CUSTOMER);
    }

    @Override
    public OptionalInt skip() {
      return OptionalInt.empty();
    }

    @Override
    public OptionalInt take() {
      return OptionalInt.empty();
    }
  }
}
