package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Conditions;
import io.intellixity.qsfilter.query.QueryElement;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class FilterSetTest {
  @Test
  void emptySetHasNoCondition() {
    NumberFilterSet set = new NumberFilterSet();
    assertTrue(set.isEmpty());
    assertEquals(Optional.empty(), set.condition("age"));
    assertEquals(Optional.empty(), FilterSet.condition(null, "age"));
  }

  @Test
  void keepsInsertionOrderAndDuplicates() {
    NumberFilterSet set = new NumberFilterSet();
    set.push(NumberFilter.gte(1));
    set.push(NumberFilter.gte(5));
    set.push(NumberFilter.lt(10));

    assertEquals(3, set.size());
    assertEquals(List.of(NumberFilter.gte(1), NumberFilter.gte(5), NumberFilter.lt(10)), set.filters());
    assertEquals(Optional.of(Conditions.and(Conditions.ge("n", 1L), Conditions.ge("n", 5L), Conditions.lt("n", 10L))),
        set.condition("n"));
  }

  @Test
  void temporalBoundsCompileToHalfOpenRange() {
    DateFilterSet set = DateFilterSet.of(
        DateFilter.after(LocalDate.of(2022, 1, 1)),
        DateFilter.before(LocalDate.of(2023, 1, 1)));

    QueryElement el = set.condition("day").orElseThrow();
    assertEquals(Conditions.and(
        Conditions.ge("day", LocalDate.of(2022, 1, 1)),
        Conditions.lt("day", LocalDate.of(2023, 1, 1))), el);
  }

  @Test
  void stringOperatorsWrapOperandVerbatim() {
    StringFilterSet set = StringFilterSet.of(
        StringFilter.contains("Jo%hn"),
        StringFilter.notContains("x"),
        StringFilter.startsWith("A"),
        StringFilter.endsWith("z"));

    assertEquals(Conditions.and(
        Conditions.like("name", "%Jo%hn%"),
        Conditions.notLike("name", "%x%"),
        Conditions.like("name", "A%"),
        Conditions.like("name", "%z")), set.condition("name").orElseThrow());
  }

  @Test
  void uuidInKeepsListOrder() {
    UUID a = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    UUID b = UUID.fromString("00000000-0000-0000-0000-00000000000b");
    UuidFilterSet set = UuidFilterSet.of(UuidFilter.in(b, a), UuidFilter.eq(a));

    assertEquals(Conditions.and(Conditions.in("id", List.of(b, a)), Conditions.eq("id", a)),
        set.condition("id").orElseThrow());
  }

  @Test
  void uuidFilterValidatesArity() {
    UUID a = UUID.randomUUID();
    assertThrows(IllegalArgumentException.class, () -> UuidFilter.in(List.of()));
    assertThrows(IllegalArgumentException.class, () -> new UuidFilter(UuidOperator.EQUALS, List.of(a, a)));
  }

  @Test
  void rejectsNullFilter() {
    assertThrows(NullPointerException.class, () -> new StringFilterSet().push(null));
  }

  @Test
  void equalityIsByTypeAndFilters() {
    assertEquals(NumberFilterSet.of(NumberFilter.eq(1)), NumberFilterSet.of(NumberFilter.eq(1)));
    assertNotEquals(NumberFilterSet.of(NumberFilter.eq(1)), NumberFilterSet.of(NumberFilter.neq(1)));
    assertNotEquals(new NumberFilterSet(), new StringFilterSet());
  }

  @Test
  void resolvesTokensExactly() {
    assertEquals(Optional.of(NumberOperator.GREATER_THAN_EQUAL), NumberOperator.fromToken("gte"));
    assertEquals(Optional.empty(), NumberOperator.fromToken("GTE"));
    assertEquals(Optional.of(TemporalOperator.NOT_EQUALS), TemporalOperator.fromToken("neq"));
    assertEquals(Optional.of(StringOperator.NOT_CONTAINS), StringOperator.fromToken("notcontains"));
    assertEquals(Optional.empty(), UuidOperator.fromToken("neq"));
  }
}
