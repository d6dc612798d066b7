package io.intellixity.qsfilter.query;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ConditionsTest {
  @Test
  void conjoinTreatsEmptyAsAbsent() {
    Condition a = Conditions.eq("a", 1L);
    Condition b = Conditions.eq("b", 2L);

    assertSame(a, Conditions.conjoin(null, a));
    assertSame(a, Conditions.conjoin(Conjunction.all(), a));
    assertSame(a, Conditions.conjoin(a, Conjunction.all()));
    assertNull(Conditions.conjoin(null, null));
    assertEquals(Conditions.and(a, b), Conditions.conjoin(a, b));
  }

  @Test
  void conjunctionIsImmutable() {
    Conjunction c = Conjunction.all();
    Conjunction d = c.add(Conditions.eq("a", 1L));
    assertTrue(c.isEmpty());
    assertEquals(1, d.elements().size());
    assertThrows(UnsupportedOperationException.class, () -> d.elements().add(Conjunction.all()));
  }

  @Test
  void inCopiesItsValues() {
    List<Object> values = new ArrayList<>(List.of(1L, 2L));
    Condition in = Conditions.in("id", values);
    values.add(3L);
    assertEquals(List.of(1L, 2L), in.value());
  }

  @Test
  void validatesConstruction() {
    assertThrows(NullPointerException.class, () -> Conditions.eq("a", null));
    assertThrows(IllegalArgumentException.class, () -> new Condition("a", Operator.IN, 1L));
  }

  @Test
  void visitorDispatchesOnElementKind() {
    QueryVisitor<String> kind = new QueryVisitor<>() {
      @Override public String visit(Condition condition) { return "condition:" + condition.column(); }
      @Override public String visit(Conjunction conjunction) { return "and:" + conjunction.elements().size(); }
    };
    assertEquals("condition:a", Conditions.lt("a", 1L).accept(kind));
    assertEquals("and:2", Conditions.and(Conditions.lt("a", 1L), Conditions.gt("a", 0L)).accept(kind));
  }

  @Test
  void sortFieldDefaultsToAscending() {
    assertEquals(SortField.Direction.ASC, new SortField("age", null).direction());
  }
}
