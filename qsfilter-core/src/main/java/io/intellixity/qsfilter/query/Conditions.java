package io.intellixity.qsfilter.query;

import java.util.Collection;
import java.util.List;

public final class Conditions {
  private Conditions() {}

  public static Condition eq(String column, Object value) { return new Condition(column, Operator.EQ, value); }
  public static Condition ne(String column, Object value) { return new Condition(column, Operator.NE, value); }
  public static Condition gt(String column, Object value) { return new Condition(column, Operator.GT, value); }
  public static Condition ge(String column, Object value) { return new Condition(column, Operator.GE, value); }
  public static Condition lt(String column, Object value) { return new Condition(column, Operator.LT, value); }
  public static Condition le(String column, Object value) { return new Condition(column, Operator.LE, value); }

  public static Condition in(String column, Collection<?> values) { return new Condition(column, Operator.IN, List.copyOf(values)); }

  public static Condition like(String column, String pattern) { return new Condition(column, Operator.LIKE, pattern); }
  public static Condition notLike(String column, String pattern) { return new Condition(column, Operator.NOT_LIKE, pattern); }

  public static Conjunction and(QueryElement... elements) {
    return new Conjunction(List.of(elements));
  }

  /** ANDs two elements, treating {@code null} and empty conjunctions as absent. */
  public static QueryElement conjoin(QueryElement left, QueryElement right) {
    if (isEmpty(left)) return right;
    if (isEmpty(right)) return left;
    return new Conjunction(List.of(left, right));
  }

  public static boolean isEmpty(QueryElement element) {
    return element == null || (element instanceof Conjunction c && c.isEmpty());
  }
}
