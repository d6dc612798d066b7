package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Condition;

import java.util.Objects;

public record NumberFilter(NumberOperator operator, long value) implements FieldFilter {
  public NumberFilter {
    Objects.requireNonNull(operator, "operator");
  }

  public static NumberFilter eq(long value) { return new NumberFilter(NumberOperator.EQUALS, value); }
  public static NumberFilter neq(long value) { return new NumberFilter(NumberOperator.NOT_EQUALS, value); }
  public static NumberFilter lt(long value) { return new NumberFilter(NumberOperator.LESSER_THAN, value); }
  public static NumberFilter lte(long value) { return new NumberFilter(NumberOperator.LESSER_THAN_EQUAL, value); }
  public static NumberFilter gt(long value) { return new NumberFilter(NumberOperator.GREATER_THAN, value); }
  public static NumberFilter gte(long value) { return new NumberFilter(NumberOperator.GREATER_THAN_EQUAL, value); }

  @Override
  public Condition toCondition(String column) {
    return operator.toCondition(column, value);
  }
}
