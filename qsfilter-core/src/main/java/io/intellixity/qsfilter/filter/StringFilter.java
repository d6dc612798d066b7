package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Condition;

import java.util.Objects;

public record StringFilter(StringOperator operator, String value) implements FieldFilter {
  public StringFilter {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
  }

  public static StringFilter contains(String value) { return new StringFilter(StringOperator.CONTAINS, value); }
  public static StringFilter notContains(String value) { return new StringFilter(StringOperator.NOT_CONTAINS, value); }
  public static StringFilter startsWith(String value) { return new StringFilter(StringOperator.STARTS_WITH, value); }
  public static StringFilter endsWith(String value) { return new StringFilter(StringOperator.ENDS_WITH, value); }

  @Override
  public Condition toCondition(String column) {
    return operator.toCondition(column, value);
  }
}
