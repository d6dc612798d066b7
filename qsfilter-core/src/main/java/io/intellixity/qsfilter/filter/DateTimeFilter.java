package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Condition;

import java.time.LocalDateTime;
import java.util.Objects;

/** Filter on a timestamp without time zone. */
public record DateTimeFilter(TemporalOperator operator, LocalDateTime value) implements FieldFilter {
  public DateTimeFilter {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
  }

  public static DateTimeFilter before(LocalDateTime value) { return new DateTimeFilter(TemporalOperator.BEFORE, value); }
  public static DateTimeFilter after(LocalDateTime value) { return new DateTimeFilter(TemporalOperator.AFTER, value); }
  public static DateTimeFilter eq(LocalDateTime value) { return new DateTimeFilter(TemporalOperator.EQUALS, value); }
  public static DateTimeFilter neq(LocalDateTime value) { return new DateTimeFilter(TemporalOperator.NOT_EQUALS, value); }

  @Override
  public Condition toCondition(String column) {
    return operator.toCondition(column, value);
  }
}
