package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Condition;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Filter on a timestamp with a fixed UTC offset. Equality includes the offset: the same instant at
 * another offset is a different value.
 */
public record DateTimeTzFilter(TemporalOperator operator, OffsetDateTime value) implements FieldFilter {
  public DateTimeTzFilter {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
  }

  public static DateTimeTzFilter before(OffsetDateTime value) { return new DateTimeTzFilter(TemporalOperator.BEFORE, value); }
  public static DateTimeTzFilter after(OffsetDateTime value) { return new DateTimeTzFilter(TemporalOperator.AFTER, value); }
  public static DateTimeTzFilter eq(OffsetDateTime value) { return new DateTimeTzFilter(TemporalOperator.EQUALS, value); }
  public static DateTimeTzFilter neq(OffsetDateTime value) { return new DateTimeTzFilter(TemporalOperator.NOT_EQUALS, value); }

  @Override
  public Condition toCondition(String column) {
    return operator.toCondition(column, value);
  }
}
