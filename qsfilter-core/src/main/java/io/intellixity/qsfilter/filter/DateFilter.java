package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Condition;

import java.time.LocalDate;
import java.util.Objects;

/** Filter on a calendar date column. */
public record DateFilter(TemporalOperator operator, LocalDate value) implements FieldFilter {
  public DateFilter {
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
  }

  public static DateFilter before(LocalDate value) { return new DateFilter(TemporalOperator.BEFORE, value); }
  public static DateFilter after(LocalDate value) { return new DateFilter(TemporalOperator.AFTER, value); }
  public static DateFilter eq(LocalDate value) { return new DateFilter(TemporalOperator.EQUALS, value); }
  public static DateFilter neq(LocalDate value) { return new DateFilter(TemporalOperator.NOT_EQUALS, value); }

  @Override
  public Condition toCondition(String column) {
    return operator.toCondition(column, value);
  }
}
