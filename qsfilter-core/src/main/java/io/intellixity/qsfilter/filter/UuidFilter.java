package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Condition;
import io.intellixity.qsfilter.query.Conditions;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Identifier filter. {@link UuidOperator#EQUALS} carries exactly one value, {@link UuidOperator#IN}
 * one or more, in the order they were supplied.
 */
public record UuidFilter(UuidOperator operator, List<UUID> values) implements FieldFilter {
  public UuidFilter {
    Objects.requireNonNull(operator, "operator");
    values = List.copyOf(Objects.requireNonNull(values, "values"));
    if (values.isEmpty()) throw new IllegalArgumentException(operator + " requires at least one value");
    if (operator == UuidOperator.EQUALS && values.size() != 1) {
      throw new IllegalArgumentException("EQUALS takes exactly one value, got " + values.size());
    }
  }

  public static UuidFilter eq(UUID value) { return new UuidFilter(UuidOperator.EQUALS, List.of(value)); }
  public static UuidFilter in(List<UUID> values) { return new UuidFilter(UuidOperator.IN, values); }
  public static UuidFilter in(UUID... values) { return new UuidFilter(UuidOperator.IN, List.of(values)); }

  /** The single operand of an {@link UuidOperator#EQUALS} filter, or the first of an IN list. */
  public UUID value() { return values.get(0); }

  @Override
  public Condition toCondition(String column) {
    return switch (operator) {
      case EQUALS -> Conditions.eq(column, value());
      case IN -> Conditions.in(column, values);
    };
  }
}
