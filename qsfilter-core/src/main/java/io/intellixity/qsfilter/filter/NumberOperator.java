package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Condition;
import io.intellixity.qsfilter.query.Conditions;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** Declared in bind order: inclusive bounds, exclusive bounds, then (in)equality. */
public enum NumberOperator {
  GREATER_THAN_EQUAL("gte"),
  LESSER_THAN_EQUAL("lte"),
  LESSER_THAN("lt"),
  GREATER_THAN("gt"),
  EQUALS("eq"),
  NOT_EQUALS("neq");

  private final String token;

  NumberOperator(String token) {
    this.token = token;
  }

  public String token() { return token; }

  /** All tokens in declaration order. */
  public static List<String> tokens() {
    return Arrays.stream(values()).map(NumberOperator::token).toList();
  }

  public static Optional<NumberOperator> fromToken(String token) {
    for (NumberOperator op : values()) {
      if (op.token.equals(token)) return Optional.of(op);
    }
    return Optional.empty();
  }

  Condition toCondition(String column, long value) {
    return switch (this) {
      case EQUALS -> Conditions.eq(column, value);
      case NOT_EQUALS -> Conditions.ne(column, value);
      case LESSER_THAN -> Conditions.lt(column, value);
      case LESSER_THAN_EQUAL -> Conditions.le(column, value);
      case GREATER_THAN -> Conditions.gt(column, value);
      case GREATER_THAN_EQUAL -> Conditions.ge(column, value);
    };
  }
}
