package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Condition;
import io.intellixity.qsfilter.query.Conditions;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Comparison vocabulary shared by date, datetime and offset datetime filters.
 * <p>
 * {@link #BEFORE} is exclusive and {@link #AFTER} inclusive, so {@code after=X} together with
 * {@code before=Y} selects the half-open interval {@code [X, Y)}.
 */
public enum TemporalOperator {
  BEFORE("before"),
  AFTER("after"),
  EQUALS("eq"),
  NOT_EQUALS("neq");

  private final String token;

  TemporalOperator(String token) {
    this.token = token;
  }

  public String token() { return token; }

  /** All tokens in declaration order. */
  public static List<String> tokens() {
    return Arrays.stream(values()).map(TemporalOperator::token).toList();
  }

  public static Optional<TemporalOperator> fromToken(String token) {
    for (TemporalOperator op : values()) {
      if (op.token.equals(token)) return Optional.of(op);
    }
    return Optional.empty();
  }

  Condition toCondition(String column, Object value) {
    return switch (this) {
      case BEFORE -> Conditions.lt(column, value);
      case AFTER -> Conditions.ge(column, value);
      case EQUALS -> Conditions.eq(column, value);
      case NOT_EQUALS -> Conditions.ne(column, value);
    };
  }
}
