package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Condition;
import io.intellixity.qsfilter.query.Conditions;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/** Pattern-match vocabulary; operands are used verbatim between the {@code %} wildcards. */
public enum StringOperator {
  CONTAINS("contains"),
  NOT_CONTAINS("notcontains"),
  STARTS_WITH("startswith"),
  ENDS_WITH("endswith");

  static final String WILDCARD = "%";

  private final String token;

  StringOperator(String token) {
    this.token = token;
  }

  public String token() { return token; }

  /** All tokens in declaration order. */
  public static List<String> tokens() {
    return Arrays.stream(values()).map(StringOperator::token).toList();
  }

  public static Optional<StringOperator> fromToken(String token) {
    for (StringOperator op : values()) {
      if (op.token.equals(token)) return Optional.of(op);
    }
    return Optional.empty();
  }

  Condition toCondition(String column, String value) {
    return switch (this) {
      case CONTAINS -> Conditions.like(column, WILDCARD + value + WILDCARD);
      case NOT_CONTAINS -> Conditions.notLike(column, WILDCARD + value + WILDCARD);
      case STARTS_WITH -> Conditions.like(column, value + WILDCARD);
      case ENDS_WITH -> Conditions.like(column, WILDCARD + value);
    };
  }
}
