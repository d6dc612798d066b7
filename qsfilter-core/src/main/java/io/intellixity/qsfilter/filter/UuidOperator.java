package io.intellixity.qsfilter.filter;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum UuidOperator {
  EQUALS("eq"),
  /** Membership in the list of every value supplied for the token. */
  IN("in");

  private final String token;

  UuidOperator(String token) {
    this.token = token;
  }

  public String token() { return token; }

  /** All tokens in declaration order. */
  public static List<String> tokens() {
    return Arrays.stream(values()).map(UuidOperator::token).toList();
  }

  public static Optional<UuidOperator> fromToken(String token) {
    for (UuidOperator op : values()) {
      if (op.token.equals(token)) return Optional.of(op);
    }
    return Optional.empty();
  }
}
