package io.intellixity.qsfilter.query;

public enum Operator {
  EQ,
  NE,
  GT,
  GE,
  LT,
  LE,

  /** Set membership; the value is a {@link java.util.List}. */
  IN,

  LIKE,
  NOT_LIKE
}
