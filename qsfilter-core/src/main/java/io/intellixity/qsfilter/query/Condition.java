package io.intellixity.qsfilter.query;

import java.util.List;
import java.util.Objects;

/** Single-column comparison. For {@link Operator#IN} the value is an immutable list. */
public final class Condition implements QueryElement {
  private final String column;
  private final Operator operator;
  private final Object value;

  public Condition(String column, Operator operator, Object value) {
    this.column = Objects.requireNonNull(column, "column");
    this.operator = Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(value, "value");
    if (operator == Operator.IN) {
      if (!(value instanceof List<?> list)) {
        throw new IllegalArgumentException("IN requires a list value for column '" + column + "'");
      }
      value = List.copyOf(list);
    }
    this.value = value;
  }

  public String column() { return column; }
  public Operator operator() { return operator; }
  public Object value() { return value; }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return column.equals(c.column) && operator == c.operator && value.equals(c.value);
  }

  @Override
  public int hashCode() { return Objects.hash(column, operator, value); }

  @Override
  public String toString() { return column + " " + operator + " " + value; }
}
