package io.intellixity.qsfilter;

import io.intellixity.qsfilter.query.SortField;

import java.util.Locale;

/** Requested sort direction. {@link #NONE} means no explicit order and renders as ascending. */
public enum Order {
  ASC,
  DESC,
  NONE;

  /** Case-insensitive {@code ASC}/{@code DESC}; anything else, including {@code null}, is {@link #NONE}. */
  public static Order parse(String value) {
    if (value == null) return NONE;
    return switch (value.toUpperCase(Locale.ROOT)) {
      case "ASC" -> ASC;
      case "DESC" -> DESC;
      default -> NONE;
    };
  }

  public String asSql() {
    return this == DESC ? "DESC" : "ASC";
  }

  public SortField.Direction direction() {
    return this == DESC ? SortField.Direction.DESC : SortField.Direction.ASC;
  }
}
