package io.intellixity.qsfilter.jdbc.statement;

import io.intellixity.qsfilter.query.Conditions;
import io.intellixity.qsfilter.query.QueryElement;
import io.intellixity.qsfilter.query.SortField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Mutable single-table SELECT. No columns means {@code *}. */
public final class SelectStatement implements FilterableStatement<SelectStatement> {
  private String table;
  private final List<String> columns = new ArrayList<>();
  private QueryElement where;
  private final List<SortField> orderBy = new ArrayList<>();
  private Integer limit;
  private Integer offset;

  public static SelectStatement select(String... columns) {
    SelectStatement s = new SelectStatement();
    for (String c : columns) s.column(c);
    return s;
  }

  public SelectStatement from(String table) {
    this.table = Objects.requireNonNull(table, "table");
    return this;
  }

  public SelectStatement column(String column) {
    columns.add(Objects.requireNonNull(column, "column"));
    return this;
  }

  @Override
  public SelectStatement where(QueryElement condition) {
    this.where = Conditions.conjoin(this.where, condition);
    return this;
  }

  @Override
  public SelectStatement limit(int limit) {
    this.limit = limit;
    return this;
  }

  @Override
  public boolean supportsOffset() { return true; }

  @Override
  public SelectStatement offset(int offset) {
    this.offset = offset;
    return this;
  }

  @Override
  public SelectStatement orderBy(String column, SortField.Direction direction) {
    orderBy.add(new SortField(column, direction));
    return this;
  }

  public String table() { return table; }
  public List<String> columns() { return Collections.unmodifiableList(columns); }
  /** Current predicate, or {@code null} when none was attached. */
  public QueryElement where() { return where; }
  public List<SortField> orderBy() { return Collections.unmodifiableList(orderBy); }
  public Integer limit() { return limit; }
  public Integer offset() { return offset; }
}
