package io.intellixity.qsfilter.jdbc.statement;

import io.intellixity.qsfilter.query.Conditions;
import io.intellixity.qsfilter.query.QueryElement;
import io.intellixity.qsfilter.query.SortField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Mutable single-table DELETE with optional ORDER BY and LIMIT. */
public final class DeleteStatement implements FilterableStatement<DeleteStatement> {
  private String table;
  private QueryElement where;
  private final List<SortField> orderBy = new ArrayList<>();
  private Integer limit;

  public static DeleteStatement deleteFrom(String table) {
    return new DeleteStatement().from(table);
  }

  public DeleteStatement from(String table) {
    this.table = Objects.requireNonNull(table, "table");
    return this;
  }

  @Override
  public DeleteStatement where(QueryElement condition) {
    this.where = Conditions.conjoin(this.where, condition);
    return this;
  }

  @Override
  public DeleteStatement limit(int limit) {
    this.limit = limit;
    return this;
  }

  @Override
  public boolean supportsOffset() { return false; }

  @Override
  public DeleteStatement offset(int offset) {
    throw new UnsupportedOperationException("DELETE has no OFFSET");
  }

  @Override
  public DeleteStatement orderBy(String column, SortField.Direction direction) {
    orderBy.add(new SortField(column, direction));
    return this;
  }

  public String table() { return table; }
  public QueryElement where() { return where; }
  public List<SortField> orderBy() { return Collections.unmodifiableList(orderBy); }
  public Integer limit() { return limit; }
}
