package io.intellixity.qsfilter.jdbc.postgres;

import io.intellixity.qsfilter.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.qsfilter.query.SortField;

import java.util.List;

/**
 * Postgres dialect.
 *
 * Keeps only Postgres-specific overrides; generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected void appendPage(StringBuilder sql, Integer limit, Integer offset) {
    if (limit != null) sql.append(" LIMIT ").append(limit);
    if (offset != null) sql.append(" OFFSET ").append(offset);
  }

  /** Postgres has no DELETE .. LIMIT; ordered or limited deletes go through a ctid subquery. */
  @Override
  protected String renderDelete(String table, String whereSql, List<SortField> orderBy, Integer limit) {
    if (limit == null && orderBy.isEmpty()) {
      return "DELETE FROM " + quoteIdent(table) + whereSql;
    }
    String t = quoteIdent(table);
    StringBuilder sub = new StringBuilder("SELECT ctid FROM ").append(t).append(whereSql);
    appendSort(sub, orderBy);
    if (limit != null) sub.append(" LIMIT ").append(limit);
    return "DELETE FROM " + t + " WHERE ctid IN (" + sub + ")";
  }
}
