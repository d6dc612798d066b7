package io.intellixity.qsfilter.jdbc.dialect;

/** MySQL-flavoured dialect exercising the generic rendering and its DELETE .. LIMIT default. */
class BacktickDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "backtick"; }

  @Override
  protected String quoteIdent(String ident) {
    return "`" + ident.replace("`", "``") + "`";
  }

  @Override
  protected void appendPage(StringBuilder sql, Integer limit, Integer offset) {
    if (limit != null) sql.append(" LIMIT ").append(limit);
    if (offset != null) sql.append(" OFFSET ").append(offset);
  }
}
