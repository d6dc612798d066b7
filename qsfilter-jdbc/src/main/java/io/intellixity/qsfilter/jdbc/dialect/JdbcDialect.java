package io.intellixity.qsfilter.jdbc.dialect;

import io.intellixity.qsfilter.jdbc.SqlStatement;
import io.intellixity.qsfilter.jdbc.statement.DeleteStatement;
import io.intellixity.qsfilter.jdbc.statement.SelectStatement;

public interface JdbcDialect {
  String id();

  /** Renders with {@code ?} placeholders; values are returned as binds in placeholder order. */
  SqlStatement render(SelectStatement statement);

  SqlStatement render(DeleteStatement statement);

  /** Renders with values inlined as SQL literals. Intended for logging and tests. */
  String toSql(SelectStatement statement);

  String toSql(DeleteStatement statement);
}
