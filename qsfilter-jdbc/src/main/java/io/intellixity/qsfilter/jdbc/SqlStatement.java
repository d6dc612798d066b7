package io.intellixity.qsfilter.jdbc;

import java.util.List;

/** Rendered SQL with {@code ?} placeholders and their values in placeholder order. */
public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (SELECT). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() (DELETE). */
    UPDATE
  }

  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, ExecKind.QUERY);
  }

  public List<Object> values() {
    return binds.stream().map(Bind::value).toList();
  }
}
