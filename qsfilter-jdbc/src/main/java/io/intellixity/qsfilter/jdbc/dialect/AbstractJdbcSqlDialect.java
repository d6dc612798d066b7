package io.intellixity.qsfilter.jdbc.dialect;

import io.intellixity.qsfilter.filter.FilterValues;
import io.intellixity.qsfilter.jdbc.Bind;
import io.intellixity.qsfilter.jdbc.SqlStatement;
import io.intellixity.qsfilter.jdbc.SqlStatement.ExecKind;
import io.intellixity.qsfilter.jdbc.statement.DeleteStatement;
import io.intellixity.qsfilter.jdbc.statement.SelectStatement;
import io.intellixity.qsfilter.query.Condition;
import io.intellixity.qsfilter.query.Conditions;
import io.intellixity.qsfilter.query.Conjunction;
import io.intellixity.qsfilter.query.QueryElement;
import io.intellixity.qsfilter.query.QueryVisitor;
import io.intellixity.qsfilter.query.SortField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * JDBC-generic SQL dialect base.
 * <p>
 * Renders SELECT and DELETE statements with their predicate tree, ORDER BY and paging. A top-level
 * conjunction is joined without parentheses; nested conjunctions of two or more elements are wrapped.
 * Conjunctions with a single element render as that element, empty ones render as nothing.
 * <p>
 * DB-specific dialects override hooks for quoting, paging and limited deletes.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  private static final Logger log = LoggerFactory.getLogger(AbstractJdbcSqlDialect.class);

  /** Where values go: into positional binds, or inline as literals. */
  protected abstract class RenderCtx {
    public abstract String add(Object value);
  }

  private final class BindCtx extends RenderCtx {
    private final List<Bind> binds = new ArrayList<>();

    @Override
    public String add(Object value) {
      binds.add(new Bind(value));
      return "?";
    }
  }

  private final class InlineCtx extends RenderCtx {
    @Override
    public String add(Object value) { return renderLiteral(value); }
  }

  @Override
  public final SqlStatement render(SelectStatement statement) {
    BindCtx ctx = new BindCtx();
    String sql = selectSql(statement, ctx);
    log.debug("qsfilter.sql dialect={} op=select binds={} sql={}", id(), ctx.binds.size(), sql);
    return new SqlStatement(sql, ctx.binds, ExecKind.QUERY);
  }

  @Override
  public final SqlStatement render(DeleteStatement statement) {
    BindCtx ctx = new BindCtx();
    String sql = deleteSql(statement, ctx);
    log.debug("qsfilter.sql dialect={} op=delete binds={} sql={}", id(), ctx.binds.size(), sql);
    return new SqlStatement(sql, ctx.binds, ExecKind.UPDATE);
  }

  @Override
  public final String toSql(SelectStatement statement) {
    return selectSql(statement, new InlineCtx());
  }

  @Override
  public final String toSql(DeleteStatement statement) {
    return deleteSql(statement, new InlineCtx());
  }

  protected String selectSql(SelectStatement s, RenderCtx ctx) {
    String table = requireTable(s.table());
    StringBuilder sql = new StringBuilder("SELECT ");
    if (s.columns().isEmpty()) {
      sql.append('*');
    } else {
      sql.append(String.join(", ", s.columns().stream().map(this::quoteIdent).toList()));
    }
    sql.append(" FROM ").append(quoteIdent(table));
    appendWhere(sql, s.where(), ctx);
    appendSort(sql, s.orderBy());
    appendPage(sql, s.limit(), s.offset());
    return sql.toString();
  }

  protected String deleteSql(DeleteStatement s, RenderCtx ctx) {
    String table = requireTable(s.table());
    StringBuilder where = new StringBuilder();
    appendWhere(where, s.where(), ctx);
    return renderDelete(table, where.toString(), s.orderBy(), s.limit());
  }

  /**
   * Default renders {@code DELETE FROM t [WHERE ..] [ORDER BY ..] [LIMIT n]}. Databases without
   * DELETE .. LIMIT override this.
   *
   * @param whereSql already rendered {@code " WHERE ..."} clause, or empty
   */
  protected String renderDelete(String table, String whereSql, List<SortField> orderBy, Integer limit) {
    StringBuilder sql = new StringBuilder("DELETE FROM ").append(quoteIdent(table)).append(whereSql);
    appendSort(sql, orderBy);
    if (limit != null) sql.append(" LIMIT ").append(limit);
    return sql.toString();
  }

  protected void appendWhere(StringBuilder sql, QueryElement where, RenderCtx ctx) {
    String predicate = renderPredicate(where, ctx);
    if (!predicate.isBlank()) sql.append(" WHERE ").append(predicate);
  }

  protected void appendSort(StringBuilder sql, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return;
    List<String> parts = new ArrayList<>();
    for (SortField sf : sort) {
      parts.add(quoteIdent(sf.field()) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
    }
    sql.append(" ORDER BY ").append(String.join(", ", parts));
  }

  /** Appends LIMIT and OFFSET; either may be {@code null}. */
  protected abstract void appendPage(StringBuilder sql, Integer limit, Integer offset);

  protected abstract String quoteIdent(String ident);

  protected String renderPredicate(QueryElement el, RenderCtx ctx) {
    if (Conditions.isEmpty(el)) return "";
    String sql = el.accept(new PredicateRenderer(ctx, true));
    return sql == null ? "" : sql;
  }

  private final class PredicateRenderer implements QueryVisitor<String> {
    private final RenderCtx ctx;
    private final boolean topLevel;

    PredicateRenderer(RenderCtx ctx, boolean topLevel) {
      this.ctx = ctx;
      this.topLevel = topLevel;
    }

    @Override
    public String visit(Conjunction conjunction) {
      List<QueryElement> children = new ArrayList<>();
      for (QueryElement c : conjunction.elements()) {
        if (!Conditions.isEmpty(c)) children.add(c);
      }
      if (children.isEmpty()) return "";
      if (children.size() == 1) return children.get(0).accept(this);

      PredicateRenderer nested = new PredicateRenderer(ctx, false);
      List<String> childSql = new ArrayList<>();
      for (QueryElement c : children) {
        String s = c.accept(nested);
        if (s == null || s.isBlank()) continue;
        childSql.add(s);
      }
      if (childSql.isEmpty()) return "";
      if (childSql.size() == 1) return childSql.get(0);
      String joined = String.join(" AND ", childSql);
      return topLevel ? joined : "(" + joined + ")";
    }

    @Override
    public String visit(Condition c) {
      String expr = quoteIdent(c.column());
      Object value = c.value();
      return switch (c.operator()) {
        case EQ -> binarySql(expr, "=", value);
        case NE -> binarySql(expr, "<>", value);
        case GT -> binarySql(expr, ">", value);
        case GE -> binarySql(expr, ">=", value);
        case LT -> binarySql(expr, "<", value);
        case LE -> binarySql(expr, "<=", value);
        case LIKE -> binarySql(expr, "LIKE", value);
        case NOT_LIKE -> binarySql(expr, "NOT LIKE", value);
        case IN -> listSql(expr, (Collection<?>) value);
      };
    }

    private String binarySql(String expr, String op, Object value) {
      return expr + " " + op + " " + ctx.add(value);
    }

    private String listSql(String expr, Collection<?> values) {
      if (values.isEmpty()) return "FALSE";
      List<String> ph = new ArrayList<>(values.size());
      for (Object v : values) ph.add(ctx.add(v));
      return expr + " IN (" + String.join(", ", ph) + ")";
    }
  }

  /**
   * Inline literal for {@link #toSql}. Temporal and UUID values use the textual forms of
   * {@link FilterValues}; strings are single-quoted with embedded quotes doubled.
   */
  protected String renderLiteral(Object value) {
    if (value == null) return "NULL";
    if (value instanceof Boolean b) return b ? "TRUE" : "FALSE";
    if (value instanceof Number n) return n.toString();
    if (value instanceof LocalDate d) return quoteString(FilterValues.format(d));
    if (value instanceof LocalDateTime dt) return quoteString(FilterValues.format(dt));
    if (value instanceof OffsetDateTime odt) return quoteString(FilterValues.format(odt));
    if (value instanceof UUID u) return quoteString(FilterValues.format(u));
    if (value instanceof CharSequence cs) return quoteString(cs.toString());
    throw new IllegalArgumentException("Unsupported literal type for dialect " + id() + ": " + value.getClass().getName());
  }

  protected String quoteString(String s) {
    return "'" + s.replace("'", "''") + "'";
  }

  private static String requireTable(String table) {
    if (table == null || table.isBlank()) throw new IllegalStateException("Statement has no table");
    return table;
  }
}
