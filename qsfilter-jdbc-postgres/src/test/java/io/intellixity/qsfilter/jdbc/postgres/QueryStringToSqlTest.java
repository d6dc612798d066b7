package io.intellixity.qsfilter.jdbc.postgres;

import io.intellixity.qsfilter.FilterDeserializationException;
import io.intellixity.qsfilter.QueryFilter;
import io.intellixity.qsfilter.QueryFilterReader;
import io.intellixity.qsfilter.jdbc.LimitPolicy;
import io.intellixity.qsfilter.jdbc.SqlStatement;
import io.intellixity.qsfilter.jdbc.dialect.Dialects;
import io.intellixity.qsfilter.jdbc.dialect.JdbcDialect;
import io.intellixity.qsfilter.jdbc.statement.DeleteStatement;
import io.intellixity.qsfilter.jdbc.statement.SelectStatement;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class QueryStringToSqlTest {
  private final QueryFilterReader reader = new QueryFilterReader();
  private final JdbcDialect dialect = Dialects.byId("postgres");

  private SelectStatement select(String query) {
    QueryFilter<UserFilters> q = reader.read(query, UserFilters.SCHEMA);
    return SelectStatement.select("age").from("user").applyFilters(q);
  }

  @Test
  void filtersSortsAndPages() {
    SelectStatement s = select(
        "filter[age][lt]=50&filter[age][gte]=20&filter[name][contains]=John&start=10&end=100&sort=age&order=DESC");

    assertEquals("SELECT \"age\" FROM \"user\" WHERE \"name\" LIKE '%John%' AND (\"age\" >= 20 AND \"age\" < 50)"
        + " ORDER BY \"age\" DESC LIMIT 90 OFFSET 10", dialect.toSql(s));

    SqlStatement st = dialect.render(s);
    assertEquals("SELECT \"age\" FROM \"user\" WHERE \"name\" LIKE ? AND (\"age\" >= ? AND \"age\" < ?)"
        + " ORDER BY \"age\" DESC LIMIT 90 OFFSET 10", st.sql());
    assertEquals(List.of("%John%", 20L, 50L), st.values());
  }

  @Test
  void noParametersGivesDefaultPage() {
    assertEquals("SELECT \"age\" FROM \"user\" LIMIT 10 OFFSET 0", dialect.toSql(select("")));
  }

  @Test
  void unsortableFieldAndBadOrderAreIgnored() {
    assertEquals("SELECT \"age\" FROM \"user\" LIMIT 10 OFFSET 0", dialect.toSql(select("sort=id&order=DESC")));
    assertEquals("SELECT \"age\" FROM \"user\" ORDER BY \"name\" ASC LIMIT 10 OFFSET 0",
        dialect.toSql(select("sort=name&order=upward")));
  }

  @Test
  void endBeforeStartStillSelectsOneRow() {
    assertEquals("SELECT \"age\" FROM \"user\" LIMIT 1 OFFSET 50", dialect.toSql(select("start=50&end=20")));
  }

  @Test
  void uuidAndOffsetDateTimeFromQueryString() {
    UUID a = UUID.fromString("67e55044-10b1-426f-9247-bb680e5fe0c8");
    SelectStatement s = select("filter[id][in]=" + a.toString().toUpperCase()
        + "&filter[id][in]=urn:uuid:0f1e2d3c-4b5a-6978-8796-a5b4c3d2e1f0"
        + "&filter[created][after]=2022-10-15T10:30:5%2b00:00");

    assertEquals("SELECT \"age\" FROM \"user\" WHERE \"id\" IN "
        + "('67e55044-10b1-426f-9247-bb680e5fe0c8', '0f1e2d3c-4b5a-6978-8796-a5b4c3d2e1f0')"
        + " AND \"created\" >= '2022-10-15 10:30:05 +00:00' LIMIT 10 OFFSET 0", dialect.toSql(s));
  }

  @Test
  void clampedLimit() {
    QueryFilter<UserFilters> q = reader.read("end=5000", UserFilters.SCHEMA);
    SelectStatement s = SelectStatement.select("age").from("user").applyFilters(q, LimitPolicy.CLAMP_TO_MAX);
    assertEquals("SELECT \"age\" FROM \"user\" LIMIT 100 OFFSET 0", dialect.toSql(s));
  }

  @Test
  void deleteFromQueryString() {
    QueryFilter<UserFilters> q = reader.read("filter[age][gt]=90&start=5&end=8&sort=age", UserFilters.SCHEMA);
    DeleteStatement del = DeleteStatement.deleteFrom("user").applyFilters(q);

    assertEquals("DELETE FROM \"user\" WHERE ctid IN (SELECT ctid FROM \"user\" WHERE \"age\" > 90"
        + " ORDER BY \"age\" ASC LIMIT 8)", dialect.toSql(del));
  }

  @Test
  void badOperandRejectsWholeRequest() {
    FilterDeserializationException ex = assertThrows(FilterDeserializationException.class,
        () -> select("filter[age][gte]=20&filter[created][before]=yesterday"));
    assertEquals("filter.created", ex.path());
  }

  @Test
  void dialectIsDiscoverable() {
    assertInstanceOf(PostgresDialect.class, dialect);
    assertEquals("postgres", dialect.id());
    assertTrue(Dialects.all().stream().anyMatch(x -> x instanceof PostgresDialect));
  }
}
