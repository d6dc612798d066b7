package io.intellixity.qsfilter.jdbc.dialect;

import io.intellixity.qsfilter.jdbc.SqlStatement;
import io.intellixity.qsfilter.jdbc.statement.DeleteStatement;
import io.intellixity.qsfilter.jdbc.statement.SelectStatement;
import io.intellixity.qsfilter.query.Conditions;
import io.intellixity.qsfilter.query.Conjunction;
import io.intellixity.qsfilter.query.SortField;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractJdbcSqlDialectTest {
  private final BacktickDialect d = new BacktickDialect();

  @Test
  void selectsAllColumnsWithoutPredicate() {
    assertEquals("SELECT * FROM `t`", d.toSql(SelectStatement.select().from("t")));
  }

  @Test
  void emptyConjunctionsVanish() {
    SelectStatement s = SelectStatement.select("a").from("t")
        .where(Conditions.and(Conjunction.all(), Conditions.and(Conjunction.all())));
    assertEquals("SELECT `a` FROM `t`", d.toSql(s));
  }

  @Test
  void parenthesisesOnlyNestedGroups() {
    SelectStatement s = SelectStatement.select("a").from("t").where(Conditions.and(
        Conditions.and(Conditions.eq("a", 1L)),
        Conditions.and(Conditions.ge("b", 2L), Conditions.lt("b", 5L)),
        Conditions.and(Conjunction.all(), Conditions.ne("c", 3L))));

    assertEquals("SELECT `a` FROM `t` WHERE `a` = 1 AND (`b` >= 2 AND `b` < 5) AND `c` <> 3", d.toSql(s));
  }

  @Test
  void singleNestedGroupIsUnwrapped() {
    SelectStatement s = SelectStatement.select("a").from("t")
        .where(Conditions.and(Conditions.and(Conditions.gt("b", 2L), Conditions.le("b", 5L))));
    assertEquals("SELECT `a` FROM `t` WHERE `b` > 2 AND `b` <= 5", d.toSql(s));
  }

  @Test
  void bindsValuesInPlaceholderOrder() {
    SelectStatement s = SelectStatement.select("a", "b").from("t")
        .where(Conditions.and(
            Conditions.like("a", "%x%"),
            Conditions.in("b", List.of(1L, 2L)),
            Conditions.notLike("c", "y%")))
        .orderBy("a", SortField.Direction.DESC)
        .limit(5)
        .offset(10);

    SqlStatement st = d.render(s);
    assertEquals("SELECT `a`, `b` FROM `t` WHERE `a` LIKE ? AND `b` IN (?, ?) AND `c` NOT LIKE ?"
        + " ORDER BY `a` DESC LIMIT 5 OFFSET 10", st.sql());
    assertEquals(List.of("%x%", 1L, 2L, "y%"), st.values());
    assertEquals(SqlStatement.ExecKind.QUERY, st.execKind());
  }

  @Test
  void emptyInIsFalse() {
    SelectStatement s = SelectStatement.select("a").from("t").where(Conditions.in("a", List.of()));
    assertEquals("SELECT `a` FROM `t` WHERE FALSE", d.toSql(s));
    assertTrue(d.render(s).binds().isEmpty());
  }

  @Test
  void escapesInlineStrings() {
    SelectStatement s = SelectStatement.select("a").from("t").where(Conditions.eq("a", "O'Brien"));
    assertEquals("SELECT `a` FROM `t` WHERE `a` = 'O''Brien'", d.toSql(s));
  }

  @Test
  void quotesIdentifiers() {
    assertEquals("SELECT `we``ird` FROM `t`", d.toSql(SelectStatement.select("we`ird").from("t")));
  }

  @Test
  void deleteUsesLimitDirectly() {
    DeleteStatement del = DeleteStatement.deleteFrom("t")
        .where(Conditions.lt("day", LocalDate.of(2020, 1, 1)))
        .orderBy("day", SortField.Direction.ASC)
        .limit(10);

    assertEquals("DELETE FROM `t` WHERE `day` < '2020-01-01' ORDER BY `day` ASC LIMIT 10", d.toSql(del));
    SqlStatement st = d.render(del);
    assertEquals("DELETE FROM `t` WHERE `day` < ? ORDER BY `day` ASC LIMIT 10", st.sql());
    assertEquals(List.of(LocalDate.of(2020, 1, 1)), st.values());
    assertEquals(SqlStatement.ExecKind.UPDATE, st.execKind());
  }

  @Test
  void rejectsUnsupportedLiteral() {
    SelectStatement s = SelectStatement.select("a").from("t").where(Conditions.eq("a", new Object()));
    assertThrows(IllegalArgumentException.class, () -> d.toSql(s));
    assertEquals(1, d.render(s).binds().size());
  }

  @Test
  void requiresTable() {
    assertThrows(IllegalStateException.class, () -> d.toSql(SelectStatement.select("a")));
  }
}
