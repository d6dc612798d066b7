package io.intellixity.qsfilter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class QueryFilterConfigTest {
  private final ClassLoader cl = QueryFilterConfigTest.class.getClassLoader();

  @Test
  void defaultsWithoutResource() {
    assertEquals(new QueryFilterConfig(10, 100), QueryFilterConfig.defaults());
    assertSame(QueryFilterConfig.DEFAULT, QueryFilterConfig.load(cl, "no/such/qsfilter.properties"));
  }

  @Test
  void loadsFromResource() {
    assertEquals(new QueryFilterConfig(25, 250), QueryFilterConfig.load(cl, "qsfilter-test.properties"));
  }

  @Test
  void missingKeysFallBack() {
    assertEquals(new QueryFilterConfig(10, 40), QueryFilterConfig.load(cl, "qsfilter-partial.properties"));
  }

  @Test
  void rejectsInvalidValues() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> QueryFilterConfig.load(cl, "qsfilter-invalid.properties"));
    assertTrue(ex.getMessage().contains(QueryFilterConfig.DEFAULT_LIMIT_KEY));
    assertThrows(IllegalArgumentException.class, () -> new QueryFilterConfig(0, 100));
    assertThrows(IllegalArgumentException.class, () -> QueryFilterConfig.DEFAULT.withMaxLimit(-1));
  }

  @Test
  void schemaPicksUpDefaultMaxLimit() {
    assertEquals(100, FilterSchema.of(UserFilters.class).maxLimit());
    assertThrows(IllegalArgumentException.class, () -> UserFilters.SCHEMA.withMaxLimit(0));
  }
}
