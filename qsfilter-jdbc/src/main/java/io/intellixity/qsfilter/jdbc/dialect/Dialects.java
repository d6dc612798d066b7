package io.intellixity.qsfilter.jdbc.dialect;

import io.intellixity.qsfilter.util.FactoriesLoader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Registry of the {@link JdbcDialect}s listed in {@code META-INF/qsfilter.factories}. */
public final class Dialects {
  private Dialects() {}

  private static final class Holder {
    static final Map<String, JdbcDialect> BY_ID = index(FactoriesLoader.load(JdbcDialect.class));
  }

  public static JdbcDialect byId(String id) {
    Objects.requireNonNull(id, "id");
    JdbcDialect d = Holder.BY_ID.get(id);
    if (d == null) {
      throw new IllegalArgumentException("Unknown JDBC dialect '" + id + "'; available: " + Holder.BY_ID.keySet());
    }
    return d;
  }

  public static List<JdbcDialect> all() {
    return List.copyOf(Holder.BY_ID.values());
  }

  static Map<String, JdbcDialect> index(List<JdbcDialect> dialects) {
    Map<String, JdbcDialect> out = new LinkedHashMap<>();
    for (JdbcDialect d : dialects) {
      JdbcDialect prev = out.putIfAbsent(d.id(), d);
      if (prev != null && prev.getClass() != d.getClass()) {
        throw new IllegalStateException("Duplicate JDBC dialect id '" + d.id() + "': "
            + prev.getClass().getName() + ", " + d.getClass().getName());
      }
    }
    return Collections.unmodifiableMap(out);
  }
}
