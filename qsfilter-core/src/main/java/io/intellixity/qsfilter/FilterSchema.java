package io.intellixity.qsfilter;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Static description of a filter group type: which fields may be sorted on and the largest
 * limit callers should allow. Declared once per type and shared read-only, e.g.
 *
 * <pre>
 * public static final FilterSchema&lt;UserFilters&gt; SCHEMA =
 *     FilterSchema.of(UserFilters.class, "name", "age", "score");
 * </pre>
 *
 * @param <T> filter group type
 */
public record FilterSchema<T extends Filter>(Class<T> type, List<String> sortableFields, int maxLimit) {
  public FilterSchema {
    Objects.requireNonNull(type, "type");
    sortableFields = List.copyOf(sortableFields == null ? List.of() : sortableFields);
    if (maxLimit <= 0) throw new IllegalArgumentException("maxLimit must be > 0");
  }

  public static <T extends Filter> FilterSchema<T> of(Class<T> type, String... sortableFields) {
    return new FilterSchema<>(type, List.of(sortableFields), QueryFilterConfig.defaults().maxLimit());
  }

  public FilterSchema<T> withMaxLimit(int maxLimit) {
    return new FilterSchema<>(type, sortableFields, maxLimit);
  }

  /**
   * Returns the declared name equal to {@code field}, or empty. Unknown names are not an error;
   * they simply disable sorting.
   */
  public Optional<String> validateSortableField(String field) {
    if (field == null) return Optional.empty();
    for (String f : sortableFields) {
      if (f.equals(field)) return Optional.of(f);
    }
    return Optional.empty();
  }
}
