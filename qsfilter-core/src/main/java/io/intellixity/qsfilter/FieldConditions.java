package io.intellixity.qsfilter;

import io.intellixity.qsfilter.filter.FilterSet;
import io.intellixity.qsfilter.query.Conjunction;
import io.intellixity.qsfilter.query.QueryElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the conjunction of a filter group's per-field conditions.
 *
 * <pre>
 * return FieldConditions.builder()
 *     .field("name", name)
 *     .field("age", age)
 *     .build();
 * </pre>
 *
 * Absent ({@code null}) and empty sets are skipped.
 */
public final class FieldConditions {
  private final List<QueryElement> parts = new ArrayList<>();

  private FieldConditions() {}

  public static FieldConditions builder() { return new FieldConditions(); }

  public FieldConditions field(String column, FilterSet<?> set) {
    FilterSet.condition(set, column).ifPresent(parts::add);
    return this;
  }

  public Conjunction build() {
    return new Conjunction(parts);
  }
}
