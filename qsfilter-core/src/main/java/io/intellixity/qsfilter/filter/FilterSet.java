package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Conjunction;
import io.intellixity.qsfilter.query.QueryElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, multi-valued collection of filters of one domain, for one field.
 * <p>
 * Insertion order is kept and nothing is deduplicated: {@code gte 20} and {@code lt 50} on the
 * same field are two independent filters ANDed together.
 *
 * @param <F> filter domain
 */
public abstract class FilterSet<F extends FieldFilter> {
  private final List<F> filters = new ArrayList<>();

  protected FilterSet() {}

  public void push(F filter) {
    filters.add(Objects.requireNonNull(filter, "filter"));
  }

  public boolean isEmpty() { return filters.isEmpty(); }

  public int size() { return filters.size(); }

  public List<F> filters() { return Collections.unmodifiableList(filters); }

  /**
   * AND of every filter compiled against {@code column}, in insertion order.
   *
   * @return empty when nothing was pushed
   */
  public Optional<QueryElement> condition(String column) {
    Objects.requireNonNull(column, "column");
    if (filters.isEmpty()) return Optional.empty();
    List<QueryElement> parts = new ArrayList<>(filters.size());
    for (F f : filters) parts.add(f.toCondition(column));
    return Optional.of(new Conjunction(parts));
  }

  /** Null-tolerant variant of {@link #condition(String)} for absent fields. */
  public static Optional<QueryElement> condition(FilterSet<?> set, String column) {
    return set == null ? Optional.empty() : set.condition(column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || o.getClass() != getClass()) return false;
    return filters.equals(((FilterSet<?>) o).filters);
  }

  @Override
  public int hashCode() { return filters.hashCode(); }

  @Override
  public String toString() { return getClass().getSimpleName() + filters; }
}
