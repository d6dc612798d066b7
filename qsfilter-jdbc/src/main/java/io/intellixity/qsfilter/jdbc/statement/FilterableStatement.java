package io.intellixity.qsfilter.jdbc.statement;

import io.intellixity.qsfilter.Filter;
import io.intellixity.qsfilter.QueryFilter;
import io.intellixity.qsfilter.jdbc.LimitPolicy;
import io.intellixity.qsfilter.jdbc.QueryFilterApplier;
import io.intellixity.qsfilter.query.QueryElement;
import io.intellixity.qsfilter.query.SortField;

/**
 * Statement that accepts a WHERE predicate, a limit and an ORDER BY.
 *
 * @param <S> concrete statement type, returned by the fluent mutators
 */
public interface FilterableStatement<S extends FilterableStatement<S>> {
  /** ANDs {@code condition} into the current WHERE predicate. */
  S where(QueryElement condition);

  S limit(int limit);

  S orderBy(String column, SortField.Direction direction);

  /** False for statements without an offset, such as deletes. */
  boolean supportsOffset();

  /** @throws UnsupportedOperationException when {@link #supportsOffset()} is false */
  S offset(int offset);

  @SuppressWarnings("unchecked")
  default S applyConditions(Filter filter) {
    return QueryFilterApplier.applyConditions((S) this, filter);
  }

  @SuppressWarnings("unchecked")
  default S applyFilters(QueryFilter<?> queryFilter) {
    return QueryFilterApplier.applyFilters((S) this, queryFilter);
  }

  @SuppressWarnings("unchecked")
  default S applyFilters(QueryFilter<?> queryFilter, LimitPolicy limitPolicy) {
    return QueryFilterApplier.applyFilters((S) this, queryFilter, limitPolicy);
  }
}
