package io.intellixity.qsfilter;

import io.intellixity.qsfilter.query.QueryElement;

/**
 * A consumer-defined group of filterable fields, typically a record whose components are
 * {@link io.intellixity.qsfilter.filter.FilterSet}s bound from {@code filter[field][op]=value}.
 * Sortable fields and limits are declared separately on a {@link FilterSchema}.
 */
public interface Filter {
  /**
   * AND of the conditions of every field that has one; an empty
   * {@link io.intellixity.qsfilter.query.Conjunction} when no field constrains anything.
   *
   * @see FieldConditions
   */
  QueryElement toCondition();
}
