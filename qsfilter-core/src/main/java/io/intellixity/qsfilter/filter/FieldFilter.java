package io.intellixity.qsfilter.filter;

import io.intellixity.qsfilter.query.Condition;

/** One typed comparison on a field, compiled against a concrete column. */
public interface FieldFilter {
  Condition toCondition(String column);
}
