package io.intellixity.qsfilter.query;

/** Node of a predicate tree: a single {@link Condition} or a {@link Conjunction} of nodes. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
