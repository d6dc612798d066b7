package io.intellixity.qsfilter.query;

public interface QueryVisitor<Q> {
  Q visit(Condition condition);
  Q visit(Conjunction conjunction);
}
