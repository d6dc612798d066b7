package io.intellixity.qsfilter.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Logical AND over an ordered list of elements.
 * <p>
 * An empty conjunction is always true; renderers omit it instead of emitting a WHERE clause.
 */
public final class Conjunction implements QueryElement {
  private static final Conjunction EMPTY = new Conjunction(List.of());

  private final List<QueryElement> elements;

  public Conjunction(List<QueryElement> elements) {
    this.elements = List.copyOf(elements == null ? List.of() : elements);
  }

  public static Conjunction all() { return EMPTY; }

  public List<QueryElement> elements() { return elements; }

  public boolean isEmpty() { return elements.isEmpty(); }

  /** Returns a new conjunction with {@code element} appended. */
  public Conjunction add(QueryElement element) {
    Objects.requireNonNull(element, "element");
    List<QueryElement> out = new ArrayList<>(elements.size() + 1);
    out.addAll(elements);
    out.add(element);
    return new Conjunction(out);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof Conjunction c && elements.equals(c.elements);
  }

  @Override
  public int hashCode() { return elements.hashCode(); }

  @Override
  public String toString() { return "AND" + elements; }
}
