package io.intellixity.qsfilter;

import com.fasterxml.jackson.annotation.JacksonInject;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.Optional;

/**
 * Paging, sorting and filtering parameters of one list request:
 * {@code start}, {@code end}, {@code sort}, {@code order} and {@code filter}.
 * <p>
 * Raw values are kept as received; {@link #offset()}, {@link #limit(int)}, {@link #sort()} and
 * {@link #order()} interpret them. Instances are bound by {@link QueryFilterReader}, which injects
 * the {@link FilterSchema} of {@code T}.
 *
 * @param <T> filter group type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class QueryFilter<T extends Filter> {
  private final FilterSchema<T> schema;
  private final Integer start;
  private final Integer end;
  private final String sort;
  private final String order;
  private final T filter;

  @JsonCreator
  public QueryFilter(@JacksonInject FilterSchema<T> schema,
                     @JsonProperty("start") Integer start,
                     @JsonProperty("end") Integer end,
                     @JsonProperty("sort") String sort,
                     @JsonProperty("order") String order,
                     @JsonProperty("filter") T filter) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.start = start;
    this.end = end;
    this.sort = sort;
    this.order = order;
    this.filter = filter;
  }

  public static <T extends Filter> QueryFilter<T> of(FilterSchema<T> schema, T filter) {
    return new QueryFilter<>(schema, null, null, null, null, filter);
  }

  public FilterSchema<T> schema() { return schema; }

  public Integer start() { return start; }
  public Integer end() { return end; }
  public String requestedSort() { return sort; }
  public String requestedOrder() { return order; }

  /** {@code start}, or 0 when absent. Negative values are returned unchanged. */
  public int offset() {
    return start != null ? start : 0;
  }

  public int limit(int offset) {
    return limit(offset, QueryFilterConfig.defaults());
  }

  /**
   * {@code max(end - offset, 1)} when {@code end} is present, otherwise
   * {@link QueryFilterConfig#defaultLimit()}. Not clamped to {@link #maxLimit()}.
   */
  public int limit(int offset, QueryFilterConfig config) {
    if (end == null) return config.defaultLimit();
    long span = (long) end - offset;
    return (int) Math.max(1L, Math.min(span, Integer.MAX_VALUE));
  }

  /** The requested sort field if the schema declares it sortable. */
  public Optional<String> sort() {
    return schema.validateSortableField(sort);
  }

  public Order order() {
    return Order.parse(order);
  }

  public Optional<T> filter() {
    return Optional.ofNullable(filter);
  }

  public int maxLimit() {
    return schema.maxLimit();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof QueryFilter<?> q)) return false;
    return schema.equals(q.schema)
        && Objects.equals(start, q.start)
        && Objects.equals(end, q.end)
        && Objects.equals(sort, q.sort)
        && Objects.equals(order, q.order)
        && Objects.equals(filter, q.filter);
  }

  @Override
  public int hashCode() {
    return Objects.hash(schema, start, end, sort, order, filter);
  }

  @Override
  public String toString() {
    return "QueryFilter{start=" + start + ", end=" + end + ", sort=" + sort + ", order=" + order
        + ", filter=" + filter + "}";
  }
}
