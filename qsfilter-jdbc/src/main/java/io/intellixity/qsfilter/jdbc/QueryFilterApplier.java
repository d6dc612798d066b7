package io.intellixity.qsfilter.jdbc;

import io.intellixity.qsfilter.Filter;
import io.intellixity.qsfilter.Order;
import io.intellixity.qsfilter.QueryFilter;
import io.intellixity.qsfilter.QueryFilterConfig;
import io.intellixity.qsfilter.jdbc.statement.FilterableStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Shapes a statement from a {@link QueryFilter}: WHERE from the filter group, LIMIT (and OFFSET
 * for selects), and ORDER BY when the requested sort field is declared sortable.
 * <p>
 * Only mutates the statement; nothing is rendered or executed here.
 */
public final class QueryFilterApplier {
  private static final Logger log = LoggerFactory.getLogger(QueryFilterApplier.class);

  private QueryFilterApplier() {}

  public static <S extends FilterableStatement<S>> S applyConditions(S statement, Filter filter) {
    Objects.requireNonNull(statement, "statement");
    Objects.requireNonNull(filter, "filter");
    return statement.where(filter.toCondition());
  }

  public static <S extends FilterableStatement<S>> S applyFilters(S statement, QueryFilter<?> queryFilter) {
    return applyFilters(statement, queryFilter, QueryFilterConfig.defaults(), LimitPolicy.UNBOUNDED);
  }

  public static <S extends FilterableStatement<S>> S applyFilters(S statement, QueryFilter<?> queryFilter,
                                                                 LimitPolicy limitPolicy) {
    return applyFilters(statement, queryFilter, QueryFilterConfig.defaults(), limitPolicy);
  }

  public static <S extends FilterableStatement<S>> S applyFilters(S statement, QueryFilter<?> queryFilter,
                                                                 QueryFilterConfig config, LimitPolicy limitPolicy) {
    Objects.requireNonNull(statement, "statement");
    Objects.requireNonNull(queryFilter, "queryFilter");
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(limitPolicy, "limitPolicy");

    boolean withOffset = statement.supportsOffset();
    int offset = withOffset ? queryFilter.offset() : 0;
    int limit = limitPolicy.apply(queryFilter.limit(offset, config), queryFilter.maxLimit());
    Optional<String> sort = queryFilter.sort();
    Order order = queryFilter.order();

    S out = statement;
    Filter filter = queryFilter.filter().orElse(null);
    if (filter != null) {
      out = applyConditions(out, filter);
    }

    out = out.limit(limit);
    if (withOffset) {
      out = out.offset(offset);
    }

    if (sort.isPresent()) {
      out = out.orderBy(sort.get(), order.direction());
    } else if (queryFilter.requestedSort() != null && log.isDebugEnabled()) {
      log.debug("qsfilter.apply sort_ignored field={} sortable={}",
          queryFilter.requestedSort(), queryFilter.schema().sortableFields());
    }

    if (log.isDebugEnabled()) {
      log.debug("qsfilter.apply statement={} filter={} offset={} limit={} sort={} order={} policy={}",
          statement.getClass().getSimpleName(), filter != null, withOffset ? offset : "-", limit,
          sort.orElse("-"), order, limitPolicy);
    }
    return out;
  }
}
