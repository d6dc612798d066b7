package io.intellixity.qsfilter.filter.json;

import io.intellixity.qsfilter.filter.DateTimeFilter;
import io.intellixity.qsfilter.filter.DateTimeFilterSet;
import io.intellixity.qsfilter.filter.FilterValues;
import io.intellixity.qsfilter.filter.TemporalOperator;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;

public final class DateTimeFilterSetDeserializer extends AbstractFilterSetDeserializer<DateTimeFilterSet> {
  public DateTimeFilterSetDeserializer() {
    super(DateTimeFilterSet.class, TemporalOperator.tokens());
  }

  @Override
  protected DateTimeFilterSet newSet() { return new DateTimeFilterSet(); }

  @Override
  protected void addFilters(DateTimeFilterSet set, String token, List<String> rawValues, Operands operands) throws IOException {
    TemporalOperator op = TemporalOperator.fromToken(token).orElseThrow(() -> operands.unknownToken(token));
    for (String raw : rawValues) {
      set.push(new DateTimeFilter(op, operands.parse(token, raw, LocalDateTime.class, FilterValues::parseDateTime)));
    }
  }
}
