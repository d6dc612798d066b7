package io.intellixity.qsfilter.filter.json;

import io.intellixity.qsfilter.filter.DateFilter;
import io.intellixity.qsfilter.filter.DateFilterSet;
import io.intellixity.qsfilter.filter.FilterValues;
import io.intellixity.qsfilter.filter.TemporalOperator;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

public final class DateFilterSetDeserializer extends AbstractFilterSetDeserializer<DateFilterSet> {
  public DateFilterSetDeserializer() {
    super(DateFilterSet.class, TemporalOperator.tokens());
  }

  @Override
  protected DateFilterSet newSet() { return new DateFilterSet(); }

  @Override
  protected void addFilters(DateFilterSet set, String token, List<String> rawValues, Operands operands) throws IOException {
    TemporalOperator op = TemporalOperator.fromToken(token).orElseThrow(() -> operands.unknownToken(token));
    for (String raw : rawValues) {
      set.push(new DateFilter(op, operands.parse(token, raw, LocalDate.class, FilterValues::parseDate)));
    }
  }
}
