package io.intellixity.qsfilter.filter.json;

import io.intellixity.qsfilter.filter.DateTimeTzFilter;
import io.intellixity.qsfilter.filter.DateTimeTzFilterSet;
import io.intellixity.qsfilter.filter.FilterValues;
import io.intellixity.qsfilter.filter.TemporalOperator;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.List;

public final class DateTimeTzFilterSetDeserializer extends AbstractFilterSetDeserializer<DateTimeTzFilterSet> {
  public DateTimeTzFilterSetDeserializer() {
    super(DateTimeTzFilterSet.class, TemporalOperator.tokens());
  }

  @Override
  protected DateTimeTzFilterSet newSet() { return new DateTimeTzFilterSet(); }

  @Override
  protected void addFilters(DateTimeTzFilterSet set, String token, List<String> rawValues, Operands operands) throws IOException {
    TemporalOperator op = TemporalOperator.fromToken(token).orElseThrow(() -> operands.unknownToken(token));
    for (String raw : rawValues) {
      set.push(new DateTimeTzFilter(op, operands.parse(token, raw, OffsetDateTime.class, FilterValues::parseDateTimeTz)));
    }
  }
}
