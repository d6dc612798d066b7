package io.intellixity.qsfilter.filter.json;

import io.intellixity.qsfilter.filter.NumberFilter;
import io.intellixity.qsfilter.filter.NumberFilterSet;
import io.intellixity.qsfilter.filter.FilterValues;
import io.intellixity.qsfilter.filter.NumberOperator;

import java.io.IOException;
import java.util.List;

public final class NumberFilterSetDeserializer extends AbstractFilterSetDeserializer<NumberFilterSet> {
  public NumberFilterSetDeserializer() {
    super(NumberFilterSet.class, NumberOperator.tokens());
  }

  @Override
  protected NumberFilterSet newSet() { return new NumberFilterSet(); }

  @Override
  protected void addFilters(NumberFilterSet set, String token, List<String> rawValues, Operands operands) throws IOException {
    NumberOperator op = NumberOperator.fromToken(token).orElseThrow(() -> operands.unknownToken(token));
    for (String raw : rawValues) {
      set.push(new NumberFilter(op, operands.parse(token, raw, Long.class, FilterValues::parseNumber)));
    }
  }
}
