package io.intellixity.qsfilter.filter.json;

import io.intellixity.qsfilter.filter.StringFilter;
import io.intellixity.qsfilter.filter.StringFilterSet;
import io.intellixity.qsfilter.filter.StringOperator;

import java.io.IOException;
import java.util.List;

public final class StringFilterSetDeserializer extends AbstractFilterSetDeserializer<StringFilterSet> {
  public StringFilterSetDeserializer() {
    super(StringFilterSet.class, StringOperator.tokens());
  }

  @Override
  protected StringFilterSet newSet() { return new StringFilterSet(); }

  @Override
  protected void addFilters(StringFilterSet set, String token, List<String> rawValues, Operands operands) throws IOException {
    StringOperator op = StringOperator.fromToken(token).orElseThrow(() -> operands.unknownToken(token));
    for (String raw : rawValues) {
      set.push(new StringFilter(op, raw));
    }
  }
}
