package io.intellixity.qsfilter.filter.json;

import io.intellixity.qsfilter.filter.FilterValues;
import io.intellixity.qsfilter.filter.UuidFilter;
import io.intellixity.qsfilter.filter.UuidFilterSet;
import io.intellixity.qsfilter.filter.UuidOperator;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** {@code id[in]=a&id[in]=b} becomes a single IN filter over {@code [a, b]}; each {@code eq} value its own filter. */
public final class UuidFilterSetDeserializer extends AbstractFilterSetDeserializer<UuidFilterSet> {
  public UuidFilterSetDeserializer() {
    super(UuidFilterSet.class, UuidOperator.tokens());
  }

  @Override
  protected UuidFilterSet newSet() { return new UuidFilterSet(); }

  @Override
  protected void addFilters(UuidFilterSet set, String token, List<String> rawValues, Operands operands) throws IOException {
    UuidOperator op = UuidOperator.fromToken(token).orElseThrow(() -> operands.unknownToken(token));
    List<UUID> ids = new ArrayList<>(rawValues.size());
    for (String raw : rawValues) {
      ids.add(operands.parse(token, raw, UUID.class, FilterValues::parseUuid));
    }
    switch (op) {
      case IN -> set.push(UuidFilter.in(ids));
      case EQUALS -> ids.forEach(id -> set.push(UuidFilter.eq(id)));
    }
  }
}
