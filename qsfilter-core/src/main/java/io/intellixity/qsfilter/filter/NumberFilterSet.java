package io.intellixity.qsfilter.filter;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.qsfilter.filter.json.NumberFilterSetDeserializer;

@JsonDeserialize(using = NumberFilterSetDeserializer.class)
public final class NumberFilterSet extends FilterSet<NumberFilter> {
  public NumberFilterSet() {}

  public static NumberFilterSet of(NumberFilter... filters) {
    NumberFilterSet set = new NumberFilterSet();
    for (NumberFilter f : filters) set.push(f);
    return set;
  }
}
