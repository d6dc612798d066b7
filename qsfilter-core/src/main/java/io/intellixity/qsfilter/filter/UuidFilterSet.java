package io.intellixity.qsfilter.filter;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.qsfilter.filter.json.UuidFilterSetDeserializer;

@JsonDeserialize(using = UuidFilterSetDeserializer.class)
public final class UuidFilterSet extends FilterSet<UuidFilter> {
  public UuidFilterSet() {}

  public static UuidFilterSet of(UuidFilter... filters) {
    UuidFilterSet set = new UuidFilterSet();
    for (UuidFilter f : filters) set.push(f);
    return set;
  }
}
