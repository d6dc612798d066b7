package io.intellixity.qsfilter.filter;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.qsfilter.filter.json.DateFilterSetDeserializer;

@JsonDeserialize(using = DateFilterSetDeserializer.class)
public final class DateFilterSet extends FilterSet<DateFilter> {
  public DateFilterSet() {}

  public static DateFilterSet of(DateFilter... filters) {
    DateFilterSet set = new DateFilterSet();
    for (DateFilter f : filters) set.push(f);
    return set;
  }
}
