package io.intellixity.qsfilter.filter;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.qsfilter.filter.json.DateTimeFilterSetDeserializer;

@JsonDeserialize(using = DateTimeFilterSetDeserializer.class)
public final class DateTimeFilterSet extends FilterSet<DateTimeFilter> {
  public DateTimeFilterSet() {}

  public static DateTimeFilterSet of(DateTimeFilter... filters) {
    DateTimeFilterSet set = new DateTimeFilterSet();
    for (DateTimeFilter f : filters) set.push(f);
    return set;
  }
}
