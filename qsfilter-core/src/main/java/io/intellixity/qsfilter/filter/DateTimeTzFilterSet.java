package io.intellixity.qsfilter.filter;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.qsfilter.filter.json.DateTimeTzFilterSetDeserializer;

@JsonDeserialize(using = DateTimeTzFilterSetDeserializer.class)
public final class DateTimeTzFilterSet extends FilterSet<DateTimeTzFilter> {
  public DateTimeTzFilterSet() {}

  public static DateTimeTzFilterSet of(DateTimeTzFilter... filters) {
    DateTimeTzFilterSet set = new DateTimeTzFilterSet();
    for (DateTimeTzFilter f : filters) set.push(f);
    return set;
  }
}
