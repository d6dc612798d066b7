package io.intellixity.qsfilter.filter;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.intellixity.qsfilter.filter.json.StringFilterSetDeserializer;

@JsonDeserialize(using = StringFilterSetDeserializer.class)
public final class StringFilterSet extends FilterSet<StringFilter> {
  public StringFilterSet() {}

  public static StringFilterSet of(StringFilter... filters) {
    StringFilterSet set = new StringFilterSet();
    for (StringFilter f : filters) set.push(f);
    return set;
  }
}
