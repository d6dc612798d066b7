package io.intellixity.qsfilter.filter.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import io.intellixity.qsfilter.filter.FilterSet;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Binds a decoded {@code {token: value | [values]}} object to a {@link FilterSet}.
 * <p>
 * Tokens are bound in the domain's fixed order, not in the order they were decoded, so the same
 * query yields the same filter set however its parameters are arranged. A token that repeats in
 * the query arrives as an array and, unless the domain gathers it into one filter, yields one
 * filter per value in encounter order. Unknown tokens and malformed operands fail the whole call.
 */
public abstract class AbstractFilterSetDeserializer<S extends FilterSet<?>> extends StdDeserializer<S> {

  private final List<String> bindOrder;

  /** @param bindOrder every token of the domain, in the order filters are pushed */
  protected AbstractFilterSetDeserializer(Class<S> type, List<String> bindOrder) {
    super(type);
    this.bindOrder = List.copyOf(bindOrder);
  }

  protected abstract S newSet();

  /** Parses {@code rawValues} of one operator token and pushes the resulting filters onto {@code set}. */
  protected abstract void addFilters(S set, String token, List<String> rawValues, Operands operands) throws IOException;

  @Override
  public S deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    String field = p.currentName();
    JsonNode node = ctxt.readTree(p);
    Operands operands = new Operands(p, field == null ? "<root>" : field);

    if (!node.isObject()) {
      throw MismatchedInputException.from(p, handledType(),
          "Expected an operator map for field '" + operands.field + "', got " + node.getNodeType());
    }

    Map<String, List<String>> byToken = new HashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = node.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      if (!bindOrder.contains(e.getKey())) throw operands.unknownToken(e.getKey());
      byToken.put(e.getKey(), rawValues(e.getKey(), e.getValue(), operands));
    }

    S set = newSet();
    for (String token : bindOrder) {
      List<String> raw = byToken.get(token);
      if (raw != null) addFilters(set, token, raw, operands);
    }
    return set;
  }

  private List<String> rawValues(String token, JsonNode value, Operands operands) throws IOException {
    List<String> out = new ArrayList<>();
    if (value.isArray()) {
      for (JsonNode x : value) out.add(scalar(token, x, operands));
    } else {
      out.add(scalar(token, value, operands));
    }
    return out;
  }

  private String scalar(String token, JsonNode value, Operands operands) throws IOException {
    if (value == null || value.isNull() || value.isContainerNode()) {
      throw MismatchedInputException.from(operands.parser, handledType(),
          "Field '" + operands.field + "' operator '" + token + "' expects a scalar value");
    }
    return value.asText();
  }

  /** Per-call parsing helper that turns operand failures into Jackson mapping errors. */
  protected final class Operands {
    private final JsonParser parser;
    private final String field;

    private Operands(JsonParser parser, String field) {
      this.parser = parser;
      this.field = field;
    }

    public String field() { return field; }

    public <T> T parse(String token, String raw, Class<T> type, Function<String, T> decoder) throws IOException {
      try {
        return decoder.apply(raw);
      } catch (RuntimeException e) {
        throw InvalidFormatException.from(parser,
            "Field '" + field + "' operator '" + token + "': cannot parse '" + raw + "' as "
                + type.getSimpleName() + " (" + e.getMessage() + ")",
            raw, type);
      }
    }

    public JsonMappingException unknownToken(String token) {
      return MismatchedInputException.from(parser, handledType(),
          "Field '" + field + "': unknown operator '" + token + "' for " + handledType().getSimpleName());
    }
  }
}
