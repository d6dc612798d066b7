package io.intellixity.qsfilter;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.InjectableValues;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.intellixity.qsfilter.querystring.BracketQueryParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Binds request parameters to {@link QueryFilter}s and filter groups.
 * <p>
 * Decoding and binding are separate steps: the query string is first decoded into a JSON tree by
 * {@link BracketQueryParser}, then bound with Jackson. Any tree of the same shape, such as a JSON
 * request body, can be bound with {@link #read(JsonNode, FilterSchema)}.
 * <p>
 * Instances are immutable and safe to share.
 */
public final class QueryFilterReader {
  private static final Logger log = LoggerFactory.getLogger(QueryFilterReader.class);

  private final ObjectMapper mapper;
  private final BracketQueryParser parser;

  public QueryFilterReader() {
    this(defaultMapper());
  }

  public QueryFilterReader(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.parser = new BracketQueryParser(mapper.getNodeFactory());
  }

  /** Mapper that ignores unknown keys, so unrelated request parameters pass through. */
  public static ObjectMapper defaultMapper() {
    return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public <T extends Filter> QueryFilter<T> read(String query, FilterSchema<T> schema) {
    return read(parser.parse(query), schema);
  }

  public <T extends Filter> QueryFilter<T> read(JsonNode tree, FilterSchema<T> schema) {
    Objects.requireNonNull(schema, "schema");
    JavaType type = mapper.getTypeFactory().constructParametricType(QueryFilter.class, schema.type());
    ObjectReader reader = mapper.readerFor(type)
        .with(new InjectableValues.Std().addValue(FilterSchema.class, schema));
    return bind(reader, tree);
  }

  /** Binds a bare filter group, e.g. {@code age[lt]=50&name[contains]=John}. */
  public <T> T readFilter(String query, Class<T> type) {
    return readFilter(parser.parse(query), type);
  }

  public <T> T readFilter(JsonNode tree, Class<T> type) {
    return bind(mapper.readerFor(type), tree);
  }

  private <T> T bind(ObjectReader reader, JsonNode tree) {
    try {
      return reader.readValue(tree);
    } catch (JsonMappingException e) {
      String path = path(e);
      log.debug("qsfilter.read failed path={} reason={}", path, e.getOriginalMessage());
      throw new FilterDeserializationException(e.getOriginalMessage(), path, e);
    } catch (IOException e) {
      throw new FilterDeserializationException(e.getMessage(), null, e);
    }
  }

  private static String path(JsonMappingException e) {
    StringBuilder sb = new StringBuilder();
    for (JsonMappingException.Reference ref : e.getPath()) {
      if (ref.getFieldName() != null) {
        if (sb.length() > 0) sb.append('.');
        sb.append(ref.getFieldName());
      } else if (ref.getIndex() >= 0) {
        sb.append('[').append(ref.getIndex()).append(']');
      }
    }
    return sb.length() == 0 ? null : sb.toString();
  }
}
