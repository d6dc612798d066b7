package io.intellixity.qsfilter.querystring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.qsfilter.FilterDeserializationException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes a bracket-style query string into a JSON tree.
 *
 * <pre>
 * filter[age][gte]=20&amp;filter[age][lt]=50&amp;sort=age
 *   -&gt; {"filter":{"age":{"gte":"20","lt":"50"}},"sort":"age"}
 * </pre>
 *
 * Keys and values are percent-decoded ({@code +} is a space). Object keys keep their first
 * appearance order. A key seen more than once, or written with a trailing {@code []}, becomes an
 * array of its values in encounter order. All leaves are strings; typing happens at binding time.
 */
public final class BracketQueryParser {
  private final JsonNodeFactory nodes;

  public BracketQueryParser() {
    this(JsonNodeFactory.instance);
  }

  public BracketQueryParser(JsonNodeFactory nodes) {
    this.nodes = nodes;
  }

  public ObjectNode parse(String query) {
    ObjectNode root = nodes.objectNode();
    if (query == null || query.isEmpty()) return root;
    String q = query.charAt(0) == '?' ? query.substring(1) : query;

    for (String pair : q.split("&")) {
      if (pair.isEmpty()) continue;
      int eq = pair.indexOf('=');
      String rawKey = eq < 0 ? pair : pair.substring(0, eq);
      String rawValue = eq < 0 ? "" : pair.substring(eq + 1);
      if (rawKey.isEmpty()) continue;

      String key = decode(rawKey);
      put(root, segments(key), decode(rawValue), key);
    }
    return root;
  }

  /** {@code a[b][c]} -&gt; [a, b, c]; a key with unbalanced brackets is taken literally. */
  static List<String> segments(String key) {
    int open = key.indexOf('[');
    if (open <= 0) return List.of(key);

    List<String> out = new ArrayList<>();
    out.add(key.substring(0, open));
    int i = open;
    while (i < key.length()) {
      if (key.charAt(i) != '[') return List.of(key);
      int close = key.indexOf(']', i);
      if (close < 0) return List.of(key);
      out.add(key.substring(i + 1, close));
      i = close + 1;
    }
    return out;
  }

  private void put(ObjectNode root, List<String> path, String value, String key) {
    boolean append = path.size() > 1 && path.get(path.size() - 1).isEmpty();
    List<String> p = append ? path.subList(0, path.size() - 1) : path;

    ObjectNode cur = root;
    for (int i = 0; i < p.size() - 1; i++) {
      String seg = p.get(i);
      if (seg.isEmpty()) {
        throw new FilterDeserializationException("Unsupported empty segment in key '" + key + "'", key);
      }
      JsonNode child = cur.get(seg);
      if (child == null) {
        cur = cur.putObject(seg);
      } else if (child instanceof ObjectNode o) {
        cur = o;
      } else {
        throw new FilterDeserializationException("Key '" + key + "' nests under a plain value", key);
      }
    }

    String leaf = p.get(p.size() - 1);
    JsonNode existing = cur.get(leaf);
    if (existing == null) {
      if (append) cur.putArray(leaf).add(value);
      else cur.put(leaf, value);
    } else if (existing instanceof ArrayNode a) {
      a.add(value);
    } else if (existing.isObject()) {
      throw new FilterDeserializationException("Key '" + key + "' is used both as a value and as an object", key);
    } else {
      ArrayNode a = nodes.arrayNode();
      a.add(existing);
      a.add(value);
      cur.set(leaf, a);
    }
  }

  private static String decode(String s) {
    try {
      return URLDecoder.decode(s, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new FilterDeserializationException("Malformed percent-encoding in '" + s + "'", null, e);
    }
  }
}
