package io.intellixity.qsfilter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Properties;

/**
 * Paging defaults.
 * <p>
 * {@link #defaults()} is read once from {@value #RESOURCE} on the classpath, when present:
 * <pre>
 * qsfilter.default-limit=10
 * qsfilter.max-limit=100
 * </pre>
 *
 * @param defaultLimit limit used when a request has no {@code end}
 * @param maxLimit     largest limit a {@link FilterSchema} allows unless it declares its own
 */
public record QueryFilterConfig(int defaultLimit, int maxLimit) {
  private static final Logger log = LoggerFactory.getLogger(QueryFilterConfig.class);

  public static final String RESOURCE = "META-INF/qsfilter.properties";
  public static final String DEFAULT_LIMIT_KEY = "qsfilter.default-limit";
  public static final String MAX_LIMIT_KEY = "qsfilter.max-limit";

  public static final QueryFilterConfig DEFAULT = new QueryFilterConfig(10, 100);

  public QueryFilterConfig {
    if (defaultLimit <= 0) throw new IllegalArgumentException("defaultLimit must be > 0");
    if (maxLimit <= 0) throw new IllegalArgumentException("maxLimit must be > 0");
  }

  public QueryFilterConfig withDefaultLimit(int defaultLimit) { return new QueryFilterConfig(defaultLimit, maxLimit); }
  public QueryFilterConfig withMaxLimit(int maxLimit) { return new QueryFilterConfig(defaultLimit, maxLimit); }

  public static QueryFilterConfig defaults() {
    return Holder.INSTANCE;
  }

  /** Loads {@code resource} from {@code cl}; missing resource or keys fall back to {@link #DEFAULT}. */
  public static QueryFilterConfig load(ClassLoader cl, String resource) {
    if (cl == null) cl = QueryFilterConfig.class.getClassLoader();
    URL url = cl.getResource(resource);
    if (url == null) {
      log.debug("qsfilter.config resource={} found=false using={}", resource, DEFAULT);
      return DEFAULT;
    }

    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load " + resource + " from " + url, e);
    }

    QueryFilterConfig cfg = new QueryFilterConfig(
        intProperty(p, DEFAULT_LIMIT_KEY, DEFAULT.defaultLimit),
        intProperty(p, MAX_LIMIT_KEY, DEFAULT.maxLimit));
    log.debug("qsfilter.config resource={} url={} loaded={}", resource, url, cfg);
    return cfg;
  }

  private static int intProperty(Properties p, String key, int def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": '" + v + "'", e);
    }
  }

  private static final class Holder {
    private static final QueryFilterConfig INSTANCE =
        load(Thread.currentThread().getContextClassLoader(), RESOURCE);
  }
}
