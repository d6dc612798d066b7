package io.intellixity.qsfilter;

/**
 * Raised when a query cannot be bound to a filter group: unknown operator token, malformed
 * operand, malformed paging value or malformed query string.
 * <p>
 * The whole request is rejected; there is no partial result.
 */
public final class FilterDeserializationException extends RuntimeException {
  private final String path;

  public FilterDeserializationException(String message, String path) {
    super(message);
    this.path = path;
  }

  public FilterDeserializationException(String message, String path, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  /** Location of the offending value, e.g. {@code filter.age}, or {@code null} when unknown. */
  public String path() { return path; }
}
