package io.intellixity.qsfilter.jdbc;

/** How {@link QueryFilterApplier} treats a limit above the schema's {@code maxLimit}. */
public enum LimitPolicy {
  /** Use the requested limit as is. */
  UNBOUNDED,
  /** Reduce the limit to {@code maxLimit}. */
  CLAMP_TO_MAX;

  public int apply(int limit, int maxLimit) {
    return switch (this) {
      case UNBOUNDED -> limit;
      case CLAMP_TO_MAX -> Math.min(limit, maxLimit);
    };
  }
}
