package io.intellixity.qsfilter.jdbc;

/** Positional parameter value of a rendered {@link SqlStatement}. */
public record Bind(Object value) {}
