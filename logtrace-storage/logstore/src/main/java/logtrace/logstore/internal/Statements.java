/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore.internal;

/**
 * Analytic statements sent to the log store. The leading {@code *} matches every record and the
 * part after the pipe aggregates them. Predicates come from {@link QueryCompiler} and may be empty.
 */
public final class Statements {
  static final String TS = "ts";

  /** Trace IDs matching the predicate, ordered by their latest span start, newest first. */
  public static String findTraceIds(QueryCompiler compiler, String predicate, int limit) {
    String traceId = compiler.identifier(LogField.TRACE_ID);
    return select(traceId + ", max(" + compiler.identifier(LogField.START_TIME) + ") as " + TS,
      predicate,
      "group by " + traceId + " order by " + TS + " desc limit " + limit);
  }

  /** Distinct values of {@code field} across records matching the predicate. */
  public static String distinct(QueryCompiler compiler, LogField field, String predicate,
    int limit) {
    return select("distinct " + compiler.identifier(field), predicate, "limit " + limit);
  }

  /** Every field of records matching the predicate. */
  public static String selectAll(String predicate, int limit) {
    return select("*", predicate, "limit " + limit);
  }

  /** Cheapest statement that proves the store is reachable and the logstore exists. */
  public static String count() {
    return select("count(1) as total", "", "");
  }

  static String select(String projection, String predicate, String suffix) {
    StringBuilder result = new StringBuilder("* | select ").append(projection).append(" from log");
    if (!predicate.isEmpty()) result.append(' ').append(predicate);
    if (!suffix.isEmpty()) result.append(' ').append(suffix);
    return result.toString();
  }

  Statements() {
  }
}
