/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import logtrace.internal.Nullable;
import logtrace.storage.QueryRequest;

/**
 * Compiles a {@link QueryRequest} into the where-clause of a log store statement.
 *
 * <p>Each {@code build*Query} method returns exactly one clause, or the empty string when its
 * input is absent. {@link #where(List)} joins the non-empty ones. No method here fails or logs.
 *
 * <p>When created with {@code escapeLiterals == false}, values are embedded verbatim: a quote
 * inside a service name, operation name or tag value yields a predicate the store cannot parse.
 * When true, quotes are doubled, which is how the query language escapes them.
 */
public final class QueryCompiler {
  static final String WHERE = "where ", AND = " and ";

  public static QueryCompiler create(boolean escapeLiterals) {
    return escapeLiterals ? ESCAPING : VERBATIM;
  }

  static final QueryCompiler VERBATIM = new QueryCompiler(false);
  static final QueryCompiler ESCAPING = new QueryCompiler(true);

  final boolean escapeLiterals;

  QueryCompiler(boolean escapeLiterals) {
    this.escapeLiterals = escapeLiterals;
  }

  /**
   * Returns "where " followed by the clauses of the request joined with "and", or empty if the
   * request has no filters. The start time range is not part of the predicate: it is passed to the
   * store as the query window.
   *
   * <p>Clause order is service name, operation name, duration, then tags sorted by key.
   */
  public String buildFindTraceIdsQuery(QueryRequest request) {
    List<String> clauses = new ArrayList<>();
    clauses.add(buildServiceNameQuery(request.serviceName()));
    clauses.add(buildOperationNameQuery(request.operationName()));
    clauses.add(buildDurationQuery(request.durationMin(), request.durationMax()));
    // tag maps have no reliable iteration order
    for (Map.Entry<String, String> tag : new TreeMap<>(request.tags()).entrySet()) {
      clauses.add(buildTagQuery(tag.getKey(), tag.getValue()));
    }
    return where(clauses);
  }

  /** Ex. {@code "process.serviceName" = 'frontend'} */
  public String buildServiceNameQuery(@Nullable String serviceName) {
    return equalTo(LogField.SERVICE_NAME, serviceName);
  }

  /** Ex. {@code operationName = 'get'} */
  public String buildOperationNameQuery(@Nullable String operationName) {
    return equalTo(LogField.OPERATION_NAME, operationName);
  }

  /** Ex. {@code traceID = '463ac35c9f6413ad'} */
  public String buildTraceIdQuery(@Nullable String traceId) {
    return equalTo(LogField.TRACE_ID, traceId);
  }

  /**
   * Bounds the duration field, inclusive on both ends. Arguments are nanoseconds, where zero means
   * unbounded. Ex. {@code 1000000000 <= duration and duration <= 2000000000}
   */
  public String buildDurationQuery(long durationMin, long durationMax) {
    String duration = identifier(LogField.DURATION);
    if (durationMin != 0 && durationMax != 0) {
      return durationMin + " <= " + duration + AND + duration + " <= " + durationMax;
    } else if (durationMin != 0) {
      return durationMin + " <= " + duration;
    } else if (durationMax != 0) {
      return duration + " <= " + durationMax;
    }
    return "";
  }

  /** Ex. {@code "tags.http.method" = 'POST'} */
  public String buildTagQuery(@Nullable String key, @Nullable String value) {
    if (key == null || key.isEmpty() || value == null) return "";
    return identifier(LogField.tagColumn(key), true) + " = " + literal(value);
  }

  /** Returns how {@code field} is referenced in a statement. */
  public String identifier(LogField field) {
    return identifier(field.column, field.quoted);
  }

  /** Joins non-empty clauses with "and", prefixed by "where ". Empty if all clauses are empty. */
  public static String where(List<String> clauses) {
    StringBuilder result = new StringBuilder();
    for (String clause : clauses) {
      if (clause == null || clause.isEmpty()) continue;
      result.append(result.length() == 0 ? WHERE : AND).append(clause);
    }
    return result.toString();
  }

  String equalTo(LogField field, @Nullable String value) {
    if (value == null || value.isEmpty()) return "";
    return identifier(field) + " = " + literal(value);
  }

  String identifier(String column, boolean quoted) {
    if (!quoted) return column;
    return '"' + (escapeLiterals ? column.replace("\"", "\"\"") : column) + '"';
  }

  String literal(String value) {
    return '\'' + (escapeLiterals ? value.replace("'", "''") : value) + '\'';
  }

  @Override public String toString() {
    return "QueryCompiler{escapeLiterals=" + escapeLiterals + "}";
  }
}
