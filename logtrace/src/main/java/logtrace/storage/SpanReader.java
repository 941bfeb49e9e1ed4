/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.storage;

import java.util.List;
import java.util.Map;
import logtrace.Call;

/**
 * Queries spans previously written to a log store, one log record per span.
 *
 * <p>Note: This is not considered a user-level Api, rather an Spi that can be used to bind
 * user-level abstractions such as futures or observables.
 */
public interface SpanReader {

  /** Retrieves all local service names seen within the lookback, sorted lexicographically. */
  Call<List<String>> getServiceNames();

  /**
   * Retrieves all operation names recorded by a service within the lookback, sorted
   * lexicographically. Empty when {@code serviceName} is null or empty.
   */
  Call<List<String>> getOperationNames(String serviceName);

  /**
   * Retrieves IDs of traces matching the request, most recent first, no more than {@link
   * QueryRequest#limit()}.
   */
  Call<List<String>> findTraceIds(QueryRequest request);

  /**
   * Retrieves the raw log records of a trace within the lookback, or empty if none are found.
   * Each record is one span keyed by log field name.
   */
  Call<List<Map<String, String>>> getTrace(String traceId);
}
