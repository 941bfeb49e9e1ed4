/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Executes statements against a log store. Implementations usually wrap a vendor SDK, and own its
 * connection, authentication and retry policy.
 *
 * <p>Implementations should not block the calling thread, and should complete the stage
 * exceptionally with the original error on failure. Errors are passed to callers unmodified.
 */
public interface LogStoreClient {

  /** Returns the rows matching {@link GetLogsRequest#query()}, one map per row. */
  CompletionStage<List<Map<String, String>>> getLogs(GetLogsRequest request);
}
