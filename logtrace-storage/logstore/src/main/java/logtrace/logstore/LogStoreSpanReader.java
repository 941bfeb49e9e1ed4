/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import logtrace.Call;
import logtrace.logstore.internal.ColumnProjector;
import logtrace.logstore.internal.LogField;
import logtrace.logstore.internal.QueryCompiler;
import logtrace.logstore.internal.SortDistinct;
import logtrace.logstore.internal.Statements;
import logtrace.logstore.internal.client.GetLogsCall;
import logtrace.storage.QueryRequest;
import logtrace.storage.SpanReader;

final class LogStoreSpanReader implements SpanReader {
  final GetLogsCall.Factory logs;
  final QueryCompiler compiler;
  final long lookback;
  final int namesLimit, traceLinesLimit;
  final boolean searchEnabled;

  LogStoreSpanReader(LogStoreStorage storage) {
    logs = storage.logs;
    compiler = QueryCompiler.create(storage.escapeLiterals);
    lookback = storage.lookback;
    namesLimit = storage.namesLimit;
    traceLinesLimit = storage.traceLinesLimit;
    searchEnabled = storage.searchEnabled;
  }

  @Override public Call<List<String>> getServiceNames() {
    if (!searchEnabled) return Call.emptyList();

    String statement = Statements.distinct(compiler, LogField.SERVICE_NAME, "", namesLimit);
    return names(statement, LogField.SERVICE_NAME);
  }

  @Override public Call<List<String>> getOperationNames(String serviceName) {
    if (serviceName == null || serviceName.isEmpty() || !searchEnabled) return Call.emptyList();

    String predicate =
      QueryCompiler.where(Collections.singletonList(compiler.buildServiceNameQuery(serviceName)));
    String statement =
      Statements.distinct(compiler, LogField.OPERATION_NAME, predicate, namesLimit);
    return names(statement, LogField.OPERATION_NAME);
  }

  Call<List<String>> names(String statement, LogField field) {
    long endMillis = System.currentTimeMillis();
    return newCall(statement, endMillis - lookback, endMillis, namesLimit)
      .map(ColumnProjector.of(field.column()))
      .map(SortDistinct.INSTANCE);
  }

  @Override public Call<List<String>> findTraceIds(QueryRequest request) {
    if (!searchEnabled) return Call.emptyList();

    // an open end never precedes startTimeMin, even when it lies in the future
    long endMillis = request.startTimeMax() != 0
      ? request.startTimeMax()
      : Math.max(System.currentTimeMillis(), request.startTimeMin());
    long beginMillis = request.startTimeMin() != 0
      ? request.startTimeMin()
      : endMillis - lookback;

    String predicate = compiler.buildFindTraceIdsQuery(request);
    String statement = Statements.findTraceIds(compiler, predicate, request.limit());
    return newCall(statement, beginMillis, endMillis, request.limit())
      .map(ColumnProjector.of(LogField.TRACE_ID.column()));
  }

  @Override public Call<List<Map<String, String>>> getTrace(String traceId) {
    if (traceId == null || traceId.isEmpty()) return Call.emptyList();

    String predicate =
      QueryCompiler.where(Collections.singletonList(compiler.buildTraceIdQuery(traceId)));
    long endMillis = System.currentTimeMillis();
    return newCall(Statements.selectAll(predicate, traceLinesLimit), endMillis - lookback,
      endMillis, traceLinesLimit);
  }

  /** The window is inclusive of {@code endMillis}, so the exclusive end second is one past it. */
  GetLogsCall newCall(String statement, long beginMillis, long endMillis, int lines) {
    long from = TimeUnit.MILLISECONDS.toSeconds(Math.max(beginMillis, 0L));
    long to = TimeUnit.MILLISECONDS.toSeconds(endMillis) + 1;
    return logs.newCall(statement, from, to, lines);
  }

  @Override public String toString() {
    return "LogStoreSpanReader{" + logs + "}";
  }
}
