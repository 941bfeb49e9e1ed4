/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import logtrace.Call;
import logtrace.Callback;
import logtrace.logstore.internal.MissingFieldException;
import logtrace.storage.QueryRequest;
import logtrace.storage.SpanReader;

import static java.util.Arrays.asList;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LogStoreSpanReaderTest {
  static final long LOOKBACK = TimeUnit.MINUTES.toMillis(15);

  @Mock LogStoreClient client;
  @Mock Callback<List<String>> callback;
  @Captor ArgumentCaptor<GetLogsRequest> request;

  SpanReader spanReader(LogStoreStorage.Builder builder) {
    return builder.logstore("spans").lookback(LOOKBACK).build().spanReader();
  }

  SpanReader spanReader() {
    return spanReader(LogStoreStorage.newBuilder(client));
  }

  void respond(List<Map<String, String>> rows) {
    when(client.getLogs(request.capture())).thenReturn(CompletableFuture.completedFuture(rows));
  }

  @Test void findTraceIds() throws Exception {
    respond(asList(Map.of("traceID", "b", "ts", "2"), Map.of("traceID", "a", "ts", "1")));
    QueryRequest query = QueryRequest.newBuilder()
      .serviceName("s")
      .operationName("o")
      .durationMin(SECONDS.toNanos(1))
      .durationMax(SECONDS.toNanos(2))
      .putTag("http.status_code", "200")
      .startTimeMin(1_000_000L)
      .startTimeMax(2_000_000L)
      .limit(5)
      .build();

    assertThat(spanReader().findTraceIds(query).execute())
      .containsExactly("b", "a");

    assertThat(request.getValue().logstore()).isEqualTo("spans");
    assertThat(request.getValue().query())
      .isEqualTo("* | select traceID, max(startTime) as ts from log"
        + " where \"process.serviceName\" = 's' and operationName = 'o'"
        + " and 1000000000 <= duration and duration <= 2000000000"
        + " and \"tags.http.status_code\" = '200'"
        + " group by traceID order by ts desc limit 5");
    assertThat(request.getValue().from()).isEqualTo(1000L);
    assertThat(request.getValue().to()).isEqualTo(2001L);
    assertThat(request.getValue().lines()).isEqualTo(5);
  }

  @Test void findTraceIds_defaultsWindowToLookback() throws Exception {
    respond(asList());
    long before = System.currentTimeMillis();

    spanReader().findTraceIds(QueryRequest.newBuilder().build()).execute();

    long after = System.currentTimeMillis();
    GetLogsRequest sent = request.getValue();
    assertThat(sent.query())
      .isEqualTo("* | select traceID, max(startTime) as ts from log"
        + " group by traceID order by ts desc limit 20");
    assertThat(sent.to() - sent.from())
      .isBetween(TimeUnit.MILLISECONDS.toSeconds(LOOKBACK), TimeUnit.MILLISECONDS.toSeconds(LOOKBACK) + 1);
    assertThat(sent.to())
      .isBetween(TimeUnit.MILLISECONDS.toSeconds(before), TimeUnit.MILLISECONDS.toSeconds(after) + 1);
  }

  @Test void findTraceIds_startTimeMinDefaultsToLookbackBeforeMax() throws Exception {
    respond(asList());

    spanReader().findTraceIds(QueryRequest.newBuilder().startTimeMax(10_000_000L).build())
      .execute();

    assertThat(request.getValue().from())
      .isEqualTo(TimeUnit.MILLISECONDS.toSeconds(10_000_000L - LOOKBACK));
    assertThat(request.getValue().to())
      .isEqualTo(10_001L);
  }

  @Test void findTraceIds_startTimeMinOnly_endsNow() throws Exception {
    respond(asList());
    long before = System.currentTimeMillis();

    spanReader().findTraceIds(QueryRequest.newBuilder().startTimeMin(1_000_000L).build())
      .execute();

    long after = System.currentTimeMillis();
    assertThat(request.getValue().from()).isEqualTo(1000L);
    assertThat(request.getValue().to())
      .isBetween(TimeUnit.MILLISECONDS.toSeconds(before), TimeUnit.MILLISECONDS.toSeconds(after) + 1);
  }

  @Test void findTraceIds_startTimeMinOnly_inFuture() throws Exception {
    respond(asList());
    long startTimeMin = System.currentTimeMillis() + TimeUnit.HOURS.toMillis(1);

    spanReader().findTraceIds(QueryRequest.newBuilder().startTimeMin(startTimeMin).build())
      .execute();

    GetLogsRequest sent = request.getValue();
    assertThat(sent.from()).isEqualTo(TimeUnit.MILLISECONDS.toSeconds(startTimeMin));
    assertThat(sent.to()).isEqualTo(sent.from() + 1);
  }

  @Test void findTraceIds_startTimeMinEqualsMax() throws Exception {
    respond(asList());

    spanReader().findTraceIds(QueryRequest.newBuilder()
      .startTimeMin(5_000_500L)
      .startTimeMax(5_000_500L)
      .build()).execute();

    assertThat(request.getValue().from()).isEqualTo(5000L);
    assertThat(request.getValue().to()).isEqualTo(5001L);
  }

  @Test void findTraceIds_lookbackBeforeEpoch_clampsToZero() throws Exception {
    respond(asList());

    spanReader().findTraceIds(QueryRequest.newBuilder().startTimeMax(60_000L).build())
      .execute();

    assertThat(request.getValue().from()).isZero();
    assertThat(request.getValue().to()).isEqualTo(61L);
  }

  @Test void findTraceIds_deferredUntilExecuted() {
    spanReader().findTraceIds(QueryRequest.newBuilder().serviceName("frontend").build());

    verifyNoInteractions(client);
  }

  @Test void findTraceIds_missingTraceId() {
    respond(asList(Map.of("traceID", "a"), Map.of("ts", "1")));

    assertThatThrownBy(spanReader().findTraceIds(QueryRequest.newBuilder().build())::execute)
      .isInstanceOf(MissingFieldException.class)
      .hasMessage("log record 1 is missing field traceID");
  }

  @Test void findTraceIds_missingTraceId_enqueue() {
    respond(asList(Map.of("ts", "1")));

    spanReader().findTraceIds(QueryRequest.newBuilder().build()).enqueue(callback);

    verify(callback).onError(isA(MissingFieldException.class));
  }

  @Test void findTraceIds_clientErrorUnmodified() {
    IOException error = new IOException("read timed out");
    when(client.getLogs(any())).thenReturn(CompletableFuture.failedFuture(error));

    assertThatThrownBy(spanReader().findTraceIds(QueryRequest.newBuilder().build())::execute)
      .isSameAs(error);
  }

  @Test void findTraceIds_escapeLiterals() throws Exception {
    respond(asList());
    SpanReader spanReader = spanReader(LogStoreStorage.newBuilder(client).escapeLiterals(true));

    spanReader.findTraceIds(QueryRequest.newBuilder().serviceName("o'brien").build()).execute();

    assertThat(request.getValue().query())
      .contains("where \"process.serviceName\" = 'o''brien' group by");
  }

  @Test void getServiceNames() throws Exception {
    respond(asList(
      Map.of("process.serviceName", "frontend"),
      Map.of("process.serviceName", "backend"),
      Map.of("process.serviceName", "frontend")
    ));

    assertThat(spanReader().getServiceNames().execute())
      .containsExactly("backend", "frontend");

    assertThat(request.getValue().query())
      .isEqualTo("* | select distinct \"process.serviceName\" from log limit 10000");
    assertThat(request.getValue().to() - request.getValue().from())
      .isBetween(TimeUnit.MILLISECONDS.toSeconds(LOOKBACK), TimeUnit.MILLISECONDS.toSeconds(LOOKBACK) + 1);
  }

  @Test void getOperationNames() throws Exception {
    respond(asList(Map.of("operationName", "get"), Map.of("operationName", "post")));

    assertThat(spanReader().getOperationNames("frontend").execute())
      .containsExactly("get", "post");

    assertThat(request.getValue().query())
      .isEqualTo("* | select distinct operationName from log"
        + " where \"process.serviceName\" = 'frontend' limit 10000");
  }

  @Test void getOperationNames_namesLimit() throws Exception {
    respond(asList());

    spanReader(LogStoreStorage.newBuilder(client).namesLimit(50))
      .getOperationNames("frontend").execute();

    assertThat(request.getValue().query()).endsWith(" limit 50");
    assertThat(request.getValue().lines()).isEqualTo(50);
  }

  @Test void getOperationNames_emptyServiceName() {
    assertThat(spanReader().getOperationNames("")).hasToString("ConstantCall{value=[]}");
    assertThat(spanReader().getOperationNames(null)).hasToString("ConstantCall{value=[]}");

    verifyNoInteractions(client);
  }

  @Test void getTrace() throws Exception {
    List<Map<String, String>> rows = asList(
      Map.of("traceID", "463ac35c9f6413ad", "spanID", "1"),
      Map.of("traceID", "463ac35c9f6413ad", "spanID", "2")
    );
    respond(rows);

    assertThat(spanReader().getTrace("463ac35c9f6413ad").execute())
      .isEqualTo(rows);

    assertThat(request.getValue().query())
      .isEqualTo("* | select * from log where traceID = '463ac35c9f6413ad' limit 10000");
  }

  @Test void getTrace_emptyTraceId() {
    assertThat(spanReader().getTrace("")).hasToString("ConstantCall{value=[]}");

    verifyNoInteractions(client);
  }

  @Test void searchDisabled_doesntMakeRemoteQueryRequests() {
    SpanReader spanReader = spanReader(LogStoreStorage.newBuilder(client).searchEnabled(false));

    assertThat(spanReader.findTraceIds(QueryRequest.newBuilder().build()))
      .hasToString("ConstantCall{value=[]}");
    assertThat(spanReader.getServiceNames()).hasToString("ConstantCall{value=[]}");
    assertThat(spanReader.getOperationNames("frontend")).hasToString("ConstantCall{value=[]}");

    verifyNoInteractions(client);
  }

  @Test void searchDisabled_stillGetsTrace() throws Exception {
    respond(asList());
    SpanReader spanReader = spanReader(LogStoreStorage.newBuilder(client).searchEnabled(false));

    Call<List<Map<String, String>>> call = spanReader.getTrace("463ac35c9f6413ad");

    assertThat(call.execute()).isEmpty();
  }

  @Test void testToString() {
    assertThat(spanReader())
      .hasToString("LogStoreSpanReader{GetLogsCall.Factory{logstore=spans}}");
  }
}
