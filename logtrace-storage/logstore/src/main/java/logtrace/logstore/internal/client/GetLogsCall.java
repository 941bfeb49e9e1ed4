/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore.internal.client;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import logtrace.Call;
import logtrace.Callback;
import logtrace.logstore.GetLogsRequest;
import logtrace.logstore.LogStoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Defers {@link LogStoreClient#getLogs(GetLogsRequest)} until execution. */
public final class GetLogsCall extends Call.Base<List<Map<String, String>>> {
  static final Logger LOG = LoggerFactory.getLogger(GetLogsCall.class);

  public static final class Factory {
    final LogStoreClient client;
    final String logstore;

    public Factory(LogStoreClient client, String logstore) {
      if (client == null) throw new NullPointerException("client == null");
      if (logstore == null) throw new NullPointerException("logstore == null");
      this.client = client;
      this.logstore = logstore;
    }

    /**
     * @param from epoch seconds, inclusive
     * @param to epoch seconds, exclusive
     */
    public GetLogsCall newCall(String query, long from, long to, int lines) {
      GetLogsRequest request = GetLogsRequest.create(logstore, query, from, to, lines);
      if (LOG.isDebugEnabled()) LOG.debug("prepared {}", request);
      return new GetLogsCall(client, request);
    }

    @Override public String toString() {
      return "GetLogsCall.Factory{logstore=" + logstore + "}";
    }
  }

  final LogStoreClient client;
  final GetLogsRequest request;
  volatile CompletableFuture<List<Map<String, String>>> future;

  GetLogsCall(LogStoreClient client, GetLogsRequest request) {
    this.client = client;
    this.request = request;
  }

  public GetLogsRequest request() {
    return request;
  }

  @Override protected List<Map<String, String>> doExecute() throws IOException {
    return getUninterruptibly(future = client.getLogs(request).toCompletableFuture());
  }

  @Override protected void doEnqueue(Callback<List<Map<String, String>>> callback) {
    try {
      future = client.getLogs(request).toCompletableFuture();
      future.whenComplete((rows, error) -> {
        if (error != null) {
          callback.onError(unwrap(error));
          return;
        }
        try {
          callback.onSuccess(rows);
        } catch (RuntimeException e) {
          // the outcome was already delivered: onError would signal the callback twice
          LOG.warn("callback failed handling {}", request, e);
        }
      });
    } catch (Throwable t) {
      propagateIfFatal(t);
      callback.onError(t);
    }
  }

  @Override protected void doCancel() {
    CompletableFuture<List<Map<String, String>>> maybeFuture = future;
    if (maybeFuture != null) maybeFuture.cancel(true);
  }

  @Override protected boolean doIsCanceled() {
    CompletableFuture<List<Map<String, String>>> maybeFuture = future;
    return maybeFuture != null && maybeFuture.isCancelled();
  }

  @Override public GetLogsCall clone() {
    return new GetLogsCall(client, request);
  }

  @Override public String toString() {
    return "GetLogsCall{" + request + "}";
  }

  static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) return error.getCause();
    return error;
  }

  /** Rethrows the client's error as-is, wrapping only checked errors that aren't I/O. */
  static <T> T getUninterruptibly(CompletableFuture<T> future) throws IOException {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return future.get();
        } catch (InterruptedException e) {
          interrupted = true;
        } catch (ExecutionException e) {
          Throwable cause = unwrap(e.getCause());
          if (cause instanceof IOException) throw (IOException) cause;
          if (cause instanceof RuntimeException) throw (RuntimeException) cause;
          if (cause instanceof Error) throw (Error) cause;
          throw new IOException(cause);
        }
      }
    } finally {
      if (interrupted) Thread.currentThread().interrupt();
    }
  }
}
