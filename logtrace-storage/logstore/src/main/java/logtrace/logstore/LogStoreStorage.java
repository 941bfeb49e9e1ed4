/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore;

import java.util.concurrent.TimeUnit;
import logtrace.Call;
import logtrace.CheckResult;
import logtrace.Component;
import logtrace.logstore.internal.Statements;
import logtrace.logstore.internal.client.GetLogsCall;
import logtrace.storage.SpanReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads spans from a log store where each span was written as one log record.
 *
 * <p>The {@link LogStoreClient} is supplied by the caller and is not closed by this component.
 */
public final class LogStoreStorage extends Component {
  static final Logger LOG = LoggerFactory.getLogger(LogStoreStorage.class);

  public static Builder newBuilder(LogStoreClient client) {
    return new Builder(client);
  }

  public static final class Builder {
    final LogStoreClient client;
    String logstore;
    long lookback = TimeUnit.DAYS.toMillis(1);
    int namesLimit = 10000, traceLinesLimit = 10000;
    boolean searchEnabled = true, escapeLiterals;

    Builder(LogStoreClient client) {
      if (client == null) throw new NullPointerException("client == null");
      this.client = client;
    }

    /** Name of the logstore spans are written to. Required. */
    public Builder logstore(String logstore) {
      if (logstore == null) throw new NullPointerException("logstore == null");
      this.logstore = logstore;
      return this;
    }

    /**
     * How far back in milliseconds to look when a query has no start time, and when listing
     * service names, operation names or a trace's records. Defaults to one day.
     */
    public Builder lookback(long lookback) {
      this.lookback = lookback;
      return this;
    }

    /** Maximum service or operation names to return. Defaults to 10000. */
    public Builder namesLimit(int namesLimit) {
      this.namesLimit = namesLimit;
      return this;
    }

    /** Maximum log records to read for one trace. Defaults to 10000. */
    public Builder traceLinesLimit(int traceLinesLimit) {
      this.traceLinesLimit = traceLinesLimit;
      return this;
    }

    /**
     * False disables searching: listing names and finding trace IDs return empty without contacting
     * the store. Looking up a trace by ID still works. Defaults to true.
     */
    public Builder searchEnabled(boolean searchEnabled) {
      this.searchEnabled = searchEnabled;
      return this;
    }

    /**
     * True doubles quotes inside values and quoted field names, so that a value such as
     * {@code O'Brien} doesn't break the statement. Defaults to false, which embeds values verbatim.
     */
    public Builder escapeLiterals(boolean escapeLiterals) {
      this.escapeLiterals = escapeLiterals;
      return this;
    }

    public LogStoreStorage build() {
      if (logstore == null || logstore.isEmpty()) {
        throw new IllegalArgumentException("logstore must be set");
      }
      if (lookback <= 0) throw new IllegalArgumentException("lookback <= 0");
      if (namesLimit <= 0) throw new IllegalArgumentException("namesLimit <= 0");
      if (traceLinesLimit <= 0) throw new IllegalArgumentException("traceLinesLimit <= 0");
      return new LogStoreStorage(this);
    }
  }

  final LogStoreClient client;
  final String logstore;
  final long lookback;
  final int namesLimit, traceLinesLimit;
  final boolean searchEnabled, escapeLiterals;
  final GetLogsCall.Factory logs;
  final LogStoreSpanReader spanReader;

  LogStoreStorage(Builder builder) {
    client = builder.client;
    logstore = builder.logstore;
    lookback = builder.lookback;
    namesLimit = builder.namesLimit;
    traceLinesLimit = builder.traceLinesLimit;
    searchEnabled = builder.searchEnabled;
    escapeLiterals = builder.escapeLiterals;
    logs = new GetLogsCall.Factory(client, logstore);
    spanReader = new LogStoreSpanReader(this);
  }

  public SpanReader spanReader() {
    return spanReader;
  }

  public long lookback() {
    return lookback;
  }

  /** Counts records written in the last minute, which fails if the logstore is unreachable. */
  @Override public CheckResult check() {
    long to = TimeUnit.MILLISECONDS.toSeconds(System.currentTimeMillis()) + 1;
    try {
      logs.newCall(Statements.count(), to - 60, to, 1).execute();
    } catch (Throwable e) {
      Call.propagateIfFatal(e);
      LOG.warn("check of logstore {} failed: {}", logstore, e.getMessage());
      return CheckResult.failed(e);
    }
    return CheckResult.OK;
  }

  @Override public String toString() {
    return "LogStoreStorage{logstore=" + logstore + ", lookback=" + lookback
      + ", searchEnabled=" + searchEnabled + ", escapeLiterals=" + escapeLiterals + "}";
  }
}
