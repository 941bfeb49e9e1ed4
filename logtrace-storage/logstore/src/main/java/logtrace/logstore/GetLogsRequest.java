/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore;

/** A statement to run against one logstore over a window of time. */
// @Immutable
public final class GetLogsRequest {

  public static GetLogsRequest create(String logstore, String query, long from, long to,
    int lines) {
    if (logstore == null) throw new NullPointerException("logstore == null");
    if (query == null) throw new NullPointerException("query == null");
    if (from < 0) throw new IllegalArgumentException("from < 0");
    if (to <= from) throw new IllegalArgumentException("to <= from");
    if (lines <= 0) throw new IllegalArgumentException("lines <= 0");
    return new GetLogsRequest(logstore, query, from, to, lines);
  }

  /** Name of the logstore spans are written to. */
  public String logstore() {
    return logstore;
  }

  /** The statement, in the log store's query language. */
  public String query() {
    return query;
  }

  /** Start of the window in epoch seconds, inclusive. */
  public long from() {
    return from;
  }

  /** End of the window in epoch seconds, exclusive. */
  public long to() {
    return to;
  }

  /** Maximum rows to return. */
  public int lines() {
    return lines;
  }

  final String logstore, query;
  final long from, to;
  final int lines;

  GetLogsRequest(String logstore, String query, long from, long to, int lines) {
    this.logstore = logstore;
    this.query = query;
    this.from = from;
    this.to = to;
    this.lines = lines;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof GetLogsRequest)) return false;
    GetLogsRequest that = (GetLogsRequest) o;
    return logstore.equals(that.logstore)
      && query.equals(that.query)
      && from == that.from
      && to == that.to
      && lines == that.lines;
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= logstore.hashCode();
    h *= 1000003;
    h ^= query.hashCode();
    h *= 1000003;
    h ^= (int) ((from >>> 32) ^ from);
    h *= 1000003;
    h ^= (int) ((to >>> 32) ^ to);
    h *= 1000003;
    h ^= lines;
    return h;
  }

  @Override public String toString() {
    return "GetLogsRequest{logstore=" + logstore + ", query=" + query + ", from=" + from
      + ", to=" + to + ", lines=" + lines + "}";
  }
}
