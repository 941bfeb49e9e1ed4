/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore.internal;

/**
 * Log fields a span is written to. Namespaced fields contain a dot and must be double-quoted in the
 * query language. Top-level fields are written bare.
 */
public enum LogField {
  TRACE_ID("traceID", false),
  SERVICE_NAME("process.serviceName", true),
  OPERATION_NAME("operationName", false),
  DURATION("duration", false),
  START_TIME("startTime", false);

  /** Each span tag is written to its own field, named with this prefix and the tag key. */
  public static final String TAG_PREFIX = "tags.";

  final String column;
  final boolean quoted;

  LogField(String column, boolean quoted) {
    this.column = column;
    this.quoted = quoted;
  }

  /** The key of this field in a returned log record. */
  public String column() {
    return column;
  }

  /** True when the field is referenced as a double-quoted identifier. */
  public boolean quoted() {
    return quoted;
  }

  /** The column a tag is stored under. Tag columns are always quoted. */
  public static String tagColumn(String key) {
    return TAG_PREFIX + key;
  }
}
