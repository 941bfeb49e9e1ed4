/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore.internal;

/**
 * Thrown when a log record returned by the store lacks a column the statement selected. This is a
 * data integrity problem: retrying the same statement will fail the same way.
 */
public final class MissingFieldException extends RuntimeException {
  static final long serialVersionUID = 0L;

  final String column;
  final int index;

  public MissingFieldException(String column, int index) {
    super("log record " + index + " is missing field " + column);
    this.column = column;
    this.index = index;
  }

  /** The column that was requested. */
  public String column() {
    return column;
  }

  /** Position of the first record lacking {@link #column()}. */
  public int index() {
    return index;
  }
}
