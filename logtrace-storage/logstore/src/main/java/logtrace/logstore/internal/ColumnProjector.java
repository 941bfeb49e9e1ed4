/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import logtrace.Call;

/**
 * Projects one column out of log records: the value at index i of the result comes from record i.
 * Records are never skipped, so a record without the column fails the whole projection with
 * {@link MissingFieldException}.
 */
public final class ColumnProjector implements Call.Mapper<List<Map<String, String>>, List<String>> {

  public static ColumnProjector of(String column) {
    if (column == null) throw new NullPointerException("column == null");
    return new ColumnProjector(column);
  }

  /** Returns the {@code column} of each record in order, or throws if any record lacks it. */
  public static List<String> project(List<Map<String, String>> records, String column) {
    if (records.isEmpty()) return Collections.emptyList();
    List<String> result = new ArrayList<>(records.size());
    for (int i = 0, length = records.size(); i < length; i++) {
      String value = records.get(i).get(column);
      if (value == null) throw new MissingFieldException(column, i);
      result.add(value);
    }
    return result;
  }

  final String column;

  ColumnProjector(String column) {
    this.column = column;
  }

  @Override public List<String> map(List<Map<String, String>> records) {
    return project(records, column);
  }

  @Override public String toString() {
    return "ColumnProjector{" + column + "}";
  }
}
