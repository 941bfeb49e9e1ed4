/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.logstore.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import logtrace.Call;

/** Sorts names lexicographically, dropping duplicates and empty strings. */
public enum SortDistinct implements Call.Mapper<List<String>, List<String>> {
  INSTANCE;

  @Override public List<String> map(List<String> input) {
    TreeSet<String> sorted = new TreeSet<>(input);
    sorted.remove("");
    return new ArrayList<>(sorted);
  }

  @Override public String toString() {
    return "SortDistinct";
  }
}
