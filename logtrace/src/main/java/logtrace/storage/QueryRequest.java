/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import logtrace.internal.Nullable;

/**
 * Invoking this request retrieves IDs of traces matching the below filters.
 *
 * <p>Start times are epoch milliseconds. Durations are nanoseconds, the grain spans are stored
 * with. For every optional numeric bound, zero means the bound is absent.
 */
public final class QueryRequest {
  static final int DEFAULT_LIMIT = 20;

  /** When present, only include traces with a span from this local service. */
  @Nullable public String serviceName() {
    return serviceName;
  }

  /** When present, only include traces with a span of this operation name. */
  @Nullable public String operationName() {
    return operationName;
  }

  /**
   * Only include traces with a span tagged with every entry in this map. Values are matched
   * exactly. Multiple entries are combined with AND, and AND against other conditions.
   */
  public Map<String, String> tags() {
    return tags;
  }

  /**
   * Only include traces starting at or after this time in epoch milliseconds. Zero defers to the
   * reader's lookback.
   */
  public long startTimeMin() {
    return startTimeMin;
  }

  /** Only include traces starting at or before this time in epoch milliseconds. Zero is now. */
  public long startTimeMax() {
    return startTimeMax;
  }

  /** Only include spans lasting at least this many nanoseconds. Zero is unbounded. */
  public long durationMin() {
    return durationMin;
  }

  /** Only include spans lasting at most this many nanoseconds. Zero is unbounded. */
  public long durationMax() {
    return durationMax;
  }

  /** Maximum number of trace IDs to return. Defaults to 20 */
  public int limit() {
    return limit;
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String serviceName, operationName;
    Map<String, String> tags = new LinkedHashMap<>();
    long startTimeMin, startTimeMax, durationMin, durationMax;
    int limit = DEFAULT_LIMIT;

    Builder(QueryRequest source) {
      serviceName = source.serviceName;
      operationName = source.operationName;
      tags = new LinkedHashMap<>(source.tags);
      startTimeMin = source.startTimeMin;
      startTimeMax = source.startTimeMax;
      durationMin = source.durationMin;
      durationMax = source.durationMax;
      limit = source.limit;
    }

    /** @see QueryRequest#serviceName() */
    public Builder serviceName(@Nullable String serviceName) {
      this.serviceName = serviceName;
      return this;
    }

    /** @see QueryRequest#operationName() */
    public Builder operationName(@Nullable String operationName) {
      this.operationName = operationName;
      return this;
    }

    /** Replaces all tags. @see QueryRequest#tags() */
    public Builder tags(Map<String, String> tags) {
      if (tags == null) throw new NullPointerException("tags == null");
      this.tags = new LinkedHashMap<>();
      for (Map.Entry<String, String> entry : tags.entrySet()) {
        putTag(entry.getKey(), entry.getValue());
      }
      return this;
    }

    /** @see QueryRequest#tags() */
    public Builder putTag(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value of " + key + " == null");
      tags.put(key, value);
      return this;
    }

    /** @see QueryRequest#startTimeMin() */
    public Builder startTimeMin(long startTimeMin) {
      this.startTimeMin = startTimeMin;
      return this;
    }

    /** @see QueryRequest#startTimeMax() */
    public Builder startTimeMax(long startTimeMax) {
      this.startTimeMax = startTimeMax;
      return this;
    }

    /** @see QueryRequest#durationMin() */
    public Builder durationMin(long durationMin) {
      this.durationMin = durationMin;
      return this;
    }

    /** @see QueryRequest#durationMax() */
    public Builder durationMax(long durationMax) {
      this.durationMax = durationMax;
      return this;
    }

    /** @see QueryRequest#limit() */
    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public QueryRequest build() {
      // remove any accidental empty strings
      if ("".equals(serviceName)) serviceName = null;
      if ("".equals(operationName)) operationName = null;
      Map<String, String> tags = new LinkedHashMap<>(this.tags);
      tags.remove("");

      if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
      if (startTimeMin < 0) throw new IllegalArgumentException("startTimeMin < 0");
      if (startTimeMax < 0) throw new IllegalArgumentException("startTimeMax < 0");
      if (startTimeMin != 0 && startTimeMax != 0 && startTimeMax < startTimeMin) {
        throw new IllegalArgumentException("startTimeMax < startTimeMin");
      }
      if (durationMin < 0) throw new IllegalArgumentException("durationMin < 0");
      if (durationMax < 0) throw new IllegalArgumentException("durationMax < 0");
      if (durationMin != 0 && durationMax != 0 && durationMax < durationMin) {
        throw new IllegalArgumentException("durationMax < durationMin");
      }

      return new QueryRequest(serviceName, operationName, Collections.unmodifiableMap(tags),
        startTimeMin, startTimeMax, durationMin, durationMax, limit);
    }

    Builder() {
    }
  }

  final String serviceName, operationName;
  final Map<String, String> tags;
  final long startTimeMin, startTimeMax, durationMin, durationMax;
  final int limit;

  QueryRequest(
    @Nullable String serviceName,
    @Nullable String operationName,
    Map<String, String> tags,
    long startTimeMin,
    long startTimeMax,
    long durationMin,
    long durationMax,
    int limit) {
    this.serviceName = serviceName;
    this.operationName = operationName;
    this.tags = tags;
    this.startTimeMin = startTimeMin;
    this.startTimeMax = startTimeMax;
    this.durationMin = durationMin;
    this.durationMax = durationMax;
    this.limit = limit;
  }

  @Override public String toString() {
    return "QueryRequest{"
      + "serviceName=" + serviceName + ", "
      + "operationName=" + operationName + ", "
      + "tags=" + tags + ", "
      + "startTimeMin=" + startTimeMin + ", "
      + "startTimeMax=" + startTimeMax + ", "
      + "durationMin=" + durationMin + ", "
      + "durationMax=" + durationMax + ", "
      + "limit=" + limit
      + "}";
  }
}
