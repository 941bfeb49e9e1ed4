/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace;

import logtrace.internal.Nullable;

/** Result of {@link Component#check()}. */
// @Immutable
public final class CheckResult {
  public static final CheckResult OK = new CheckResult(true, null);

  public static CheckResult failed(Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    return new CheckResult(false, error);
  }

  public boolean ok() {
    return ok;
  }

  /** Present when not ok */
  @Nullable public Throwable error() {
    return error;
  }

  final boolean ok;
  final Throwable error;

  CheckResult(boolean ok, @Nullable Throwable error) {
    this.ok = ok;
    this.error = error;
  }

  @Override public String toString() {
    return "CheckResult{ok=" + ok + ", error=" + error + "}";
  }
}
