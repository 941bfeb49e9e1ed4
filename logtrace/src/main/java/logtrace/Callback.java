/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace;

import logtrace.internal.Nullable;

/**
 * Receives the outcome of {@link Call#enqueue(Callback)}. Exactly one of the two methods is
 * invoked.
 */
public interface Callback<V> {

  /** Invoked with the value of a successful call, which may be null for {@code Void}. */
  void onSuccess(@Nullable V value);

  /** Invoked with the error of a failed call, unmodified from where it was raised. */
  void onError(Throwable t);
}
