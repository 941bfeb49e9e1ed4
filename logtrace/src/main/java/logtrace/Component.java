/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace;

import java.io.Closeable;
import java.io.IOException;

/**
 * Components are object graphs used to compose a trace reader. For example, a storage component
 * returns a {@link logtrace.storage.SpanReader}.
 *
 * <p>Components are lazy with regards to I/O: building one never contacts the log store.
 */
public abstract class Component implements Closeable {

  /**
   * Answers the question: Are operations on this component likely to succeed?
   *
   * <p>Implementations should probe the remote store with the cheapest meaningful request and be
   * safe to call many times, even concurrently.
   *
   * @see CheckResult#OK
   */
  public CheckResult check() {
    return CheckResult.OK;
  }

  /** Closes any resources created implicitly by the component. Provided clients are left open. */
  @Override public void close() throws IOException {
  }
}
