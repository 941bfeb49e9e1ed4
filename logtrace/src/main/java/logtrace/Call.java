/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * A deferred request against a log store, usable once, either {@link #execute() synchronously}
 * or {@link #enqueue(Callback) asynchronously}. {@linkplain #cancel()} can be called from any
 * thread.
 *
 * <p>Translating input into a statement happens when the call is created, so that input errors
 * surface before any I/O. Only the remote request runs on {@linkplain #execute()}.
 *
 * <pre>{@code
 * // the predicate is compiled here
 * Call<List<String>> traceIds = spanReader.findTraceIds(request);
 * // the log store is queried here
 * List<String> ids = traceIds.execute();
 * }</pre>
 *
 * <p>Use {@linkplain #clone()} to replay a call.
 *
 * @param <V> the success type, typically not null except when {@code V} is {@linkplain Void}.
 */
public abstract class Call<V> implements Cloneable {
  /** Returns a completed call, for when the input implies there is nothing to ask the store. */
  public static <V> Call<V> create(V v) {
    return new Constant<>(v);
  }

  public static <T> Call<List<T>> emptyList() {
    return Call.create(Collections.emptyList());
  }

  public interface Mapper<V1, V2> {
    V2 map(V1 input);
  }

  /**
   * Transforms the value of this call, for example projecting log rows into a column.
   *
   * <p>Discard "this" in favor of the result.
   */
  public final <R> Call<R> map(Mapper<V, R> mapper) {
    return new Mapping<>(mapper, this);
  }

  // Taken from RxJava throwIfFatal, which was taken from scala
  public static void propagateIfFatal(Throwable t) {
    if (t instanceof VirtualMachineError) {
      throw (VirtualMachineError) t;
    } else if (t instanceof LinkageError) {
      throw (LinkageError) t;
    }
  }

  /**
   * Invokes the request, returning its value or propagating its error. A second invocation fails
   * with {@link IllegalStateException}.
   */
  public abstract V execute() throws IOException;

  /** Invokes the request asynchronously, signaling {@code callback} once complete. */
  public abstract void enqueue(Callback<V> callback);

  /** Requests cancelation. Blocking implementations may not honor it. */
  public abstract void cancel();

  /** Returns true if {@linkplain #cancel()} was called. */
  public abstract boolean isCanceled();

  /** Returns a copy of this object, so you can make an identical follow-up request. */
  @Override public abstract Call<V> clone();

  static class Constant<V> extends Base<V> { // not final for mock testing
    final V v;

    Constant(V v) {
      this.v = v;
    }

    @Override protected V doExecute() {
      return v;
    }

    @Override protected void doEnqueue(Callback<V> callback) {
      callback.onSuccess(v);
    }

    @Override public Call<V> clone() {
      return new Constant<>(v);
    }

    @Override public String toString() {
      return "ConstantCall{value=" + v + "}";
    }
  }

  static final class Mapping<R, V> extends Base<R> {
    final Mapper<V, R> mapper;
    final Call<V> delegate;

    Mapping(Mapper<V, R> mapper, Call<V> delegate) {
      this.mapper = mapper;
      this.delegate = delegate;
    }

    @Override protected R doExecute() throws IOException {
      return mapper.map(delegate.execute());
    }

    @Override protected void doEnqueue(Callback<R> callback) {
      delegate.enqueue(new Callback<V>() {
        @Override public void onSuccess(V value) {
          R mapped;
          try {
            mapped = mapper.map(value);
          } catch (Throwable t) {
            propagateIfFatal(t);
            callback.onError(t);
            return;
          }
          callback.onSuccess(mapped);
        }

        @Override public void onError(Throwable t) {
          callback.onError(t);
        }
      });
    }

    @Override protected void doCancel() {
      delegate.cancel();
    }

    @Override public String toString() {
      return "Mapping{call=" + delegate + ", mapper=" + mapper + "}";
    }

    @Override public Call<R> clone() {
      return new Mapping<>(mapper, delegate.clone());
    }
  }

  /** Guards single execution and cancelation so subtypes only implement the I/O. */
  public static abstract class Base<V> extends Call<V> {
    volatile boolean canceled;
    boolean executed;

    protected Base() {
    }

    @Override public final V execute() throws IOException {
      markExecuted();
      if (isCanceled()) throw new IOException("Canceled");
      return doExecute();
    }

    protected abstract V doExecute() throws IOException;

    @Override public final void enqueue(Callback<V> callback) {
      markExecuted();
      if (isCanceled()) {
        callback.onError(new IOException("Canceled"));
      } else {
        doEnqueue(callback);
      }
    }

    protected abstract void doEnqueue(Callback<V> callback);

    synchronized void markExecuted() {
      if (executed) throw new IllegalStateException("Already Executed");
      executed = true;
    }

    @Override public final void cancel() {
      canceled = true;
      doCancel();
    }

    protected void doCancel() {
    }

    @Override public final boolean isCanceled() {
      return canceled || doIsCanceled();
    }

    protected boolean doIsCanceled() {
      return false;
    }
  }
}
