/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package logtrace.internal;

/**
 * Marks a parameter, field or return value that may be null. Named {@code Nullable} so that
 * static analysis tools recognize it without a dependency on a jsr305 jar.
 */
@java.lang.annotation.Documented
@java.lang.annotation.Retention(java.lang.annotation.RetentionPolicy.RUNTIME)
public @interface Nullable {
}
