/**
 * GitHub REST request dispatching: retries, rate-limit aware backoff, mutation pacing and
 * pagination.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.request;

import org.jspecify.annotations.NullMarked;
