/**
 * Retry with exponential backoff for outbound calls.
 *
 * <p>{@link com.vigil.resilience.BackoffPolicy} computes capped, optionally jittered delay
 * sequences; {@link com.vigil.resilience.RetryExecutor} wraps any fallible operation with a
 * {@link com.vigil.resilience.RetryPolicy}; {@link com.vigil.resilience.HttpRetryClassifier}
 * decides which HTTP outcomes are transient and what delay a response asks for.
 *
 * <p>Typical usage:
 *
 * <pre>{@code
 * RetryExecutor executor = new RetryExecutor();
 * String body = executor.execute("content-api", () -> client.generate(prompt), RetryPolicy.defaults());
 * }</pre>
 *
 * @see com.vigil.resilience.RetryingHttpClient
 */
package com.vigil.resilience;
