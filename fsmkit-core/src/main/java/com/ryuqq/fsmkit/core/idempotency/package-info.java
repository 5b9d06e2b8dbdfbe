/**
 * Retry-safe application of transitions.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsmkit.core.idempotency.IdempotentMachine} - Machine wrapper with get → next → put flow</li>
 *   <li>{@link com.ryuqq.fsmkit.core.idempotency.IdempotencyKeyFunction} - Derives the idempotency key</li>
 *   <li>{@link com.ryuqq.fsmkit.core.idempotency.IdempotencyKeys} - Default key strategies</li>
 * </ul>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>A retry observed after the first write returns the stored log verbatim</li>
 *   <li>Replays never invoke guards or the underlying machine</li>
 *   <li>Denied attempts stay denied on retry</li>
 *   <li>At-most-once under concurrent identical retries requires a put-if-absent store</li>
 * </ul>
 *
 * @since 1.0.0
 * @author FsmKit Team
 */
package com.ryuqq.fsmkit.core.idempotency;
