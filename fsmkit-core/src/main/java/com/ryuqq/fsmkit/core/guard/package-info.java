/**
 * Guard contract for transition evaluation.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsmkit.core.guard.Guard} - Capability deciding whether a matched transition may fire</li>
 *   <li>{@link com.ryuqq.fsmkit.core.guard.GuardContext} - Immutable evaluation snapshot</li>
 *   <li>{@link com.ryuqq.fsmkit.core.guard.GuardDecision} - Sealed result (Allow, Deny, Fail)</li>
 *   <li>{@link com.ryuqq.fsmkit.core.guard.Guards} - Common guard implementations</li>
 * </ul>
 *
 * <h2>Decision Mapping</h2>
 * <pre>
 * Allow        → allowed=true,  reason=ok
 * Deny(reason) → allowed=false, reason=guard_blocked,  ILLEGAL_TRANSITION
 * Fail(cause)  → allowed=false, reason=internal_error, ILLEGAL_TRANSITION (cause attached)
 * </pre>
 *
 * @since 1.0.0
 * @author FsmKit Team
 */
package com.ryuqq.fsmkit.core.guard;
