/**
 * Canonical transition records.
 *
 * <p>{@link com.ryuqq.fsmkit.core.log.TransitionLog} is produced by every evaluation,
 * allowed or not, and doubles as the payload stored for idempotent replay.</p>
 *
 * <h2>Canonical String</h2>
 * <pre>
 * from=PENDING|on=SUBMIT|to=SUBMITTED|at=2026-02-15T00:00:00Z|allowed=1|reason=ok|m=source=api
 * </pre>
 * <ul>
 *   <li>Fixed field order, no whitespace</li>
 *   <li>Timestamp: RFC3339, UTC, nanosecond precision with trailing zeros trimmed</li>
 *   <li>Meta pairs sorted by key ascending</li>
 * </ul>
 *
 * @since 1.0.0
 * @author FsmKit Team
 */
package com.ryuqq.fsmkit.core.log;
