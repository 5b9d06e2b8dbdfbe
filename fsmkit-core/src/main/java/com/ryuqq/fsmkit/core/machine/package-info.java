/**
 * Transition registry and evaluator.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsmkit.core.machine.Machine} - Registry keyed by (from, on) and pure evaluator</li>
 *   <li>{@link com.ryuqq.fsmkit.core.machine.Transition} - Immutable rule (from, on, to, name, guard)</li>
 *   <li>{@link com.ryuqq.fsmkit.core.machine.TransitionResult} - Evaluation result (next, log, error)</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Machine machine = Machine.create("transfer-intent");
 * machine.register(Transition.of("PENDING", "SUBMIT", "SUBMITTED"));
 *
 * TransitionResult ok = machine.next("tx-1", State.of("PENDING"), Event.of("SUBMIT"), at, meta, null);
 * // ok.next() == SUBMITTED, ok.log().reason() == OK
 *
 * TransitionResult missing = machine.next("tx-1", State.of("PENDING"), Event.of("APPROVE"), at, meta, null);
 * // missing.next() == EMPTY, missing.error().kind() == NO_TRANSITION
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Determinism:</strong> evaluation depends only on (state, event, at, meta, input)</li>
 *   <li><strong>Auditability:</strong> every evaluation yields a fully populated log</li>
 *   <li><strong>Stable ordering:</strong> snapshots are explicitly sorted by (from, on, to)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author FsmKit Team
 */
package com.ryuqq.fsmkit.core.machine;
