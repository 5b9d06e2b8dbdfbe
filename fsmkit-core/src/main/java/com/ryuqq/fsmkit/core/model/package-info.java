/**
 * Identifier value objects for states and events.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsmkit.core.model.State} - Machine state identifier</li>
 *   <li>{@link com.ryuqq.fsmkit.core.model.Event} - Transition trigger identifier</li>
 * </ul>
 *
 * <h2>Validation Rules</h2>
 * <pre>
 * normalize = trim surrounding Unicode White_Space
 *             (U+0009..U+000D, U+0085, and Zs/Zl/Zp such as U+0020, U+00A0, U+3000)
 * valid     = 1..64 chars after normalize, only [A-Za-z0-9_.:-]
 * </pre>
 *
 * <p>Identifiers are opaque: construction never validates, so that an invalid caller
 * input can still be recorded verbatim (after normalization) in a transition log.</p>
 *
 * @since 1.0.0
 * @author FsmKit Team
 */
package com.ryuqq.fsmkit.core.model;
