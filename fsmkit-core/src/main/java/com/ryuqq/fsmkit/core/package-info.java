/**
 * FsmKit Core SDK.
 *
 * <p>A deterministic finite-state-machine engine for auditable, retry-safe domain workflows
 * (order lifecycles, transfer intents).</p>
 *
 * <h2>Packages</h2>
 * <ul>
 *   <li>{@code model} - State and Event identifiers</li>
 *   <li>{@code guard} - Guard contract and decisions</li>
 *   <li>{@code machine} - Transition registry and evaluator</li>
 *   <li>{@code log} - Canonical transition records</li>
 *   <li>{@code idempotency} - Idempotent wrapper and key functions</li>
 *   <li>{@code spi} - Store contract implemented by adapters</li>
 *   <li>{@code exception} - Error taxonomy</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.fsmkit.core.Must} is the only API that turns configuration failures
 * into unchecked exceptions.</p>
 *
 * @since 1.0.0
 * @author FsmKit Team
 */
package com.ryuqq.fsmkit.core;
