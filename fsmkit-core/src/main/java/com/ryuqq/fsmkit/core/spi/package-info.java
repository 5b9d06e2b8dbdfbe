/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide persistence for the idempotency layer.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsmkit.core.spi.TransitionLogStore} - Idempotency key → TransitionLog storage</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., fsmkit-adapter-inmemory) provide concrete implementations.
 * Adapters should extend the contract tests in fsmkit-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>No hidden locking:</strong> the engine never synchronizes around store calls</li>
 *   <li><strong>Idempotent writes:</strong> repeated put of the same (key, log) must be safe</li>
 * </ul>
 *
 * @since 1.0.0
 * @author FsmKit Team
 */
package com.ryuqq.fsmkit.core.spi;
