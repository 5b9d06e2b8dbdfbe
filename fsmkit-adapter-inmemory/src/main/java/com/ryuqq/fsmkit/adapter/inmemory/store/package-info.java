/**
 * In-memory TransitionLogStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the TransitionLogStore SPI
 * for tests, examples and single-process deployments.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.fsmkit.adapter.inmemory.store.InMemoryTransitionLogStore}:
 *       Thread-safe in-memory implementation of {@link com.ryuqq.fsmkit.core.spi.TransitionLogStore}</li>
 *   <li>{@link com.ryuqq.fsmkit.adapter.inmemory.store.InMemoryStoreConfig}:
 *       Write policy and capacity settings</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.fsmkit.core.spi.TransitionLogStore
 * @author FsmKit Team
 * @since 1.0.0
 */
package com.ryuqq.fsmkit.adapter.inmemory.store;
