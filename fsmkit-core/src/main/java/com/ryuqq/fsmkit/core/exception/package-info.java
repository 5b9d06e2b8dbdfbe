/**
 * Error taxonomy for FsmKit.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.fsmkit.core.exception.ErrorKind} - Error kinds (enum)</li>
 *   <li>{@link com.ryuqq.fsmkit.core.exception.FsmException} - Checked exception carrying a kind</li>
 *   <li>{@link com.ryuqq.fsmkit.core.exception.TransitionLogStoreException} - Store failures (STORAGE)</li>
 * </ul>
 *
 * <h2>Propagation</h2>
 * <ul>
 *   <li><strong>Configuration errors:</strong> thrown from create/register, never wrapped in a log</li>
 *   <li><strong>Evaluation errors:</strong> returned inside a TransitionResult next to a fully populated log</li>
 *   <li><strong>Programming errors:</strong> null arguments raise IllegalArgumentException</li>
 * </ul>
 *
 * @since 1.0.0
 * @author FsmKit Team
 */
package com.ryuqq.fsmkit.core.exception;
