/**
 * Application lifecycle state machine.
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * PENDING → APPROVED (approve application, job filled)
 * APPROVED → WORK_SUBMITTED (submit work)
 * WORK_SUBMITTED → WORK_SUBMITTED (re-submission before payout)
 * WORK_SUBMITTED → PAID (approve submission, escrow released)
 *
 * Forbidden:
 * - PAID → * (terminal state)
 * - Skipped or backward transitions
 * </pre>
 *
 * @since 1.0.0
 * @author JobEscrow Team
 */
package com.ryuqq.jobescrow.core.statemachine;
