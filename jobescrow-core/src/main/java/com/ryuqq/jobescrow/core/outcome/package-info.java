/**
 * Instruction outcomes: {@link com.ryuqq.jobescrow.core.outcome.Ok} and
 * {@link com.ryuqq.jobescrow.core.outcome.Fail}.
 *
 * @since 1.0.0
 * @author JobEscrow Team
 */
package com.ryuqq.jobescrow.core.outcome;
