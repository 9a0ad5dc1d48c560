/**
 * 명령 기반 진입점.
 *
 * <p>서명자와 {@link com.ryuqq.jobescrow.application.instruction.Instruction}을 받아
 * {@link com.ryuqq.jobescrow.core.outcome.Outcome}으로 응답합니다. 이름 있는 오류는
 * {@link com.ryuqq.jobescrow.core.outcome.Fail}로 변환됩니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
package com.ryuqq.jobescrow.application.instruction;
