package com.ryuqq.jobescrow.core.outcome;

import com.ryuqq.jobescrow.core.error.ErrorCategory;
import com.ryuqq.jobescrow.core.error.MarketplaceException;

/**
 * 거부 결과 (재시도 불가).
 *
 * <p>권한, 상태, 검증, 자원, 중복 검사 중 하나가 실패하여 아무것도 변경되지 않았음을 나타냅니다.</p>
 *
 * @param errorCode 오류 코드 (예: JOB-001, JOB-010)
 * @param category 오류 분류
 * @param message 오류 메시지
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    ErrorCategory category,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우, category가 null인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * 예외로부터 Fail 생성.
     *
     * @param exception 마켓플레이스 예외
     * @return Fail 인스턴스
     * @throws IllegalArgumentException exception이 null인 경우
     */
    public static Fail from(MarketplaceException exception) {
        if (exception == null) {
            throw new IllegalArgumentException("exception cannot be null");
        }
        return new Fail(exception.getErrorCode().getCode(), exception.getCategory(), exception.getMessage());
    }
}
