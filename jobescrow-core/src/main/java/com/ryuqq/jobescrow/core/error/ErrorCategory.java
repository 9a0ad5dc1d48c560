package com.ryuqq.jobescrow.core.error;

/**
 * 오류 분류.
 *
 * <p>모든 오류는 동기적으로 호출자에게 전달되며, 어떤 분류도 일시적 오류로 취급하지 않습니다
 * (내부 재시도 없음).</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    /**
     * 역할 불일치 또는 호출자 신원 불일치.
     */
    AUTHORIZATION,

    /**
     * 상태 위반 (이미 채워진 잡, 미승인 지원서, 미완료 작업, 지급 완료).
     */
    STATE,

    /**
     * 입력 검증 실패 (날짜, 길이 제한, 금액, 참조 불일치).
     */
    VALIDATION,

    /**
     * 자원 부족 또는 에스크로 잔액 불일치.
     */
    RESOURCE,

    /**
     * 중복 등록, 중복 잡, 중복 지원.
     */
    UNIQUENESS,

    /**
     * 참조한 레코드가 존재하지 않음.
     */
    NOT_FOUND
}
