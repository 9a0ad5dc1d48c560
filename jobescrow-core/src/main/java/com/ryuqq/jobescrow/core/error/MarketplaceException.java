package com.ryuqq.jobescrow.core.error;

/**
 * 마켓플레이스 연산이 사전조건 검사에서 거부되었음을 나타내는 예외.
 *
 * <p>모든 검사는 상태 변경 이전에 수행되므로, 이 예외가 발생한 경우
 * 레코드와 에스크로 잔액은 변경되지 않은 상태로 남습니다.</p>
 *
 * <p>널 인자, 허용되지 않은 상태 전이 같은 프로그래밍 오류는 이 예외가 아니라
 * {@link IllegalArgumentException} / {@link IllegalStateException}으로 표현합니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public class MarketplaceException extends RuntimeException {

    private final MarketplaceErrorCode errorCode;

    /**
     * 메시지 템플릿 인자를 받는 생성자.
     *
     * @param errorCode 오류 코드
     * @param args 메시지 템플릿 인자
     */
    public MarketplaceException(MarketplaceErrorCode errorCode, Object... args) {
        super(String.format(errorCode.getMessage(), args));
        this.errorCode = errorCode;
    }

    public MarketplaceErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return errorCode.getCategory();
    }
}
