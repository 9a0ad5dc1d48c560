package com.ryuqq.jobescrow.core.outcome;

/**
 * 인스트럭션 실행 결과.
 *
 * <p>Outcome은 두 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공적으로 완료됨</li>
 *   <li>{@link Fail}: 사전조건 검사에서 거부됨 (재시도 불가)</li>
 * </ul>
 *
 * <p>모든 거부는 동기적이며 일시적 실패로 취급하지 않으므로 재시도 결과 타입은 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = processor.process(signer, instruction);
 * if (outcome instanceof Fail fail) {
 *     log.warn("rejected: {}", fail.errorCode());
 * }
 * </pre>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 거부인지 확인.
     *
     * @return 거부 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
