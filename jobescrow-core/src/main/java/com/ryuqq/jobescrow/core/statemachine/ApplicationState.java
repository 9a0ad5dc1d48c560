package com.ryuqq.jobescrow.core.statemachine;

/**
 * 지원서(및 승인된 잡)의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → APPROVED (지원서 승인, 잡 filled)</li>
 *   <li>APPROVED → WORK_SUBMITTED (작업 제출)</li>
 *   <li>WORK_SUBMITTED → WORK_SUBMITTED (재제출, 지급 전까지)</li>
 *   <li>WORK_SUBMITTED → PAID (제출 승인, 에스크로 지급)</li>
 *   <li><strong>건너뛰기 및 역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ▼ (approve_application)
 * APPROVED
 *    │
 *    ▼ (submit_work)
 * WORK_SUBMITTED ──┐
 *    │     ▲       │ (재제출)
 *    │     └───────┘
 *    ▼ (approve_submission)
 * PAID
 *
 * 금지된 전이:
 * - PENDING → WORK_SUBMITTED ❌
 * - APPROVED → PAID ❌
 * - PAID → * ❌
 * </pre>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public enum ApplicationState {

    /**
     * 지원됨 (아직 승인 안 됨).
     */
    PENDING,

    /**
     * 승인됨 (잡 filled).
     */
    APPROVED,

    /**
     * 작업 제출됨.
     */
    WORK_SUBMITTED,

    /**
     * 에스크로 지급 완료 (종료).
     */
    PAID;

    /**
     * 종료 상태인지 확인.
     *
     * @return PAID인 경우 true
     */
    public boolean isTerminal() {
        return this == PAID;
    }

    /**
     * 지원서 플래그로부터 상태 도출.
     *
     * @param approved 승인 여부
     * @param completed 작업 제출 여부
     * @param paid 지급 여부
     * @return 상태
     * @throws IllegalStateException 플래그 조합이 일관되지 않은 경우
     */
    public static ApplicationState of(boolean approved, boolean completed, boolean paid) {
        if (paid) {
            if (!approved || !completed) {
                throw new IllegalStateException("paid application must be approved and completed");
            }
            return PAID;
        }
        if (completed) {
            if (!approved) {
                throw new IllegalStateException("completed application must be approved");
            }
            return WORK_SUBMITTED;
        }
        return approved ? APPROVED : PENDING;
    }
}
