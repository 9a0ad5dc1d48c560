package com.ryuqq.jobescrow.core.statemachine;

/**
 * 지원서 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → APPROVED</li>
 *   <li>APPROVED → WORK_SUBMITTED</li>
 *   <li>WORK_SUBMITTED → WORK_SUBMITTED</li>
 *   <li>WORK_SUBMITTED → PAID</li>
 * </ul>
 *
 * <p>사전조건 위반은 가드가 이름 있는 오류로 먼저 거부하므로, 여기서 발생하는
 * {@link IllegalStateException}은 불변식 위반(프로그래밍 오류)을 의미합니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public final class ApplicationTransition {

    // Utility class - prevent instantiation
    private ApplicationTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 확인 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(ApplicationState from, ApplicationState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        switch (from) {
            case PENDING:
                return to == ApplicationState.APPROVED;
            case APPROVED:
                return to == ApplicationState.WORK_SUBMITTED;
            case WORK_SUBMITTED:
                return to == ApplicationState.WORK_SUBMITTED || to == ApplicationState.PAID;
            default:
                return false;
        }
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(ApplicationState from, ApplicationState to) {
        if (from != null && from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }
}
