package com.ryuqq.jobescrow.core.model;

import com.ryuqq.jobescrow.core.error.MarketplaceErrorCode;
import com.ryuqq.jobescrow.core.error.MarketplaceException;

/**
 * 잡 일정 (시작/종료 시각, epoch 초).
 *
 * <p>시작과 종료는 함께 지정되어야 하며 {@code startDate ≤ endDate}를 만족해야 합니다.
 * 현재 시각과의 비교는 {@link #requireNotStartedBefore(long)}에서 수행합니다.</p>
 *
 * @param startDate 시작 시각 (epoch 초)
 * @param endDate 종료 시각 (epoch 초)
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public record JobSchedule(long startDate, long endDate) {

    /**
     * Compact Constructor.
     *
     * @throws MarketplaceException startDate가 endDate보다 늦은 경우 (INVALID_DATES)
     */
    public JobSchedule {
        if (startDate > endDate) {
            throw new MarketplaceException(MarketplaceErrorCode.INVALID_DATES,
                "startDate " + startDate + " is after endDate " + endDate);
        }
    }

    /**
     * 선택적 입력으로부터 일정 생성.
     *
     * <p>둘 다 null이면 null을 반환합니다. 한쪽만 지정된 경우는 거부합니다.</p>
     *
     * @param startDate 시작 시각 (null 가능)
     * @param endDate 종료 시각 (null 가능)
     * @return JobSchedule 또는 null
     * @throws MarketplaceException 한쪽만 지정되었거나 순서가 잘못된 경우 (INVALID_DATES)
     */
    public static JobSchedule ofNullable(Long startDate, Long endDate) {
        if (startDate == null && endDate == null) {
            return null;
        }
        if (startDate == null || endDate == null) {
            throw new MarketplaceException(MarketplaceErrorCode.INVALID_DATES,
                "startDate and endDate must be supplied together");
        }
        return new JobSchedule(startDate, endDate);
    }

    /**
     * 시작 시각이 기준 시각 이후인지 검증.
     *
     * @param now 기준 시각 (epoch 초)
     * @throws MarketplaceException startDate가 now보다 이전인 경우 (INVALID_DATES)
     */
    public void requireNotStartedBefore(long now) {
        if (startDate < now) {
            throw new MarketplaceException(MarketplaceErrorCode.INVALID_DATES,
                "startDate " + startDate + " is before current time " + now);
        }
    }
}
