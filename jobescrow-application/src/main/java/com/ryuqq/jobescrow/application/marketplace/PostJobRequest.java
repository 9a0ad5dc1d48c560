package com.ryuqq.jobescrow.application.marketplace;

/**
 * 잡 게시 요청.
 *
 * @param title 제목 (최대 100자, (의뢰인, 제목)마다 하나)
 * @param description 설명 (최대 500자)
 * @param amount 예치 금액 (부호 없는 64비트)
 * @param startDate 시작 시각 (epoch 초, null 가능)
 * @param endDate 종료 시각 (epoch 초, null 가능)
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public record PostJobRequest(
    String title,
    String description,
    long amount,
    Long startDate,
    Long endDate
) {

    /**
     * 일정 없는 요청 생성.
     *
     * @param title 제목
     * @param description 설명
     * @param amount 예치 금액
     * @return PostJobRequest 인스턴스
     */
    public static PostJobRequest of(String title, String description, long amount) {
        return new PostJobRequest(title, description, amount, null, null);
    }
}
