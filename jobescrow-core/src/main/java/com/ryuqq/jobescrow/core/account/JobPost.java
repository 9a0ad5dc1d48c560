package com.ryuqq.jobescrow.core.account;

import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.FieldLimit;
import com.ryuqq.jobescrow.core.model.JobSchedule;

/**
 * 잡 포스트.
 *
 * <p>잡 포스트와 그 에스크로 하위 레코드는 하나의 단위로 수명을 공유합니다.
 * 에스크로 주소는 잡 포스트 주소와 {@code escrowNonce}로부터 결정적으로 파생됩니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code amount}는 생성 시 에스크로에 예치된 금액과 같고 변경되지 않음</li>
 *   <li>{@code filled}는 false → true로 정확히 한 번만 전이</li>
 *   <li>일정이 있으면 {@code startDate ≥ createdAt}</li>
 * </ul>
 *
 * @param address 레코드 주소 ("job_post", client, title 로부터 파생)
 * @param client 의뢰인 신원
 * @param title 제목 (최대 100자)
 * @param description 설명 (최대 500자)
 * @param amount 예치 금액 (부호 없는 64비트, {@link com.ryuqq.jobescrow.core.model.Amounts} 참고)
 * @param filled 지원서 승인 여부
 * @param escrowNonce 에스크로 주소 파생 nonce (0~255)
 * @param schedule 일정 (null 가능)
 * @param createdAt 생성 시각 (epoch 초)
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public record JobPost(
    AccountAddress address,
    AccountAddress client,
    String title,
    String description,
    long amount,
    boolean filled,
    int escrowNonce,
    JobSchedule schedule,
    long createdAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 범위를 벗어난 경우
     */
    public JobPost {
        if (address == null || client == null) {
            throw new IllegalArgumentException("address and client are required for JobPost");
        }
        if (escrowNonce < 0 || escrowNonce > 255) {
            throw new IllegalArgumentException("escrowNonce must be between 0 and 255: " + escrowNonce);
        }
        title = FieldLimit.TITLE.check(title);
        description = FieldLimit.DESCRIPTION.check(description);
        // schedule은 null 허용
    }

    /**
     * 채워진 상태의 사본 생성.
     *
     * @return filled=true 인 새 인스턴스
     * @throws IllegalStateException 이미 채워진 경우
     */
    public JobPost markFilled() {
        if (filled) {
            throw new IllegalStateException("JobPost already filled: " + address);
        }
        return new JobPost(address, client, title, description, amount, true, escrowNonce, schedule, createdAt);
    }

    /**
     * 의뢰인 일치 여부.
     *
     * @param caller 호출자 신원
     * @return 의뢰인이면 true
     */
    public boolean isPostedBy(AccountAddress caller) {
        return client.equals(caller);
    }
}
