package com.ryuqq.jobescrow.application.marketplace;

import com.ryuqq.jobescrow.core.account.Application;
import com.ryuqq.jobescrow.core.model.AccountAddress;

/**
 * 제출 승인 결과.
 *
 * @param jobPost 잡 포스트 주소
 * @param escrow 종료된 에스크로 주소
 * @param freelancer 수령인
 * @param amount 지급 금액 (부호 없는 64비트)
 * @param application 지급 완료된 지원서
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public record Payout(
    AccountAddress jobPost,
    AccountAddress escrow,
    AccountAddress freelancer,
    long amount,
    Application application
) {
}
