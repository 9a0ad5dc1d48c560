package com.ryuqq.jobescrow.testkit.contract;

import com.ryuqq.jobescrow.core.spi.ApplicationStore;
import com.ryuqq.jobescrow.core.spi.JobPostStore;
import com.ryuqq.jobescrow.core.spi.Ledger;
import com.ryuqq.jobescrow.core.spi.LockManager;
import com.ryuqq.jobescrow.core.spi.UserAccountStore;

/**
 * Contract Test 대상 SPI 구현체 묶음.
 *
 * <p>어댑터 모듈은 매 테스트마다 새 인스턴스로 구성된 묶음을 반환해야 합니다.</p>
 *
 * @param userAccounts 신원 레지스트리 저장소
 * @param jobPosts 잡 포스트 저장소
 * @param applications 지원서 저장소
 * @param ledger 잔액 원장
 * @param lockManager 락 관리자
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public record MarketplaceSpi(
    UserAccountStore userAccounts,
    JobPostStore jobPosts,
    ApplicationStore applications,
    Ledger ledger,
    LockManager lockManager
) {

    public MarketplaceSpi {
        if (userAccounts == null || jobPosts == null || applications == null
            || ledger == null || lockManager == null) {
            throw new IllegalArgumentException("all SPI implementations are required");
        }
    }
}
