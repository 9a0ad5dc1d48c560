package com.ryuqq.jobescrow.testkit.contract;

import com.ryuqq.jobescrow.application.instruction.InstructionProcessor;
import com.ryuqq.jobescrow.application.marketplace.Marketplace;
import com.ryuqq.jobescrow.application.marketplace.MarketplaceConfig;
import com.ryuqq.jobescrow.application.marketplace.MarketplaceService;
import com.ryuqq.jobescrow.application.marketplace.PostJobRequest;
import com.ryuqq.jobescrow.core.account.Application;
import com.ryuqq.jobescrow.core.account.JobPost;
import com.ryuqq.jobescrow.core.error.MarketplaceErrorCode;
import com.ryuqq.jobescrow.core.error.MarketplaceException;
import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.UserRole;
import com.ryuqq.jobescrow.core.spi.ApplicationStore;
import com.ryuqq.jobescrow.core.spi.JobPostStore;
import com.ryuqq.jobescrow.core.spi.Ledger;
import com.ryuqq.jobescrow.core.spi.LockManager;
import com.ryuqq.jobescrow.core.spi.UserAccountStore;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>어댑터 모듈이 제공한 SPI 구현체 위에 {@link MarketplaceService}를 구성하고,
 * 시나리오 작성에 필요한 픽스처/단언 헬퍼를 제공합니다.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>{@link #createSpi()}: 매 테스트마다 새 SPI 구현체 묶음</li>
 *   <li>고정 시계: {@link #NOW} (2026-01-01T00:00:00Z)</li>
 *   <li>기본 설정: {@link MarketplaceConfig#MarketplaceConfig()}</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryMarketplaceScenarioContractTest extends MarketplaceScenarioContractTest {
 *     {@literal @}Override
 *     protected MarketplaceSpi createSpi() {
 *         return InMemoryMarketplaceSpi.create();
 *     }
 * }
 * </pre>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public abstract class AbstractMarketplaceContractTest {

    /**
     * 고정 시계 기준 현재 시각 (epoch 초).
     */
    protected static final long NOW = 1_767_225_600L;

    protected UserAccountStore userAccounts;
    protected JobPostStore jobPosts;
    protected ApplicationStore applications;
    protected Ledger ledger;
    protected LockManager lockManager;
    protected Clock clock;
    protected Marketplace marketplace;
    protected InstructionProcessor processor;

    /**
     * 테스트 대상 SPI 구현체 묶음 생성.
     *
     * @return 새 인스턴스로 구성된 묶음
     */
    protected abstract MarketplaceSpi createSpi();

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    protected void setUpMarketplace() {
        MarketplaceSpi spi = createSpi();
        userAccounts = spi.userAccounts();
        jobPosts = spi.jobPosts();
        applications = spi.applications();
        ledger = spi.ledger();
        lockManager = spi.lockManager();
        clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        marketplace = newMarketplace(new MarketplaceConfig());
        processor = new InstructionProcessor(marketplace);
    }

    /**
     * 같은 SPI 구현체를 공유하는 마켓플레이스를 다른 설정으로 생성.
     *
     * @param config 설정
     * @return 새 마켓플레이스
     */
    protected Marketplace newMarketplace(MarketplaceConfig config) {
        return new MarketplaceService(userAccounts, jobPosts, applications, ledger, lockManager, config, clock);
    }

    protected static AccountAddress address(String value) {
        return AccountAddress.of(value);
    }

    /**
     * 의뢰인 등록 후 잔액 충전.
     *
     * @param id 신원 값
     * @param balance 초기 잔액
     * @return 의뢰인 신원
     */
    protected AccountAddress registerClient(String id, long balance) {
        AccountAddress client = address(id);
        ledger.credit(client, balance);
        marketplace.registerUser(client, "Client " + id, UserRole.CLIENT);
        return client;
    }

    protected AccountAddress registerFreelancer(String id) {
        AccountAddress freelancer = address(id);
        marketplace.registerUser(freelancer, "Freelancer " + id, UserRole.FREELANCER);
        return freelancer;
    }

    protected JobPost postJob(AccountAddress client, String title, long amount) {
        return marketplace.postJob(client, PostJobRequest.of(title, "Description of " + title, amount));
    }

    protected Application apply(AccountAddress freelancer, JobPost job) {
        return marketplace.applyToJob(freelancer, job.address(), "https://resume/" + freelancer.getValue(), null);
    }

    /**
     * 잡 게시 → 지원 → 승인까지 진행.
     *
     * @param client 의뢰인
     * @param freelancer 프리랜서
     * @param title 잡 제목
     * @param amount 예치 금액
     * @return 승인된 지원서
     */
    protected Application approvedApplication(AccountAddress client, AccountAddress freelancer, String title, long amount) {
        JobPost job = postJob(client, title, amount);
        Application application = apply(freelancer, job);
        return marketplace.approveApplication(client, job.address(), application.address());
    }

    /**
     * 잡 게시 → 지원 → 승인 → 작업 제출까지 진행.
     */
    protected Application submittedApplication(AccountAddress client, AccountAddress freelancer, String title, long amount) {
        Application approved = approvedApplication(client, freelancer, title, amount);
        return marketplace.submitWork(freelancer, approved.address(), "https://work/" + title, "done");
    }

    protected AccountAddress escrowOf(JobPost job) {
        return marketplace.addresses().escrow(job.address(), job.escrowNonce());
    }

    /**
     * 호출이 지정된 오류 코드로 실패하는지 검증.
     *
     * @param expected 기대 오류 코드
     * @param call 실행할 호출
     * @return 발생한 예외
     */
    protected static MarketplaceException assertFails(MarketplaceErrorCode expected, ThrowingCallable call) {
        MarketplaceException exception = catchThrowableOfType(call, MarketplaceException.class);
        assertThat(exception)
            .as("expected MarketplaceException with %s", expected)
            .isNotNull();
        assertThat(exception.getErrorCode()).isEqualTo(expected);
        return exception;
    }
}
