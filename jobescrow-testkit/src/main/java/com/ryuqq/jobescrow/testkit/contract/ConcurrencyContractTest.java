package com.ryuqq.jobescrow.testkit.contract;

import com.ryuqq.jobescrow.application.marketplace.PostJobRequest;
import com.ryuqq.jobescrow.core.account.Application;
import com.ryuqq.jobescrow.core.account.JobPost;
import com.ryuqq.jobescrow.core.error.MarketplaceErrorCode;
import com.ryuqq.jobescrow.core.error.MarketplaceException;
import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.UserRole;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Test: 동시 요청 처리.
 *
 * <p>같은 잡에 대한 경쟁 요청이 직렬화되어, 순서와 무관하게 하나만 성공하는지 검증합니다.</p>
 * <ul>
 *   <li>같은 잡에 서로 다른 프리랜서 동시 지원 → 모두 저장, 승인 없음</li>
 *   <li>같은 잡의 서로 다른 지원서 동시 승인 → 정확히 하나만 승인</li>
 *   <li>같은 지원서 동시 지급 승인 → 정확히 한 번 지급</li>
 *   <li>잔액이 하나만 감당하는 동시 게시 → 하나만 게시, 잔액 음수 불가</li>
 *   <li>같은 신원 동시 등록 → 하나만 등록</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public abstract class ConcurrencyContractTest extends AbstractMarketplaceContractTest {

    private static final int THREADS = 8;

    @Test
    void 서로_다른_프리랜서의_동시_지원은_모두_저장되고_승인되지_않음() throws Exception {
        // given
        AccountAddress client = registerClient("client-a", 100);
        JobPost job = postJob(client, "Logo", 100);
        List<AccountAddress> freelancers = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            freelancers.add(registerFreelancer("freelancer-" + i));
        }

        // when
        Queue<MarketplaceErrorCode> failures = new ConcurrentLinkedQueue<>();
        AtomicInteger successes = runConcurrently(THREADS, index -> apply(freelancers.get(index), job), failures);

        // then
        assertThat(successes.get()).isEqualTo(THREADS);
        assertThat(failures).isEmpty();
        assertThat(marketplace.findApplications(job.address()))
            .hasSize(THREADS)
            .noneMatch(Application::approved)
            .extracting(Application::applicant)
            .containsExactlyInAnyOrderElementsOf(freelancers);
        assertThat(marketplace.findJob(job.address()).filled()).isFalse();
    }

    @Test
    void 같은_잡의_지원서_동시_승인_시_정확히_하나만_승인됨() throws Exception {
        // given
        AccountAddress client = registerClient("client-a", 100);
        JobPost job = postJob(client, "Logo", 100);
        List<Application> candidates = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            candidates.add(apply(registerFreelancer("freelancer-" + i), job));
        }

        // when
        Queue<MarketplaceErrorCode> failures = new ConcurrentLinkedQueue<>();
        AtomicInteger successes = runConcurrently(THREADS, index ->
            marketplace.approveApplication(client, job.address(), candidates.get(index).address()), failures);

        // then
        assertThat(successes.get()).isEqualTo(1);
        assertThat(failures).hasSize(THREADS - 1).containsOnly(MarketplaceErrorCode.JOB_ALREADY_FILLED);
        assertThat(marketplace.findApplications(job.address()))
            .filteredOn(Application::approved)
            .hasSize(1);
        assertThat(marketplace.findJob(job.address()).filled()).isTrue();
    }

    @Test
    void 같은_지원서_동시_지급_승인_시_정확히_한_번_지급됨() throws Exception {
        // given
        AccountAddress client = registerClient("client-a", 100);
        AccountAddress freelancer = registerFreelancer("freelancer-b");
        Application submitted = submittedApplication(client, freelancer, "Logo", 100);

        // when
        Queue<MarketplaceErrorCode> failures = new ConcurrentLinkedQueue<>();
        AtomicInteger successes = runConcurrently(THREADS, index ->
            marketplace.approveSubmission(client, submitted.jobPost(), submitted.address(), "review " + index),
            failures);

        // then
        assertThat(successes.get()).isEqualTo(1);
        assertThat(failures).hasSize(THREADS - 1).containsOnly(MarketplaceErrorCode.ALREADY_PAID);
        assertThat(ledger.balanceOf(freelancer)).isEqualTo(100);
        assertThat(marketplace.escrowBalance(submitted.jobPost())).isZero();
    }

    @Test
    void 잔액이_하나만_감당하는_동시_게시_시_하나만_게시됨() throws Exception {
        // given
        AccountAddress client = registerClient("client-a", 100);

        // when
        Queue<MarketplaceErrorCode> failures = new ConcurrentLinkedQueue<>();
        AtomicInteger successes = runConcurrently(THREADS, index ->
            marketplace.postJob(client, PostJobRequest.of("Job " + index, "parallel", 100)), failures);

        // then
        assertThat(successes.get()).isEqualTo(1);
        assertThat(failures).hasSize(THREADS - 1).containsOnly(MarketplaceErrorCode.INSUFFICIENT_FUNDS);
        assertThat(ledger.balanceOf(client)).isZero();
        assertThat(marketplace.findJobsByClient(client)).hasSize(1);
    }

    @Test
    void 같은_신원_동시_등록_시_하나만_등록됨() throws Exception {
        // given
        AccountAddress owner = address("user-1");

        // when
        Queue<MarketplaceErrorCode> failures = new ConcurrentLinkedQueue<>();
        AtomicInteger successes = runConcurrently(THREADS, index ->
            marketplace.registerUser(owner, "name " + index, index % 2 == 0 ? UserRole.CLIENT : UserRole.FREELANCER),
            failures);

        // then
        assertThat(successes.get()).isEqualTo(1);
        assertThat(failures).hasSize(THREADS - 1).containsOnly(MarketplaceErrorCode.ALREADY_EXISTS);
        assertThat(marketplace.findUser(owner)).isNotNull();
    }

    /**
     * 작업을 여러 스레드에서 동시에 시작.
     *
     * @param threads 스레드 수
     * @param task 스레드 인덱스를 받는 작업
     * @param failures 이름 있는 오류 수집
     * @return 성공 횟수
     */
    protected AtomicInteger runConcurrently(int threads, IndexedTask task, Queue<MarketplaceErrorCode> failures)
        throws InterruptedException {
        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        CountDownLatch ready = new CountDownLatch(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger successes = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            int index = i;
            executorService.submit(() -> {
                try {
                    ready.countDown();
                    start.await();
                    task.run(index);
                    successes.incrementAndGet();
                } catch (MarketplaceException e) {
                    failures.add(e.getErrorCode());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        ready.await(5, TimeUnit.SECONDS);
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executorService.shutdown();
        return successes;
    }

    /**
     * 스레드 인덱스를 받는 작업.
     */
    @FunctionalInterface
    protected interface IndexedTask {
        void run(int index);
    }
}
