package com.ryuqq.jobescrow.adapter.inmemory.lock;

import com.ryuqq.jobescrow.core.model.AccountAddress;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryLockManager 유닛 테스트.
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
class InMemoryLockManagerTest {

    private static final AccountAddress CLIENT = AccountAddress.of("client-a");
    private static final AccountAddress JOB = AccountAddress.of("job-1");

    private final InMemoryLockManager lockManager = new InMemoryLockManager();

    @Test
    void 작업_실행_중에는_모든_키가_잠겨_있고_종료_후_해제됨() {
        // when
        boolean lockedInside = lockManager.executeWithLocks(List.of(JOB, CLIENT),
            () -> lockManager.isLocked(CLIENT) && lockManager.isLocked(JOB));

        // then
        assertThat(lockedInside).isTrue();
        assertThat(lockManager.isLocked(CLIENT)).isFalse();
        assertThat(lockManager.isLocked(JOB)).isFalse();
    }

    @Test
    void 한_번도_사용되지_않은_키는_잠겨_있지_않음() {
        assertThat(lockManager.isLocked(JOB)).isFalse();
    }

    @Test
    void null_키나_작업은_IllegalArgumentException() {
        assertThatThrownBy(() -> lockManager.executeWithLock(null, () -> 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> lockManager.executeWithLock(JOB, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(lockManager.isLocked(JOB)).isFalse();
    }

    @Test
    void 많은_키를_잠가도_스트라이프_수는_고정됨() {
        // when
        for (int i = 0; i < 10_000; i++) {
            lockManager.executeWithLock(AccountAddress.of("one-shot-" + i), () -> null);
        }

        // then
        assertThat(lockManager.stripeCount()).isEqualTo(InMemoryLockManager.DEFAULT_STRIPES);
    }

    @Test
    void 같은_스트라이프를_공유하는_키들도_함께_잠그고_모두_해제함() {
        // given
        InMemoryLockManager singleStripe = new InMemoryLockManager(1);

        // when
        String result = singleStripe.executeWithLocks(List.of(CLIENT, JOB), () -> "done");

        // then
        assertThat(result).isEqualTo("done");
        assertThat(singleStripe.stripeCount()).isEqualTo(1);
        assertThat(singleStripe.isLocked(CLIENT)).isFalse();
        assertThat(singleStripe.isLocked(JOB)).isFalse();
    }

    @Test
    void 작은_스트라이프_수에서도_역순_키_요청이_교착되지_않음() throws Exception {
        // given
        InMemoryLockManager fewStripes = new InMemoryLockManager(2);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        int[] counter = {0};

        try {
            // when
            Future<?> forward = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    fewStripes.executeWithLocks(List.of(CLIENT, JOB), () -> counter[0]++);
                }
                return null;
            });
            Future<?> backward = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    fewStripes.executeWithLocks(List.of(JOB, CLIENT), () -> counter[0]++);
                }
                return null;
            });
            start.countDown();
            forward.get(10, TimeUnit.SECONDS);
            backward.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        // then
        assertThat(counter[0]).isEqualTo(1_000);
        assertThat(fewStripes.isLocked(CLIENT)).isFalse();
        assertThat(fewStripes.isLocked(JOB)).isFalse();
    }

    @Test
    void 스트라이프_수가_양수가_아니면_IllegalArgumentException() {
        assertThatThrownBy(() -> new InMemoryLockManager(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
