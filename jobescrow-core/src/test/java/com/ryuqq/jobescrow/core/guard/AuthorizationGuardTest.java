package com.ryuqq.jobescrow.core.guard;

import com.ryuqq.jobescrow.core.account.Application;
import com.ryuqq.jobescrow.core.account.JobPost;
import com.ryuqq.jobescrow.core.account.UserAccount;
import com.ryuqq.jobescrow.core.error.MarketplaceErrorCode;
import com.ryuqq.jobescrow.core.error.MarketplaceException;
import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.UserRole;
import com.ryuqq.jobescrow.core.spi.UserAccountStore;
import com.ryuqq.jobescrow.core.statemachine.ApplicationState;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/**
 * AuthorizationGuard 유닛 테스트.
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AuthorizationGuardTest {

    private static final AccountAddress CLIENT = AccountAddress.of("client-a");
    private static final AccountAddress FREELANCER = AccountAddress.of("freelancer-b");
    private static final AccountAddress JOB = AccountAddress.of("job-1");

    @Mock
    private UserAccountStore userAccounts;

    private AuthorizationGuard guard;
    private JobPost openJob;
    private Application pending;

    @BeforeEach
    void setUp() {
        guard = new AuthorizationGuard(userAccounts);
        openJob = new JobPost(JOB, CLIENT, "Logo", "desc", 100, false, 255, null, 0L);
        pending = Application.submitted(AccountAddress.of("application-1"), FREELANCER, JOB, "https://resume", null);
    }

    // ============================================================
    // 1. 역할
    // ============================================================

    @Test
    void requireRole_등록된_역할이면_레코드를_반환함() {
        // given
        UserAccount account = new UserAccount(AccountAddress.of("record-1"), CLIENT, "Acme", UserRole.CLIENT);
        when(userAccounts.find(CLIENT)).thenReturn(account);

        // when & then
        assertThat(guard.requireRole(CLIENT, UserRole.CLIENT)).isEqualTo(account);
    }

    @Test
    void requireRole_역할이_다르면_UNAUTHORIZED() {
        // given
        when(userAccounts.find(CLIENT))
            .thenReturn(new UserAccount(AccountAddress.of("record-1"), CLIENT, "Acme", UserRole.CLIENT));

        // when & then
        assertErrorCode(() -> guard.requireRole(CLIENT, UserRole.FREELANCER), MarketplaceErrorCode.UNAUTHORIZED);
    }

    @Test
    void requireRole_미등록이면_UNAUTHORIZED() {
        // given
        when(userAccounts.find(CLIENT)).thenReturn(null);

        // when & then
        assertErrorCode(() -> guard.requireRole(CLIENT, UserRole.CLIENT), MarketplaceErrorCode.UNAUTHORIZED);
    }

    // ============================================================
    // 2. 소유권
    // ============================================================

    @Test
    void requireJobOwner_의뢰인이_아니면_UNAUTHORIZED() {
        guard.requireJobOwner(CLIENT, openJob);

        assertErrorCode(() -> guard.requireJobOwner(FREELANCER, openJob), MarketplaceErrorCode.UNAUTHORIZED);
    }

    @Test
    void requireApplicant_지원자가_아니면_UNAUTHORIZED() {
        guard.requireApplicant(FREELANCER, pending);

        assertErrorCode(() -> guard.requireApplicant(CLIENT, pending), MarketplaceErrorCode.UNAUTHORIZED);
    }

    @Test
    void requireBelongsTo_다른_잡이면_APPLICATION_JOB_MISMATCH() {
        JobPost other = new JobPost(AccountAddress.of("job-2"), CLIENT, "Other", "desc", 100, false, 255, null, 0L);

        assertErrorCode(() -> guard.requireBelongsTo(pending, other), MarketplaceErrorCode.APPLICATION_JOB_MISMATCH);
    }

    @Test
    void requireOpen_채워진_잡이면_JOB_ALREADY_FILLED() {
        guard.requireOpen(openJob);

        assertErrorCode(() -> guard.requireOpen(openJob.markFilled()), MarketplaceErrorCode.JOB_ALREADY_FILLED);
    }

    // ============================================================
    // 3. 상태 전이 → 이름 있는 오류
    // ============================================================

    @Test
    void requireTransition_허용된_전이는_통과함() {
        guard.requireTransition(pending, ApplicationState.APPROVED);
        guard.requireTransition(pending.approve(), ApplicationState.WORK_SUBMITTED);
    }

    @Test
    void requireTransition_승인되지_않은_지원서_제출은_APPLICATION_NOT_APPROVED() {
        assertErrorCode(() -> guard.requireTransition(pending, ApplicationState.WORK_SUBMITTED),
            MarketplaceErrorCode.APPLICATION_NOT_APPROVED);
    }

    @Test
    void requireTransition_제출되지_않은_지원서_지급은_WORK_NOT_COMPLETED() {
        assertErrorCode(() -> guard.requireTransition(pending, ApplicationState.PAID),
            MarketplaceErrorCode.WORK_NOT_COMPLETED);
        assertErrorCode(() -> guard.requireTransition(pending.approve(), ApplicationState.PAID),
            MarketplaceErrorCode.WORK_NOT_COMPLETED);
    }

    @Test
    void requireTransition_이미_승인된_지원서_재승인은_JOB_ALREADY_FILLED() {
        assertErrorCode(() -> guard.requireTransition(pending.approve(), ApplicationState.APPROVED),
            MarketplaceErrorCode.JOB_ALREADY_FILLED);
    }

    @Test
    void requireTransition_지급된_지원서는_항상_ALREADY_PAID() {
        Application paid = pending.approve().submitWork("https://work", "done").settle("great");

        assertErrorCode(() -> guard.requireTransition(paid, ApplicationState.PAID), MarketplaceErrorCode.ALREADY_PAID);
        assertErrorCode(() -> guard.requireTransition(paid, ApplicationState.WORK_SUBMITTED),
            MarketplaceErrorCode.ALREADY_PAID);
    }

    private static void assertErrorCode(ThrowingCallable call, MarketplaceErrorCode expected) {
        assertThatThrownBy(call)
            .isInstanceOfSatisfying(MarketplaceException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(expected));
    }
}
