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
import com.ryuqq.jobescrow.core.statemachine.ApplicationTransition;

/**
 * 권한 가드.
 *
 * <p>모든 변경 연산이 상태를 바꾸기 전에 호출하는 역할/소유권/상태 검사 모음입니다.
 * 검사는 읽기만 수행하며, 위반 시 이름 있는 {@link MarketplaceException}을 던집니다.</p>
 *
 * <p><strong>신원 기준:</strong> 역할 검사는 항상 {@link UserAccountStore}의 레코드를
 * 기준으로 하며, 등록되지 않은 호출자는 UNAUTHORIZED로 거부됩니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public final class AuthorizationGuard {

    private final UserAccountStore userAccounts;

    /**
     * 생성자.
     *
     * @param userAccounts 신원 레지스트리 저장소
     * @throws IllegalArgumentException userAccounts가 null인 경우
     */
    public AuthorizationGuard(UserAccountStore userAccounts) {
        if (userAccounts == null) {
            throw new IllegalArgumentException("userAccounts cannot be null");
        }
        this.userAccounts = userAccounts;
    }

    /**
     * 호출자가 지정 역할로 등록되어 있는지 검증.
     *
     * @param caller 호출자 신원
     * @param role 요구 역할
     * @return 호출자의 신원 레코드
     * @throws MarketplaceException 미등록이거나 역할이 다른 경우 (UNAUTHORIZED)
     */
    public UserAccount requireRole(AccountAddress caller, UserRole role) {
        if (caller == null || role == null) {
            throw new IllegalArgumentException("caller and role cannot be null");
        }
        UserAccount account = userAccounts.find(caller);
        if (account == null) {
            throw new MarketplaceException(MarketplaceErrorCode.UNAUTHORIZED, caller + " is not registered");
        }
        if (!account.hasRole(role)) {
            throw new MarketplaceException(MarketplaceErrorCode.UNAUTHORIZED,
                caller + " is registered as " + account.role() + ", " + role + " required");
        }
        return account;
    }

    /**
     * 호출자가 잡의 의뢰인인지 검증.
     *
     * @param caller 호출자 신원
     * @param job 잡 포스트
     * @throws MarketplaceException 의뢰인이 아닌 경우 (UNAUTHORIZED)
     */
    public void requireJobOwner(AccountAddress caller, JobPost job) {
        if (!job.isPostedBy(caller)) {
            throw new MarketplaceException(MarketplaceErrorCode.UNAUTHORIZED,
                caller + " is not the client of job " + job.address());
        }
    }

    /**
     * 호출자가 지원서의 지원자인지 검증.
     *
     * @param caller 호출자 신원
     * @param application 지원서
     * @throws MarketplaceException 지원자가 아닌 경우 (UNAUTHORIZED)
     */
    public void requireApplicant(AccountAddress caller, Application application) {
        if (!application.applicant().equals(caller)) {
            throw new MarketplaceException(MarketplaceErrorCode.UNAUTHORIZED,
                caller + " is not the applicant of " + application.address());
        }
    }

    /**
     * 지원서가 해당 잡을 참조하는지 검증.
     *
     * @param application 지원서
     * @param job 잡 포스트
     * @throws MarketplaceException 다른 잡의 지원서인 경우 (APPLICATION_JOB_MISMATCH)
     */
    public void requireBelongsTo(Application application, JobPost job) {
        if (!application.belongsTo(job.address())) {
            throw new MarketplaceException(MarketplaceErrorCode.APPLICATION_JOB_MISMATCH,
                application.address(), job.address());
        }
    }

    /**
     * 잡이 아직 채워지지 않았는지 검증.
     *
     * @param job 잡 포스트
     * @throws MarketplaceException 이미 채워진 경우 (JOB_ALREADY_FILLED)
     */
    public void requireOpen(JobPost job) {
        if (job.filled()) {
            throw new MarketplaceException(MarketplaceErrorCode.JOB_ALREADY_FILLED, job.address());
        }
    }

    /**
     * 지원서가 목표 상태로 전이 가능한지 검증.
     *
     * <p>허용되지 않은 전이를 이름 있는 오류로 변환합니다:</p>
     * <ul>
     *   <li>현재 PAID → ALREADY_PAID</li>
     *   <li>APPROVED 목표, 현재 PENDING 아님 → JOB_ALREADY_FILLED</li>
     *   <li>WORK_SUBMITTED 목표, 현재 PENDING → APPLICATION_NOT_APPROVED</li>
     *   <li>PAID 목표, 현재 PENDING/APPROVED → WORK_NOT_COMPLETED</li>
     * </ul>
     *
     * @param application 지원서
     * @param target 목표 상태
     * @throws MarketplaceException 전이가 허용되지 않는 경우
     */
    public void requireTransition(Application application, ApplicationState target) {
        ApplicationState current = application.state();
        if (ApplicationTransition.isAllowed(current, target)) {
            return;
        }
        if (current.isTerminal()) {
            throw new MarketplaceException(MarketplaceErrorCode.ALREADY_PAID, application.address());
        }
        switch (target) {
            case APPROVED:
                throw new MarketplaceException(MarketplaceErrorCode.JOB_ALREADY_FILLED, application.jobPost());
            case WORK_SUBMITTED:
                throw new MarketplaceException(MarketplaceErrorCode.APPLICATION_NOT_APPROVED, application.address());
            case PAID:
                throw new MarketplaceException(MarketplaceErrorCode.WORK_NOT_COMPLETED, application.address());
            default:
                throw new IllegalStateException(
                    String.format("Invalid state transition: %s → %s", current, target));
        }
    }
}
