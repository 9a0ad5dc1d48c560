package com.ryuqq.jobescrow.application.marketplace;

import com.ryuqq.jobescrow.core.account.Application;
import com.ryuqq.jobescrow.core.account.EscrowAccount;
import com.ryuqq.jobescrow.core.account.JobPost;
import com.ryuqq.jobescrow.core.account.UserAccount;
import com.ryuqq.jobescrow.core.address.ProgramAddresses;
import com.ryuqq.jobescrow.core.custody.EscrowCustodian;
import com.ryuqq.jobescrow.core.custody.ReleaseAuthorization;
import com.ryuqq.jobescrow.core.error.MarketplaceErrorCode;
import com.ryuqq.jobescrow.core.error.MarketplaceException;
import com.ryuqq.jobescrow.core.guard.AuthorizationGuard;
import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.Amounts;
import com.ryuqq.jobescrow.core.model.FieldLimit;
import com.ryuqq.jobescrow.core.model.JobSchedule;
import com.ryuqq.jobescrow.core.model.UserRole;
import com.ryuqq.jobescrow.core.spi.ApplicationStore;
import com.ryuqq.jobescrow.core.spi.JobPostStore;
import com.ryuqq.jobescrow.core.spi.Ledger;
import com.ryuqq.jobescrow.core.spi.LockManager;
import com.ryuqq.jobescrow.core.spi.UserAccountStore;
import com.ryuqq.jobescrow.core.statemachine.ApplicationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * {@link Marketplace} 구현체.
 *
 * <p>모든 변경 연산은 "검사 후 변경(guard-then-mutate)" 순서를 따릅니다.
 * {@link AuthorizationGuard}와 필드 검증이 모두 통과한 뒤에만 저장소와 원장을 변경합니다.</p>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>postJob: (의뢰인, 잡 주소) 락 - 잔액 검사와 예치 사이 경합 방지</li>
 *   <li>approveApplication / submitWork / approveSubmission: 잡 주소 락</li>
 *   <li>applyToJob: 락 없음 (지원자별로 분리된 키에 insert-if-absent)</li>
 *   <li>filled 플래그와 paid 플래그는 락 안에서 저장소 compare-and-set으로 한 번 더 보호</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public final class MarketplaceService implements Marketplace {

    private static final Logger log = LoggerFactory.getLogger(MarketplaceService.class);

    private final UserAccountStore userAccounts;
    private final JobPostStore jobPosts;
    private final ApplicationStore applications;
    private final LockManager lockManager;
    private final MarketplaceConfig config;
    private final Clock clock;
    private final ProgramAddresses addresses;
    private final EscrowCustodian custodian;
    private final AuthorizationGuard guard;

    /**
     * 생성자 (시스템 UTC 시계).
     *
     * @param userAccounts 신원 레지스트리 저장소
     * @param jobPosts 잡 포스트 저장소
     * @param applications 지원서 저장소
     * @param ledger 잔액 원장
     * @param lockManager 락 관리자
     * @param config 설정
     */
    public MarketplaceService(UserAccountStore userAccounts, JobPostStore jobPosts, ApplicationStore applications,
                              Ledger ledger, LockManager lockManager, MarketplaceConfig config) {
        this(userAccounts, jobPosts, applications, ledger, lockManager, config, Clock.systemUTC());
    }

    /**
     * 생성자 (시계 주입).
     *
     * @param userAccounts 신원 레지스트리 저장소
     * @param jobPosts 잡 포스트 저장소
     * @param applications 지원서 저장소
     * @param ledger 잔액 원장
     * @param lockManager 락 관리자
     * @param config 설정
     * @param clock 현재 시각 기준
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public MarketplaceService(UserAccountStore userAccounts, JobPostStore jobPosts, ApplicationStore applications,
                              Ledger ledger, LockManager lockManager, MarketplaceConfig config, Clock clock) {
        if (userAccounts == null || jobPosts == null || applications == null) {
            throw new IllegalArgumentException("stores cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (lockManager == null) {
            throw new IllegalArgumentException("lockManager cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.userAccounts = userAccounts;
        this.jobPosts = jobPosts;
        this.applications = applications;
        this.lockManager = lockManager;
        this.config = config;
        this.clock = clock;
        this.addresses = new ProgramAddresses(config.programId());
        this.custodian = new EscrowCustodian(ledger, addresses);
        this.guard = new AuthorizationGuard(userAccounts);
    }

    @Override
    public UserAccount registerUser(AccountAddress caller, String name, UserRole role) {
        requireNonNull(caller, "caller");
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        String checkedName = FieldLimit.NAME.check(name);

        UserAccount account = new UserAccount(addresses.userAccount(caller), caller, checkedName, role);
        if (!userAccounts.insert(account)) {
            throw new MarketplaceException(MarketplaceErrorCode.ALREADY_EXISTS, account.address());
        }

        log.info("User registered: {} as {}", checkedName, role);
        return account;
    }

    @Override
    public JobPost postJob(AccountAddress caller, PostJobRequest request) {
        requireNonNull(caller, "caller");
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        // 1. 역할 및 입력 검증
        guard.requireRole(caller, UserRole.CLIENT);
        String title = FieldLimit.TITLE.check(request.title());
        String description = FieldLimit.DESCRIPTION.check(request.description());
        long amount = request.amount();
        long now = clock.instant().getEpochSecond();
        JobSchedule schedule = JobSchedule.ofNullable(request.startDate(), request.endDate());
        if (schedule != null) {
            schedule.requireNotStartedBefore(now);
        }

        AccountAddress jobAddress = addresses.jobPost(caller, title);

        // 2. 의뢰인 잔액과 잡 주소를 잠근 상태에서 중복/잔액 검사 후 예치
        return lockManager.executeWithLocks(List.of(caller, jobAddress), () -> {
            if (jobPosts.find(jobAddress) != null) {
                throw new MarketplaceException(MarketplaceErrorCode.ALREADY_EXISTS, jobAddress);
            }
            custodian.requireFunds(caller, amount);

            EscrowAccount escrow = custodian.reserve(jobAddress);
            JobPost job = new JobPost(jobAddress, caller, title, description, amount,
                false, escrow.nonce(), schedule, now);

            custodian.deposit(escrow, caller, amount);
            if (!jobPosts.insert(job)) {
                // 잡 주소 락을 보유한 채 부재를 확인했으므로 도달하면 저장소 계약 위반
                log.error("JobPostStore rejected insert of {} after absence check; escrow {} holds {}",
                    jobAddress, escrow.address(), Amounts.format(amount));
                throw new IllegalStateException("JobPostStore rejected insert of " + jobAddress);
            }

            log.info("Job post created with amount: {} ({}, escrow {})",
                Amounts.format(amount), jobAddress, escrow.address());
            return job;
        });
    }

    @Override
    public Application applyToJob(AccountAddress caller, AccountAddress jobPost, String resumeLink, Long expectedEndDate) {
        requireNonNull(caller, "caller");
        requireNonNull(jobPost, "jobPost");

        guard.requireRole(caller, UserRole.FREELANCER);
        String checkedResume = FieldLimit.RESUME_LINK.check(resumeLink);
        if (expectedEndDate != null && expectedEndDate < 0) {
            throw new MarketplaceException(MarketplaceErrorCode.INVALID_DATES,
                "expectedEndDate must not be negative: " + expectedEndDate);
        }
        requireJob(jobPost);

        Application application = Application.submitted(
            addresses.application(jobPost, caller), caller, jobPost, checkedResume, expectedEndDate);
        if (!applications.insert(application)) {
            throw new MarketplaceException(MarketplaceErrorCode.ALREADY_EXISTS, application.address());
        }

        log.info("Application submitted with resume: {} ({} → {})", checkedResume, caller, jobPost);
        return application;
    }

    @Override
    public Application approveApplication(AccountAddress caller, AccountAddress jobPost, AccountAddress application) {
        requireNonNull(caller, "caller");
        requireNonNull(jobPost, "jobPost");
        requireNonNull(application, "application");

        return lockManager.executeWithLock(jobPost, () -> {
            JobPost job = requireJob(jobPost);
            guard.requireJobOwner(caller, job);
            guard.requireRole(caller, UserRole.CLIENT);
            Application current = requireApplication(application);
            guard.requireBelongsTo(current, job);
            guard.requireOpen(job);
            guard.requireTransition(current, ApplicationState.APPROVED);

            JobPost filled = job.markFilled();
            Application approved = current.approve();

            // filled 플래그가 잡당 단일 승인을 보장하는 유일한 지점
            if (!jobPosts.compareAndSet(job, filled)) {
                throw new MarketplaceException(MarketplaceErrorCode.JOB_ALREADY_FILLED, jobPost);
            }
            if (!applications.compareAndSet(current, approved)) {
                jobPosts.compareAndSet(filled, job);
                throw new IllegalStateException("Application modified concurrently: " + application);
            }

            log.info("Application approved for job: {} ({})", job.title(), application);
            return approved;
        });
    }

    @Override
    public Application submitWork(AccountAddress caller, AccountAddress application, String submissionLink, String narration) {
        requireNonNull(caller, "caller");
        requireNonNull(application, "application");

        guard.requireRole(caller, UserRole.FREELANCER);
        AccountAddress jobPost = requireApplication(application).jobPost();

        return lockManager.executeWithLock(jobPost, () -> {
            Application current = requireApplication(application);
            guard.requireApplicant(caller, current);
            guard.requireTransition(current, ApplicationState.WORK_SUBMITTED);
            if (current.completed() && !config.resubmissionAllowed()) {
                throw new MarketplaceException(MarketplaceErrorCode.WORK_ALREADY_SUBMITTED, application);
            }
            String checkedLink = FieldLimit.SUBMISSION_LINK.check(submissionLink);
            String checkedNarration = FieldLimit.NARRATION.check(narration);

            Application submitted = current.submitWork(checkedLink, checkedNarration);
            if (!applications.compareAndSet(current, submitted)) {
                throw new IllegalStateException("Application modified concurrently: " + application);
            }

            log.info("Work submitted with link: {} and narration ({})", checkedLink, application);
            return submitted;
        });
    }

    @Override
    public Payout approveSubmission(AccountAddress caller, AccountAddress jobPost, AccountAddress application,
                                    String clientReview) {
        requireNonNull(caller, "caller");
        requireNonNull(jobPost, "jobPost");
        requireNonNull(application, "application");

        return lockManager.executeWithLock(jobPost, () -> {
            JobPost job = requireJob(jobPost);
            guard.requireJobOwner(caller, job);
            guard.requireRole(caller, UserRole.CLIENT);
            Application current = requireApplication(application);
            guard.requireBelongsTo(current, job);
            guard.requireTransition(current, ApplicationState.PAID);
            String checkedReview = FieldLimit.CLIENT_REVIEW.check(clientReview);
            custodian.requireFullyFunded(job);

            // paid 플래그를 먼저 기록해 지급을 1회로 제한
            Application settled = current.settle(checkedReview);
            if (!applications.compareAndSet(current, settled)) {
                throw new MarketplaceException(MarketplaceErrorCode.ALREADY_PAID, application);
            }

            // 이체 전 실패만 paid 플래그를 되돌림
            long released;
            try {
                ReleaseAuthorization authorization = custodian.authorizeRelease(job);
                released = custodian.release(authorization, job, current.applicant());
            } catch (RuntimeException e) {
                applications.compareAndSet(settled, current);
                throw e;
            }

            try {
                custodian.close(job);
            } catch (RuntimeException e) {
                log.error("Escrow for {} released {} to {} but could not be closed",
                    jobPost, Amounts.format(released), current.applicant(), e);
                throw e;
            }

            log.info("Submission approved, funds transferred, and review recorded ({} → {}: {})",
                jobPost, current.applicant(), Amounts.format(released));
            return new Payout(jobPost, custodian.escrowOf(job).address(), current.applicant(), released, settled);
        });
    }

    @Override
    public UserAccount findUser(AccountAddress owner) {
        requireNonNull(owner, "owner");
        return userAccounts.find(owner);
    }

    @Override
    public JobPost findJob(AccountAddress jobPost) {
        requireNonNull(jobPost, "jobPost");
        return jobPosts.find(jobPost);
    }

    @Override
    public List<JobPost> findJobsByClient(AccountAddress client) {
        requireNonNull(client, "client");
        return jobPosts.findByClient(client);
    }

    @Override
    public Application findApplication(AccountAddress application) {
        requireNonNull(application, "application");
        return applications.find(application);
    }

    @Override
    public List<Application> findApplications(AccountAddress jobPost) {
        requireNonNull(jobPost, "jobPost");
        return applications.findByJobPost(jobPost);
    }

    @Override
    public long escrowBalance(AccountAddress jobPost) {
        requireNonNull(jobPost, "jobPost");
        return custodian.balanceOf(requireJob(jobPost));
    }

    @Override
    public ProgramAddresses addresses() {
        return addresses;
    }

    private JobPost requireJob(AccountAddress jobPost) {
        JobPost job = jobPosts.find(jobPost);
        if (job == null) {
            throw new MarketplaceException(MarketplaceErrorCode.JOB_NOT_FOUND, jobPost);
        }
        return job;
    }

    private Application requireApplication(AccountAddress application) {
        Application found = applications.find(application);
        if (found == null) {
            throw new MarketplaceException(MarketplaceErrorCode.APPLICATION_NOT_FOUND, application);
        }
        return found;
    }

    private static void requireNonNull(AccountAddress address, String name) {
        if (address == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
