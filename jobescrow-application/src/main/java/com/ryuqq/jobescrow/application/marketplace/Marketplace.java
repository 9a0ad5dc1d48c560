package com.ryuqq.jobescrow.application.marketplace;

import com.ryuqq.jobescrow.core.account.Application;
import com.ryuqq.jobescrow.core.account.JobPost;
import com.ryuqq.jobescrow.core.account.UserAccount;
import com.ryuqq.jobescrow.core.address.ProgramAddresses;
import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.UserRole;

import java.util.List;

/**
 * 에스크로 기반 잡 마켓플레이스.
 *
 * <p>의뢰인이 대금을 예치하며 잡을 게시하고, 프리랜서가 지원하며, 잡마다 하나의 지원서만
 * 승인되고, 작업이 제출되면 의뢰인의 승인과 함께 에스크로 자금이 프리랜서에게 지급됩니다.</p>
 *
 * <p><strong>상태 흐름 (잡 + 승인된 지원서):</strong></p>
 * <pre>
 * Open ─approveApplication→ Filled ─submitWork→ WorkSubmitted ─approveSubmission→ Paid
 * </pre>
 *
 * <p><strong>오류 처리:</strong> 모든 변경 연산은 검사를 먼저 끝낸 뒤 상태를 변경합니다.
 * 검사 실패는 {@link com.ryuqq.jobescrow.core.error.MarketplaceException}으로 동기 전달되며,
 * 이 경우 레코드와 잔액은 변경되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * marketplace.registerUser(client, "Acme", UserRole.CLIENT);
 * JobPost job = marketplace.postJob(client, PostJobRequest.of("Logo", "Design a logo", 100));
 *
 * marketplace.registerUser(freelancer, "Kim", UserRole.FREELANCER);
 * Application application = marketplace.applyToJob(freelancer, job.address(), "https://cv/kim", null);
 *
 * marketplace.approveApplication(client, job.address(), application.address());
 * marketplace.submitWork(freelancer, application.address(), "https://work/logo", "done");
 * Payout payout = marketplace.approveSubmission(client, job.address(), application.address(), "great");
 * </pre>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public interface Marketplace {

    /**
     * 호출자 신원을 역할과 함께 등록.
     *
     * @param caller 호출자 신원
     * @param name 표시 이름 (최대 50자)
     * @param role 역할
     * @return 생성된 신원 레코드
     * @throws com.ryuqq.jobescrow.core.error.MarketplaceException ALREADY_EXISTS, FIELD_TOO_LONG
     */
    UserAccount registerUser(AccountAddress caller, String name, UserRole role);

    /**
     * 잡을 게시하고 금액을 에스크로에 예치.
     *
     * <p>금액은 부호 없는 64비트 값입니다 ({@link com.ryuqq.jobescrow.core.model.Amounts}).</p>
     *
     * @param caller 의뢰인 신원
     * @param request 잡 게시 요청
     * @return 생성된 잡 포스트
     * @throws com.ryuqq.jobescrow.core.error.MarketplaceException UNAUTHORIZED, INVALID_DATES,
     *         ALREADY_EXISTS, INSUFFICIENT_FUNDS, FIELD_TOO_LONG
     */
    JobPost postJob(AccountAddress caller, PostJobRequest request);

    /**
     * 잡에 지원.
     *
     * @param caller 프리랜서 신원
     * @param jobPost 잡 포스트 주소
     * @param resumeLink 이력서 링크 (최대 200자)
     * @param expectedEndDate 예상 종료 시각 (epoch 초, null 가능, 0 이상)
     * @return 생성된 지원서
     * @throws com.ryuqq.jobescrow.core.error.MarketplaceException UNAUTHORIZED, INVALID_DATES,
     *         ALREADY_EXISTS, JOB_NOT_FOUND, FIELD_TOO_LONG
     */
    Application applyToJob(AccountAddress caller, AccountAddress jobPost, String resumeLink, Long expectedEndDate);

    /**
     * 지원서 승인 (잡당 한 번).
     *
     * @param caller 의뢰인 신원
     * @param jobPost 잡 포스트 주소
     * @param application 지원서 주소
     * @return 승인된 지원서
     * @throws com.ryuqq.jobescrow.core.error.MarketplaceException UNAUTHORIZED, JOB_ALREADY_FILLED,
     *         JOB_NOT_FOUND, APPLICATION_NOT_FOUND, APPLICATION_JOB_MISMATCH
     */
    Application approveApplication(AccountAddress caller, AccountAddress jobPost, AccountAddress application);

    /**
     * 작업 제출.
     *
     * @param caller 프리랜서 신원
     * @param application 지원서 주소
     * @param submissionLink 제출 링크 (최대 200자)
     * @param narration 작업 설명 (최대 300자)
     * @return 제출된 지원서
     * @throws com.ryuqq.jobescrow.core.error.MarketplaceException UNAUTHORIZED, APPLICATION_NOT_APPROVED,
     *         ALREADY_PAID, WORK_ALREADY_SUBMITTED, APPLICATION_NOT_FOUND, FIELD_TOO_LONG
     */
    Application submitWork(AccountAddress caller, AccountAddress application, String submissionLink, String narration);

    /**
     * 제출 승인: 리뷰를 기록하고 에스크로 전액을 프리랜서에게 지급.
     *
     * @param caller 의뢰인 신원
     * @param jobPost 잡 포스트 주소
     * @param application 지원서 주소
     * @param clientReview 리뷰 (최대 300자)
     * @return 지급 결과
     * @throws com.ryuqq.jobescrow.core.error.MarketplaceException UNAUTHORIZED, WORK_NOT_COMPLETED,
     *         ALREADY_PAID, ESCROW_MISMATCH, JOB_NOT_FOUND, APPLICATION_NOT_FOUND,
     *         APPLICATION_JOB_MISMATCH, FIELD_TOO_LONG
     */
    Payout approveSubmission(AccountAddress caller, AccountAddress jobPost, AccountAddress application, String clientReview);

    /**
     * @param owner 신원
     * @return 신원 레코드, 없으면 null
     */
    UserAccount findUser(AccountAddress owner);

    /**
     * @param jobPost 잡 포스트 주소
     * @return 잡 포스트, 없으면 null
     */
    JobPost findJob(AccountAddress jobPost);

    /**
     * @param client 의뢰인 신원
     * @return 의뢰인이 게시한 잡 (없으면 빈 목록)
     */
    List<JobPost> findJobsByClient(AccountAddress client);

    /**
     * @param application 지원서 주소
     * @return 지원서, 없으면 null
     */
    Application findApplication(AccountAddress application);

    /**
     * @param jobPost 잡 포스트 주소
     * @return 잡에 대한 지원서 (없으면 빈 목록)
     */
    List<Application> findApplications(AccountAddress jobPost);

    /**
     * 잡의 에스크로 잔액.
     *
     * @param jobPost 잡 포스트 주소
     * @return 잔액 (지급 전 job.amount, 지급 후 0)
     * @throws com.ryuqq.jobescrow.core.error.MarketplaceException JOB_NOT_FOUND
     */
    long escrowBalance(AccountAddress jobPost);

    /**
     * 호출자가 참조 주소를 계산할 때 사용하는 파생 주소 계산기.
     *
     * @return ProgramAddresses
     */
    ProgramAddresses addresses();
}
