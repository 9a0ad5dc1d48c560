package com.ryuqq.jobescrow.core.account;

import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.FieldLimit;
import com.ryuqq.jobescrow.core.statemachine.ApplicationState;
import com.ryuqq.jobescrow.core.statemachine.ApplicationTransition;

/**
 * 지원서.
 *
 * <p>(잡, 지원자) 쌍마다 하나만 존재하며 지원 시 생성되고, 승인/제출/검토 연산으로
 * 변경되며 삭제되지 않습니다. {@code jobPost}는 잡 포스트에 대한 비소유 참조입니다.</p>
 *
 * <p>상태 변경 메서드는 모두 {@link ApplicationTransition}으로 전이를 검증한 뒤
 * 새 인스턴스를 반환합니다.</p>
 *
 * @param address 레코드 주소 ("application", jobPost, applicant 로부터 파생)
 * @param applicant 지원자 신원
 * @param jobPost 잡 포스트 주소
 * @param resumeLink 이력서 링크 (최대 200자)
 * @param approved 승인 여부
 * @param completed 작업 제출 여부
 * @param submissionLink 제출 링크 (최대 200자)
 * @param narration 작업 설명 (최대 300자)
 * @param clientReview 의뢰인 리뷰 (최대 300자)
 * @param expectedEndDate 예상 종료 시각 (epoch 초, null 가능)
 * @param paid 에스크로 지급 여부
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public record Application(
    AccountAddress address,
    AccountAddress applicant,
    AccountAddress jobPost,
    String resumeLink,
    boolean approved,
    boolean completed,
    String submissionLink,
    String narration,
    String clientReview,
    Long expectedEndDate,
    boolean paid
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public Application {
        if (address == null || applicant == null || jobPost == null) {
            throw new IllegalArgumentException("address, applicant and jobPost are required for Application");
        }
        resumeLink = FieldLimit.RESUME_LINK.check(resumeLink);
        submissionLink = FieldLimit.SUBMISSION_LINK.check(submissionLink);
        narration = FieldLimit.NARRATION.check(narration);
        clientReview = FieldLimit.CLIENT_REVIEW.check(clientReview);
    }

    /**
     * 신규 지원서 생성 (approved = completed = paid = false, 텍스트 필드 비어 있음).
     *
     * @param address 레코드 주소
     * @param applicant 지원자
     * @param jobPost 잡 포스트 주소
     * @param resumeLink 이력서 링크
     * @param expectedEndDate 예상 종료 시각 (null 가능)
     * @return Application 인스턴스
     */
    public static Application submitted(
        AccountAddress address,
        AccountAddress applicant,
        AccountAddress jobPost,
        String resumeLink,
        Long expectedEndDate
    ) {
        return new Application(address, applicant, jobPost, resumeLink,
            false, false, "", "", "", expectedEndDate, false);
    }

    /**
     * 현재 생명주기 상태.
     *
     * @return 플래그로부터 도출된 상태
     */
    public ApplicationState state() {
        return ApplicationState.of(approved, completed, paid);
    }

    /**
     * 승인된 사본 생성.
     *
     * @return approved=true 인 새 인스턴스
     * @throws IllegalStateException PENDING 상태가 아닌 경우
     */
    public Application approve() {
        ApplicationTransition.validate(state(), ApplicationState.APPROVED);
        return new Application(address, applicant, jobPost, resumeLink,
            true, completed, submissionLink, narration, clientReview, expectedEndDate, paid);
    }

    /**
     * 작업 제출된 사본 생성 (재제출 시 기존 값 덮어씀).
     *
     * @param newSubmissionLink 제출 링크
     * @param newNarration 작업 설명
     * @return completed=true 인 새 인스턴스
     * @throws IllegalStateException APPROVED 또는 WORK_SUBMITTED 상태가 아닌 경우
     */
    public Application submitWork(String newSubmissionLink, String newNarration) {
        ApplicationTransition.validate(state(), ApplicationState.WORK_SUBMITTED);
        return new Application(address, applicant, jobPost, resumeLink,
            approved, true, newSubmissionLink, newNarration, clientReview, expectedEndDate, paid);
    }

    /**
     * 지급 완료된 사본 생성.
     *
     * @param review 의뢰인 리뷰
     * @return paid=true 인 새 인스턴스
     * @throws IllegalStateException WORK_SUBMITTED 상태가 아닌 경우
     */
    public Application settle(String review) {
        ApplicationTransition.validate(state(), ApplicationState.PAID);
        return new Application(address, applicant, jobPost, resumeLink,
            approved, completed, submissionLink, narration, review, expectedEndDate, true);
    }

    /**
     * 특정 잡에 대한 지원서인지 확인.
     *
     * @param jobPostAddress 잡 포스트 주소
     * @return 일치하면 true
     */
    public boolean belongsTo(AccountAddress jobPostAddress) {
        return jobPost.equals(jobPostAddress);
    }
}
