package com.ryuqq.jobescrow.core.model;

/**
 * 사용자 역할.
 *
 * <p>등록 시 한 번 결정되며 이후 변경할 수 없습니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public enum UserRole {

    /**
     * 잡을 게시하고 대금을 에스크로에 예치하는 의뢰인.
     */
    CLIENT,

    /**
     * 잡에 지원하고 작업물을 제출하는 프리랜서.
     */
    FREELANCER
}
