package com.ryuqq.jobescrow.application.marketplace;

/**
 * 마켓플레이스 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>programId: 모든 파생 주소에 섞이는 네임스페이스 (기본 "jobescrow")</li>
 *   <li>resubmissionAllowed: 지급 전 작업 재제출 허용 여부 (기본 true, 재제출 시 기존 값을 덮어씀)</li>
 * </ul>
 *
 * <p>programId가 다르면 같은 (의뢰인, 제목)이라도 다른 잡 주소가 파생되므로,
 * 하나의 저장소를 공유하는 인스턴스들은 같은 programId를 사용해야 합니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 * @param programId 파생 주소 네임스페이스 (빈 문자열 불가)
 * @param resubmissionAllowed 재제출 허용 여부
 */
public record MarketplaceConfig(String programId, boolean resubmissionAllowed) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: programId="jobescrow", resubmissionAllowed=true</p>
     */
    public MarketplaceConfig() {
        this("jobescrow", true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public MarketplaceConfig {
        if (programId == null || programId.isBlank()) {
            throw new IllegalArgumentException("programId cannot be null or blank");
        }
    }

    /**
     * programId만 변경한 새 인스턴스 생성.
     *
     * @param programId 새로운 programId
     * @return 새 MarketplaceConfig 인스턴스
     */
    public MarketplaceConfig withProgramId(String programId) {
        return new MarketplaceConfig(programId, this.resubmissionAllowed);
    }

    /**
     * resubmissionAllowed만 변경한 새 인스턴스 생성.
     *
     * @param resubmissionAllowed 재제출 허용 여부
     * @return 새 MarketplaceConfig 인스턴스
     */
    public MarketplaceConfig withResubmissionAllowed(boolean resubmissionAllowed) {
        return new MarketplaceConfig(this.programId, resubmissionAllowed);
    }
}
