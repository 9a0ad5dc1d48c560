package com.ryuqq.jobescrow.core.model;

import com.ryuqq.jobescrow.core.error.MarketplaceErrorCode;
import com.ryuqq.jobescrow.core.error.MarketplaceException;

/**
 * 저장 필드별 최대 길이.
 *
 * <p>레코드 저장 시점에 검사되며, 외부 호출자가 지켜야 하는 저장 계약의 일부입니다.</p>
 *
 * <ul>
 *   <li>NAME: 50자</li>
 *   <li>TITLE: 100자</li>
 *   <li>DESCRIPTION: 500자</li>
 *   <li>RESUME_LINK, SUBMISSION_LINK: 200자</li>
 *   <li>NARRATION, CLIENT_REVIEW: 300자</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public enum FieldLimit {

    NAME("name", 50),
    TITLE("title", 100),
    DESCRIPTION("description", 500),
    RESUME_LINK("resumeLink", 200),
    SUBMISSION_LINK("submissionLink", 200),
    NARRATION("narration", 300),
    CLIENT_REVIEW("clientReview", 300);

    private final String fieldName;
    private final int maxLength;

    FieldLimit(String fieldName, int maxLength) {
        this.fieldName = fieldName;
        this.maxLength = maxLength;
    }

    public String fieldName() {
        return fieldName;
    }

    public int maxLength() {
        return maxLength;
    }

    /**
     * 값의 길이 검증.
     *
     * <p>null은 빈 문자열로 취급합니다.</p>
     *
     * @param value 검증할 값
     * @return 검증된 값 (null이면 빈 문자열)
     * @throws MarketplaceException 최대 길이를 초과한 경우 (FIELD_TOO_LONG)
     */
    public String check(String value) {
        String checked = value == null ? "" : value;
        if (checked.length() > maxLength) {
            throw new MarketplaceException(
                MarketplaceErrorCode.FIELD_TOO_LONG, fieldName, maxLength, checked.length());
        }
        return checked;
    }
}
