package com.ryuqq.jobescrow.core.error;

/**
 * 마켓플레이스 오류 코드.
 *
 * <p>각 코드는 고유 식별자, 메시지 템플릿({@link String#format} 형식), 분류를 가집니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public enum MarketplaceErrorCode {

    // === Authorization ===
    UNAUTHORIZED("JOB-001", "You are not authorized to perform this action: %s", ErrorCategory.AUTHORIZATION),

    // === State ===
    JOB_ALREADY_FILLED("JOB-010", "This job has already been filled: %s", ErrorCategory.STATE),
    APPLICATION_NOT_APPROVED("JOB-011", "Application has not been approved yet: %s", ErrorCategory.STATE),
    WORK_NOT_COMPLETED("JOB-012", "Work has not been completed yet: %s", ErrorCategory.STATE),
    ALREADY_PAID("JOB-013", "Escrow for this application has already been released: %s", ErrorCategory.STATE),
    WORK_ALREADY_SUBMITTED("JOB-014", "Work has already been submitted: %s", ErrorCategory.STATE),

    // === Validation ===
    INVALID_DATES("JOB-020", "Invalid dates: %s", ErrorCategory.VALIDATION),
    FIELD_TOO_LONG("JOB-021", "Field %s exceeds %d characters (actual: %d)", ErrorCategory.VALIDATION),
    APPLICATION_JOB_MISMATCH("JOB-023", "Application %s does not belong to job %s", ErrorCategory.VALIDATION),

    // === Resource ===
    INSUFFICIENT_FUNDS("JOB-030", "Insufficient funds (balance: %s, required: %s)", ErrorCategory.RESOURCE),
    ESCROW_MISMATCH("JOB-031", "Escrow balance %s does not match job amount %s", ErrorCategory.RESOURCE),

    // === Uniqueness ===
    ALREADY_EXISTS("JOB-040", "Account already exists: %s", ErrorCategory.UNIQUENESS),

    // === Not found ===
    JOB_NOT_FOUND("JOB-051", "Job post not found: %s", ErrorCategory.NOT_FOUND),
    APPLICATION_NOT_FOUND("JOB-052", "Application not found: %s", ErrorCategory.NOT_FOUND);

    private final String code;
    private final String message;
    private final ErrorCategory category;

    MarketplaceErrorCode(String code, String message, ErrorCategory category) {
        this.code = code;
        this.message = message;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
