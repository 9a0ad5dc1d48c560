package com.ryuqq.jobescrow.core.outcome;

import com.ryuqq.jobescrow.core.model.AccountAddress;

/**
 * 성공 결과.
 *
 * @param account 생성되거나 변경된 레코드의 주소
 * @param message 결과 메시지 (선택, null 가능)
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public record Ok(
    AccountAddress account,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException account가 null인 경우
     */
    public Ok {
        if (account == null) {
            throw new IllegalArgumentException("account cannot be null");
        }
        // message는 null 허용
    }

    /**
     * 메시지 없이 Ok 생성.
     *
     * @param account 레코드 주소
     * @return Ok 인스턴스
     */
    public static Ok of(AccountAddress account) {
        return new Ok(account, null);
    }
}
