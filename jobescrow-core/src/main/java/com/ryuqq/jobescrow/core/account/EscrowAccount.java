package com.ryuqq.jobescrow.core.account;

import com.ryuqq.jobescrow.core.model.AccountAddress;

/**
 * 에스크로 하위 레코드.
 *
 * <p>잡 포스트와 1:1로 연결된 자금 보관 계정입니다. 주소는 잡 포스트 주소와 nonce로부터
 * 결정적으로 파생되며, 사람이 보유한 키가 아닌 프로그램 로직만이 자금을 이동할 수 있습니다.
 * 잔액 자체는 {@link com.ryuqq.jobescrow.core.spi.Ledger}가 보관합니다.</p>
 *
 * @param address 에스크로 주소
 * @param jobPost 잡 포스트 주소
 * @param nonce 파생 nonce (0~255)
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public record EscrowAccount(
    AccountAddress address,
    AccountAddress jobPost,
    int nonce
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 nonce가 범위를 벗어난 경우
     */
    public EscrowAccount {
        if (address == null || jobPost == null) {
            throw new IllegalArgumentException("address and jobPost are required for EscrowAccount");
        }
        if (nonce < 0 || nonce > 255) {
            throw new IllegalArgumentException("nonce must be between 0 and 255: " + nonce);
        }
    }
}
