package com.ryuqq.jobescrow.core.account;

import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.FieldLimit;
import com.ryuqq.jobescrow.core.model.UserRole;

/**
 * 신원 레코드.
 *
 * <p>호출자 신원(owner)을 선언된 역할에 결합합니다. 신원당 하나만 존재하며,
 * 생성 이후 역할을 변경하는 연산은 없습니다.</p>
 *
 * @param address 레코드 주소 ("user", owner 로부터 파생)
 * @param owner 호출자 신원
 * @param name 표시 이름 (최대 50자)
 * @param role 역할
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public record UserAccount(
    AccountAddress address,
    AccountAddress owner,
    String name,
    UserRole role
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null인 경우
     */
    public UserAccount {
        if (address == null || owner == null || role == null) {
            throw new IllegalArgumentException("address, owner and role are required for UserAccount");
        }
        name = FieldLimit.NAME.check(name);
    }

    /**
     * 역할 일치 여부.
     *
     * @param expected 기대 역할
     * @return 일치하면 true
     */
    public boolean hasRole(UserRole expected) {
        return role == expected;
    }
}
