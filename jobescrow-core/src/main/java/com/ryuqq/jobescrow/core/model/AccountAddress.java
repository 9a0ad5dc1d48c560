package com.ryuqq.jobescrow.core.model;

import java.util.regex.Pattern;

/**
 * 계정 주소 (호출자 식별자 또는 파생된 레코드 주소).
 *
 * <p>AccountAddress는 사용자 식별자(공개키 등)와 프로그램이 파생한 레코드 주소
 * (사용자 계정, 잡 포스트, 지원서, 에스크로)를 모두 표현합니다.
 * 레지스트리, 잡, 지원서 저장소의 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public final class AccountAddress implements Comparable<AccountAddress> {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");
    private static final int MAX_LENGTH = 64;

    private final String value;

    private AccountAddress(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("AccountAddress cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("AccountAddress length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("AccountAddress contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * AccountAddress 생성.
     *
     * @param value 주소 값
     * @return AccountAddress 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AccountAddress of(String value) {
        return new AccountAddress(value);
    }

    /**
     * 주소 값 조회.
     *
     * @return 주소 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(AccountAddress other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AccountAddress that = (AccountAddress) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "AccountAddress{" + value + '}';
    }
}
