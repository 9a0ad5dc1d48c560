package com.ryuqq.jobescrow.core.model;

/**
 * 부호 없는 64비트 금액 연산.
 *
 * <p>잡 금액과 원장 잔액은 {@code long}에 부호 없는 값으로 저장됩니다.
 * {@code 2^63} 이상의 값은 음수 비트 패턴을 가지므로, 비교와 덧셈, 출력은
 * 반드시 이 클래스를 거쳐야 합니다.</p>
 *
 * <pre>
 * long max = Amounts.MAX;                          // 18446744073709551615
 * Amounts.isLessThan(balance, amount);             // Long.compareUnsigned 기반
 * Amounts.addExact(balance, amount);               // 2^64 이상이면 ArithmeticException
 * Amounts.format(amount);                          // 로그/메시지용 10진 문자열
 * </pre>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public final class Amounts {

    /**
     * 표현 가능한 최대 금액 (2^64 - 1).
     */
    public static final long MAX = -1L;

    // Utility class - prevent instantiation
    private Amounts() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 부호 없는 비교.
     *
     * @param left 왼쪽 금액
     * @param right 오른쪽 금액
     * @return left &lt; right 이면 true
     */
    public static boolean isLessThan(long left, long right) {
        return Long.compareUnsigned(left, right) < 0;
    }

    /**
     * 부호 없는 덧셈 (오버플로 거부).
     *
     * @param left 왼쪽 금액
     * @param right 오른쪽 금액
     * @return 합계
     * @throws ArithmeticException 합계가 {@link #MAX}를 넘는 경우
     */
    public static long addExact(long left, long right) {
        long sum = left + right;
        if (Long.compareUnsigned(sum, left) < 0) {
            throw new ArithmeticException("unsigned long overflow: " + format(left) + " + " + format(right));
        }
        return sum;
    }

    /**
     * 10진 문자열 변환.
     *
     * @param amount 금액
     * @return 부호 없는 10진 표현
     */
    public static String format(long amount) {
        return Long.toUnsignedString(amount);
    }

    /**
     * 10진 문자열 파싱.
     *
     * @param value 0 이상 {@link #MAX} 이하의 10진 문자열
     * @return 금액
     * @throws NumberFormatException 범위를 벗어나거나 숫자가 아닌 경우
     */
    public static long parse(String value) {
        return Long.parseUnsignedLong(value);
    }
}
