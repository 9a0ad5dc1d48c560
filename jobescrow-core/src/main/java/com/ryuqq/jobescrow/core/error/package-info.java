/**
 * 오류 코드와 예외.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobescrow.core.error.MarketplaceErrorCode} - 코드 (JOB-xxx) + 메시지 템플릿 + 분류</li>
 *   <li>{@link com.ryuqq.jobescrow.core.error.ErrorCategory} - 인가, 상태, 검증, 자원, 유일성, 부재</li>
 *   <li>{@link com.ryuqq.jobescrow.core.error.MarketplaceException} - 검사 실패 시 던지는 런타임 예외</li>
 * </ul>
 *
 * <p>MarketplaceException이 던져진 연산은 레코드와 잔액을 변경하지 않습니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
package com.ryuqq.jobescrow.core.error;
