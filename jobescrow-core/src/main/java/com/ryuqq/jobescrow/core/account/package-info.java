/**
 * 마켓플레이스 레코드 - 신원, 잡 포스트, 에스크로, 지원서.
 *
 * <p>모든 레코드는 불변 record이며, 상태 변경은 새 사본을 반환합니다
 * ({@link com.ryuqq.jobescrow.core.account.JobPost#markFilled()},
 * {@link com.ryuqq.jobescrow.core.account.Application#approve()} 등).
 * 저장소는 사본 전후 값으로 compare-and-set 합니다.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
package com.ryuqq.jobescrow.core.account;
