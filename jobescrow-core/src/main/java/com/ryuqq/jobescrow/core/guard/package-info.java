/**
 * 호출자 소유권, 역할, 상태 선행조건 검사.
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
package com.ryuqq.jobescrow.core.guard;
