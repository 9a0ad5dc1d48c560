/**
 * 시드 기반 파생 주소 계산.
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
package com.ryuqq.jobescrow.core.address;
