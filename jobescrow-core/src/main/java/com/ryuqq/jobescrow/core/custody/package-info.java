/**
 * 에스크로 보관 및 프로그램 권한 기반 지급.
 *
 * @since 1.0.0
 * @author JobEscrow Team
 */
package com.ryuqq.jobescrow.core.custody;
