/**
 * JobEscrow Application Layer - 마켓플레이스 연산 API.
 *
 * <h2>핵심 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobescrow.application.marketplace.Marketplace} - 여섯 가지 변경 연산과 조회</li>
 *   <li>{@link com.ryuqq.jobescrow.application.marketplace.MarketplaceService} - 검사 후 변경 구현체</li>
 *   <li>{@link com.ryuqq.jobescrow.application.marketplace.MarketplaceConfig} - programId, 재제출 정책</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 저장소/원장/락은 core SPI로 주입</li>
 *   <li><strong>원자성:</strong> 실패한 연산은 레코드와 잔액을 바꾸지 않음</li>
 *   <li><strong>잡 단위 직렬화:</strong> 같은 잡에 대한 변경은 잡 주소 락 안에서 수행</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
package com.ryuqq.jobescrow.application.marketplace;
