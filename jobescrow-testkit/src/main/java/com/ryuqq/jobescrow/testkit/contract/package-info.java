/**
 * JobEscrow Contract Test 키트.
 *
 * <p>SPI 구현체(저장소, 원장, 락 관리자)가 마켓플레이스의 보장을 지키는지 검증하는
 * 추상 테스트 모음입니다. 어댑터 모듈은 각 추상 클래스를 상속하고
 * {@link com.ryuqq.jobescrow.testkit.contract.AbstractMarketplaceContractTest#createSpi()}만 구현합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.jobescrow.testkit.contract.RecordStoreContractTest} - insert-if-absent, compare-and-set</li>
 *   <li>{@link com.ryuqq.jobescrow.testkit.contract.LedgerContractTest} - 원자적 이체, 오버플로</li>
 *   <li>{@link com.ryuqq.jobescrow.testkit.contract.LockManagerContractTest} - 상호 배제, 재진입, 교착 방지</li>
 *   <li>{@link com.ryuqq.jobescrow.testkit.contract.MarketplaceScenarioContractTest} - 종단 시나리오</li>
 *   <li>{@link com.ryuqq.jobescrow.testkit.contract.ConcurrencyContractTest} - 경쟁 요청 직렬화</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
package com.ryuqq.jobescrow.testkit.contract;
