/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide storage, balances and locking for the marketplace core.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.jobescrow.core.spi.UserAccountStore} - identity registry records</li>
 *   <li>{@link com.ryuqq.jobescrow.core.spi.JobPostStore} - job posts with compare-and-set</li>
 *   <li>{@link com.ryuqq.jobescrow.core.spi.ApplicationStore} - applications with compare-and-set</li>
 *   <li>{@link com.ryuqq.jobescrow.core.spi.Ledger} - spendable and escrow balances</li>
 *   <li>{@link com.ryuqq.jobescrow.core.spi.LockManager} - per-address mutual exclusion</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., jobescrow-adapter-inmemory) provide concrete implementations.
 * Every implementation should pass the contract tests shipped in jobescrow-testkit.</p>
 *
 * @since 1.0.0
 * @author JobEscrow Team
 */
package com.ryuqq.jobescrow.core.spi;
