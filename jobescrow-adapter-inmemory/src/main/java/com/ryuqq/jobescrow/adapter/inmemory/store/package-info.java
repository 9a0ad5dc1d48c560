/**
 * In-memory record store adapter implementation package.
 *
 * <p>Reference implementations of the identity, job post and application store SPIs.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.jobescrow.adapter.inmemory.store.InMemoryUserAccountStore}:
 *       accounts keyed by owner identity</li>
 *   <li>{@link com.ryuqq.jobescrow.adapter.inmemory.store.InMemoryJobPostStore}:
 *       job posts with compare-and-set updates</li>
 *   <li>{@link com.ryuqq.jobescrow.adapter.inmemory.store.InMemoryApplicationStore}:
 *       applications with compare-and-set updates</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.jobescrow.core.spi.UserAccountStore
 * @see com.ryuqq.jobescrow.core.spi.JobPostStore
 * @see com.ryuqq.jobescrow.core.spi.ApplicationStore
 * @author JobEscrow Team
 * @since 1.0.0
 */
package com.ryuqq.jobescrow.adapter.inmemory.store;
