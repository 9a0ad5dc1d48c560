/**
 * In-memory per-address lock manager.
 *
 * <p>Provides the per-job serialization the marketplace relies on within one JVM.</p>
 *
 * @see com.ryuqq.jobescrow.core.spi.LockManager
 * @author JobEscrow Team
 * @since 1.0.0
 */
package com.ryuqq.jobescrow.adapter.inmemory.lock;
