package com.ryuqq.jobescrow.core.spi;

import com.ryuqq.jobescrow.core.model.AccountAddress;

import java.util.List;
import java.util.function.Supplier;

/**
 * Per-account mutual exclusion SPI.
 *
 * <p>Reproduces the serialized-execution guarantee of a single-writer host: any two
 * tasks holding a lock on the same address never interleave. The marketplace locks the
 * job post address around approval, submission and payout, and the client plus job post
 * addresses around job creation.</p>
 *
 * <p><strong>Lock Ordering:</strong></p>
 * <p>{@link #executeWithLocks(List, Supplier)} acquires keys in one global order shared
 * by every caller and releases them in reverse, so callers cannot deadlock each other
 * by passing keys in different orders.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Reentrant for the owning thread</li>
 *   <li>Locks are always released, including when the task throws</li>
 *   <li>No timeout: waiting callers block until the holder finishes</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public interface LockManager {

    /**
     * Runs the task while holding the lock for one address.
     *
     * @param key the address to lock
     * @param task the task
     * @param <T> the result type
     * @return the task result
     * @throws IllegalArgumentException if key or task is null
     */
    <T> T executeWithLock(AccountAddress key, Supplier<T> task);

    /**
     * Runs the task while holding the locks for several addresses, acquired in a global order.
     *
     * @param keys the addresses to lock (duplicates are ignored)
     * @param task the task
     * @param <T> the result type
     * @return the task result
     * @throws IllegalArgumentException if keys is null or empty, or task is null
     */
    <T> T executeWithLocks(List<AccountAddress> keys, Supplier<T> task);
}
