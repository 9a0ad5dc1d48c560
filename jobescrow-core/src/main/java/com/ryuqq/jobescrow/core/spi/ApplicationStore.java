package com.ryuqq.jobescrow.core.spi;

import com.ryuqq.jobescrow.core.account.Application;
import com.ryuqq.jobescrow.core.model.AccountAddress;

import java.util.List;

/**
 * Application ledger storage SPI.
 *
 * <p>Stores one {@link Application} per (job, applicant) pair, keyed by the derived
 * application address. Concurrent inserts for distinct applicants write disjoint keys
 * and need no coordination.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: insert is insert-if-absent, compareAndSet is atomic</li>
 *   <li>Records are never deleted</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public interface ApplicationStore {

    /**
     * Inserts the application if its address is not taken.
     *
     * @param application the application
     * @return true if inserted, false if the applicant already applied to the job
     * @throws IllegalArgumentException if application is null
     */
    boolean insert(Application application);

    /**
     * Looks up an application.
     *
     * @param address the application address
     * @return the application, or null if none exists
     * @throws IllegalArgumentException if address is null
     */
    Application find(AccountAddress address);

    /**
     * Atomically replaces {@code expected} with {@code updated}.
     *
     * @param expected the record the caller read
     * @param updated the replacement, with the same address
     * @return true if replaced, false if the stored record no longer equals expected
     * @throws IllegalArgumentException if either argument is null or the addresses differ
     */
    boolean compareAndSet(Application expected, Application updated);

    /**
     * Lists the applications submitted to one job, in insertion order.
     *
     * @param jobPost the job post address
     * @return applications (may be empty)
     * @throws IllegalArgumentException if jobPost is null
     */
    List<Application> findByJobPost(AccountAddress jobPost);
}
