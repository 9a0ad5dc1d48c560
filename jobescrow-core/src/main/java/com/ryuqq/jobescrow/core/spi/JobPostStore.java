package com.ryuqq.jobescrow.core.spi;

import com.ryuqq.jobescrow.core.account.JobPost;
import com.ryuqq.jobescrow.core.model.AccountAddress;

import java.util.List;

/**
 * Job ledger storage SPI.
 *
 * <p>Stores {@link JobPost} records keyed by their derived address.</p>
 *
 * <p><strong>Compare-And-Set:</strong></p>
 * <p>{@link #compareAndSet(JobPost, JobPost)} replaces the stored record only if it
 * still equals {@code expected}. The marketplace serializes mutations per job with
 * {@link LockManager}; the CAS is the second line of defence for the
 * read-filled / set-filled sequence of application approval.</p>
 *
 * <pre>
 * UPDATE job_post SET filled = true, version = version + 1
 * WHERE address = ? AND version = ?;
 * </pre>
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
public interface JobPostStore {

    /**
     * Inserts the job post if its address is not taken.
     *
     * @param jobPost the job post
     * @return true if inserted, false if a job post already exists at that address
     * @throws IllegalArgumentException if jobPost is null
     */
    boolean insert(JobPost jobPost);

    /**
     * Looks up a job post.
     *
     * @param address the job post address
     * @return the job post, or null if none exists
     * @throws IllegalArgumentException if address is null
     */
    JobPost find(AccountAddress address);

    /**
     * Atomically replaces {@code expected} with {@code updated}.
     *
     * @param expected the record the caller read
     * @param updated the replacement, with the same address
     * @return true if replaced, false if the stored record no longer equals expected
     * @throws IllegalArgumentException if either argument is null or the addresses differ
     */
    boolean compareAndSet(JobPost expected, JobPost updated);

    /**
     * Lists the job posts of one client, oldest first.
     *
     * @param client the client identity
     * @return job posts (may be empty)
     * @throws IllegalArgumentException if client is null
     */
    List<JobPost> findByClient(AccountAddress client);
}
