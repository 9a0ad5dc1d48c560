package com.ryuqq.jobescrow.adapter.inmemory.store;

import com.ryuqq.jobescrow.core.account.JobPost;
import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.spi.JobPostStore;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link JobPostStore} for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>jobPosts:</strong> ConcurrentHashMap&lt;AccountAddress, JobPost&gt; - current record by address</li>
 *   <li><strong>insertionOrder:</strong> CopyOnWriteArrayList&lt;AccountAddress&gt; - creation order for client queries</li>
 * </ul>
 *
 * <p><strong>Compare-and-Set:</strong> {@link ConcurrentHashMap#replace(Object, Object, Object)}
 * compares with {@link JobPost#equals(Object)}, so an update succeeds only when the stored
 * record is still the one the caller read.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public class InMemoryJobPostStore implements JobPostStore {

    private final ConcurrentHashMap<AccountAddress, JobPost> jobPosts;
    private final CopyOnWriteArrayList<AccountAddress> insertionOrder;

    /**
     * Creates a new InMemoryJobPostStore with empty storage.
     */
    public InMemoryJobPostStore() {
        this.jobPosts = new ConcurrentHashMap<>();
        this.insertionOrder = new CopyOnWriteArrayList<>();
    }

    @Override
    public boolean insert(JobPost jobPost) {
        if (jobPost == null) {
            throw new IllegalArgumentException("jobPost cannot be null");
        }
        if (jobPosts.putIfAbsent(jobPost.address(), jobPost) != null) {
            return false;
        }
        insertionOrder.add(jobPost.address());
        return true;
    }

    @Override
    public JobPost find(AccountAddress address) {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        return jobPosts.get(address);
    }

    @Override
    public boolean compareAndSet(JobPost expected, JobPost updated) {
        if (expected == null || updated == null) {
            throw new IllegalArgumentException("expected and updated cannot be null");
        }
        if (!expected.address().equals(updated.address())) {
            throw new IllegalArgumentException(
                "address cannot change: " + expected.address() + " → " + updated.address());
        }
        return jobPosts.replace(expected.address(), expected, updated);
    }

    @Override
    public List<JobPost> findByClient(AccountAddress client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        return insertionOrder.stream()
                .map(jobPosts::get)
                .filter(job -> job != null && job.isPostedBy(client))
                .collect(Collectors.toList());
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        jobPosts.clear();
        insertionOrder.clear();
    }
}
