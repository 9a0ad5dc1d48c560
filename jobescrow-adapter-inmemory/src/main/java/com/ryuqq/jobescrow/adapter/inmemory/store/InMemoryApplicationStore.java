package com.ryuqq.jobescrow.adapter.inmemory.store;

import com.ryuqq.jobescrow.core.account.Application;
import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.spi.ApplicationStore;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ApplicationStore} for testing and reference purposes.
 *
 * <p>Applications are keyed by their derived address, which already encodes the
 * (job post, applicant) pair; {@link ConcurrentHashMap#putIfAbsent} therefore enforces
 * one application per applicant per job.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public class InMemoryApplicationStore implements ApplicationStore {

    private final ConcurrentHashMap<AccountAddress, Application> applications;
    private final CopyOnWriteArrayList<AccountAddress> insertionOrder;

    /**
     * Creates a new InMemoryApplicationStore with empty storage.
     */
    public InMemoryApplicationStore() {
        this.applications = new ConcurrentHashMap<>();
        this.insertionOrder = new CopyOnWriteArrayList<>();
    }

    @Override
    public boolean insert(Application application) {
        if (application == null) {
            throw new IllegalArgumentException("application cannot be null");
        }
        if (applications.putIfAbsent(application.address(), application) != null) {
            return false;
        }
        insertionOrder.add(application.address());
        return true;
    }

    @Override
    public Application find(AccountAddress address) {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        return applications.get(address);
    }

    @Override
    public boolean compareAndSet(Application expected, Application updated) {
        if (expected == null || updated == null) {
            throw new IllegalArgumentException("expected and updated cannot be null");
        }
        if (!expected.address().equals(updated.address())) {
            throw new IllegalArgumentException(
                "address cannot change: " + expected.address() + " → " + updated.address());
        }
        return applications.replace(expected.address(), expected, updated);
    }

    @Override
    public List<Application> findByJobPost(AccountAddress jobPost) {
        if (jobPost == null) {
            throw new IllegalArgumentException("jobPost cannot be null");
        }
        return insertionOrder.stream()
                .map(applications::get)
                .filter(application -> application != null && application.belongsTo(jobPost))
                .collect(Collectors.toList());
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        applications.clear();
        insertionOrder.clear();
    }
}
