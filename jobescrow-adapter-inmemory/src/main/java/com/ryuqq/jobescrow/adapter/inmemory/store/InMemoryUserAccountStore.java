package com.ryuqq.jobescrow.adapter.inmemory.store;

import com.ryuqq.jobescrow.core.account.UserAccount;
import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.spi.UserAccountStore;

import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link UserAccountStore} for testing and reference purposes.
 *
 * <p>Accounts are keyed by owner identity. {@link ConcurrentHashMap#putIfAbsent} makes
 * registration an atomic insert-if-absent, so concurrent registrations by the same
 * owner produce exactly one account.</p>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public class InMemoryUserAccountStore implements UserAccountStore {

    /**
     * Owner identity → account.
     */
    private final ConcurrentHashMap<AccountAddress, UserAccount> accounts;

    /**
     * Creates a new InMemoryUserAccountStore with empty storage.
     */
    public InMemoryUserAccountStore() {
        this.accounts = new ConcurrentHashMap<>();
    }

    @Override
    public boolean insert(UserAccount account) {
        if (account == null) {
            throw new IllegalArgumentException("account cannot be null");
        }
        return accounts.putIfAbsent(account.owner(), account) == null;
    }

    @Override
    public UserAccount find(AccountAddress owner) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        return accounts.get(owner);
    }

    /**
     * Returns the number of registered accounts.
     *
     * <p>This method is used for test assertions.</p>
     *
     * @return account count
     */
    public int size() {
        return accounts.size();
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        accounts.clear();
    }
}
