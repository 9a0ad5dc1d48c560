package com.ryuqq.jobescrow.core.spi;

import com.ryuqq.jobescrow.core.account.UserAccount;
import com.ryuqq.jobescrow.core.model.AccountAddress;

/**
 * Identity registry storage SPI.
 *
 * <p>Holds one {@link UserAccount} per owner identity, keyed by the owner
 * (not by the derived record address) so role checks are a single lookup.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: insert must be atomic insert-if-absent</li>
 *   <li>No update or delete path: role is immutable after registration</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public interface UserAccountStore {

    /**
     * Inserts the account if no account exists for its owner.
     *
     * @param account the account to insert
     * @return true if inserted, false if an account already exists for the owner
     * @throws IllegalArgumentException if account is null
     */
    boolean insert(UserAccount account);

    /**
     * Looks up the account registered by the given owner.
     *
     * @param owner the caller identity
     * @return the account, or null if the owner has not registered
     * @throws IllegalArgumentException if owner is null
     */
    UserAccount find(AccountAddress owner);
}
