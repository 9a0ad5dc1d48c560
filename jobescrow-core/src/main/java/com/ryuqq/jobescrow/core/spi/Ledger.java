package com.ryuqq.jobescrow.core.spi;

import com.ryuqq.jobescrow.core.model.AccountAddress;

/**
 * Balance ledger SPI.
 *
 * <p>Holds spendable balances for caller identities and escrow accounts. The core
 * never mints funds; callers are funded by the surrounding environment through
 * {@link #credit(AccountAddress, long)}.</p>
 *
 * <p>Balances and amounts are unsigned 64-bit values stored in {@code long}; compare and
 * add them with {@link com.ryuqq.jobescrow.core.model.Amounts}.</p>
 *
 * <p><strong>Transfer Semantics:</strong></p>
 * <pre>
 * BEGIN TRANSACTION;
 *   SELECT balance FROM balances WHERE address = :from FOR UPDATE;
 *   -- balance &lt; amount → rollback, InsufficientFunds
 *   UPDATE balances SET balance = balance - :amount WHERE address = :from;
 *   UPSERT balances SET balance = balance + :amount WHERE address = :to;
 * COMMIT;
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic transfer: either both sides move or neither does</li>
 *   <li>Thread-safe: concurrent transfers never drive a balance below zero</li>
 *   <li>Overflow on the receiving side is rejected, not wrapped</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public interface Ledger {

    /**
     * Returns the balance of an account.
     *
     * @param address the account address
     * @return the balance, 0 if the account does not exist
     * @throws IllegalArgumentException if address is null
     */
    long balanceOf(AccountAddress address);

    /**
     * Checks whether an account has been opened (credited at least once and not closed).
     *
     * @param address the account address
     * @return true if the account exists
     * @throws IllegalArgumentException if address is null
     */
    boolean exists(AccountAddress address);

    /**
     * Adds funds to an account, opening it if needed.
     *
     * @param address the account address
     * @param amount the amount to add (unsigned)
     * @throws IllegalArgumentException if address is null
     * @throws ArithmeticException if the balance would exceed the unsigned 64-bit range
     */
    void credit(AccountAddress address, long amount);

    /**
     * Moves funds between two accounts atomically, opening the destination if needed.
     *
     * @param from the source account
     * @param to the destination account
     * @param amount the amount to move (unsigned)
     * @throws IllegalArgumentException if an address is null or they are equal
     * @throws com.ryuqq.jobescrow.core.error.MarketplaceException INSUFFICIENT_FUNDS if the source balance is lower than amount
     * @throws ArithmeticException if the destination balance would exceed the unsigned 64-bit range
     */
    void transfer(AccountAddress from, AccountAddress to, long amount);

    /**
     * Closes an account whose balance is zero.
     *
     * @param address the account address
     * @throws IllegalArgumentException if address is null
     * @throws IllegalStateException if the account still holds funds
     */
    void close(AccountAddress address);
}
