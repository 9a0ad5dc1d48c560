package com.ryuqq.jobescrow.adapter.inmemory.ledger;

import com.ryuqq.jobescrow.core.error.MarketplaceErrorCode;
import com.ryuqq.jobescrow.core.error.MarketplaceException;
import com.ryuqq.jobescrow.core.model.AccountAddress;
import com.ryuqq.jobescrow.core.model.Amounts;
import com.ryuqq.jobescrow.core.spi.Ledger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * In-memory implementation of {@link Ledger} for testing and reference purposes.
 *
 * <p>All mutating methods are {@code synchronized} on the ledger instance, which makes
 * every transfer atomic with respect to every other ledger call. Balances are checked
 * before either side is written, so a rejected transfer leaves both accounts unchanged.</p>
 *
 * <p>Balances and amounts are unsigned 64-bit values compared and summed through {@link Amounts}.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Single global monitor: transfers on unrelated accounts are serialized</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public class InMemoryLedger implements Ledger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLedger.class);

    /**
     * Open accounts → balance. Guarded by {@code this}.
     */
    private final Map<AccountAddress, Long> balances;

    /**
     * Creates a new InMemoryLedger with no accounts.
     */
    public InMemoryLedger() {
        this.balances = new HashMap<>();
    }

    @Override
    public synchronized long balanceOf(AccountAddress address) {
        requireAddress(address);
        return balances.getOrDefault(address, 0L);
    }

    @Override
    public synchronized boolean exists(AccountAddress address) {
        requireAddress(address);
        return balances.containsKey(address);
    }

    @Override
    public synchronized void credit(AccountAddress address, long amount) {
        requireAddress(address);
        long updated = Amounts.addExact(balances.getOrDefault(address, 0L), amount);
        balances.put(address, updated);
        log.debug("Credited {} to {} (balance: {})", Amounts.format(amount), address, Amounts.format(updated));
    }

    @Override
    public synchronized void transfer(AccountAddress from, AccountAddress to, long amount) {
        requireAddress(from);
        requireAddress(to);
        if (from.equals(to)) {
            throw new IllegalArgumentException("Cannot transfer to the same account: " + from);
        }

        long fromBalance = balances.getOrDefault(from, 0L);
        if (Amounts.isLessThan(fromBalance, amount)) {
            throw new MarketplaceException(MarketplaceErrorCode.INSUFFICIENT_FUNDS,
                Amounts.format(fromBalance), Amounts.format(amount));
        }
        long toBalance = Amounts.addExact(balances.getOrDefault(to, 0L), amount);

        balances.put(from, fromBalance - amount);
        balances.put(to, toBalance);
        log.debug("Transferred {} from {} to {}", Amounts.format(amount), from, to);
    }

    @Override
    public synchronized void close(AccountAddress address) {
        requireAddress(address);
        Long balance = balances.get(address);
        if (balance == null) {
            return;
        }
        if (balance != 0L) {
            throw new IllegalStateException("Cannot close account " + address + " holding " + Amounts.format(balance));
        }
        balances.remove(address);
        log.debug("Closed account {}", address);
    }

    /**
     * Returns the sum of all balances.
     *
     * <p>This method is used for test assertions: transfers never change the total.</p>
     *
     * @return total balance across all open accounts (unsigned)
     * @throws ArithmeticException if the total exceeds the unsigned 64-bit range
     */
    public synchronized long totalSupply() {
        long total = 0L;
        for (long balance : balances.values()) {
            total = Amounts.addExact(total, balance);
        }
        return total;
    }

    /**
     * Clears all accounts.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public synchronized void clear() {
        balances.clear();
    }

    private static void requireAddress(AccountAddress address) {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
    }
}
