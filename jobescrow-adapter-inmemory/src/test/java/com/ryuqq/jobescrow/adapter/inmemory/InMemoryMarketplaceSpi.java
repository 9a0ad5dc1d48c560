package com.ryuqq.jobescrow.adapter.inmemory;

import com.ryuqq.jobescrow.adapter.inmemory.ledger.InMemoryLedger;
import com.ryuqq.jobescrow.adapter.inmemory.lock.InMemoryLockManager;
import com.ryuqq.jobescrow.adapter.inmemory.store.InMemoryApplicationStore;
import com.ryuqq.jobescrow.adapter.inmemory.store.InMemoryJobPostStore;
import com.ryuqq.jobescrow.adapter.inmemory.store.InMemoryUserAccountStore;
import com.ryuqq.jobescrow.testkit.contract.MarketplaceSpi;

/**
 * In-memory SPI 구현체 묶음 생성기.
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
public final class InMemoryMarketplaceSpi {

    private InMemoryMarketplaceSpi() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static MarketplaceSpi create() {
        return new MarketplaceSpi(
            new InMemoryUserAccountStore(),
            new InMemoryJobPostStore(),
            new InMemoryApplicationStore(),
            new InMemoryLedger(),
            new InMemoryLockManager()
        );
    }
}
