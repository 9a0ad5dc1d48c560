package com.ryuqq.jobescrow.adapter.inmemory;

import com.ryuqq.jobescrow.testkit.contract.LockManagerContractTest;
import com.ryuqq.jobescrow.testkit.contract.MarketplaceSpi;

/**
 * Contract Tests for {@link com.ryuqq.jobescrow.adapter.inmemory.lock.InMemoryLockManager}.
 *
 * @author JobEscrow Team
 * @since 1.0.0
 */
class InMemoryLockManagerContractTest extends LockManagerContractTest {

    @Override
    protected MarketplaceSpi createSpi() {
        return InMemoryMarketplaceSpi.create();
    }
}
