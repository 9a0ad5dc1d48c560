/**
 * In-memory balance ledger.
 *
 * @see com.ryuqq.jobescrow.core.spi.Ledger
 * @author JobEscrow Team
 * @since 1.0.0
 */
package com.ryuqq.jobescrow.adapter.inmemory.ledger;
