package com.hedgetrader.market;

/**
 * Source of market snapshots for the admission gate and the close policy.
 *
 * <p>Must be cheap enough to poll once per pair on every monitoring tick. Implementations
 * return null when no data is known for the market; the gate treats that as a failed
 * market-conditions check.
 */
public interface MarketSnapshotProvider {

    /**
     * @param marketId exchange market identifier
     * @return the latest snapshot, or null if the market is unknown
     * @throws com.hedgetrader.exception.ExchangeException if the source cannot be reached
     */
    MarketSnapshot getSnapshot(String marketId);
}
