package com.hedgetrader.market;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Builder;
import lombok.Getter;

/**
 * Point-in-time market quality for one market, as reported by a {@link MarketSnapshotProvider}.
 *
 * <p>Volatility and spread are fractions of price (0.02 = 2%). Liquidity is the order book
 * depth available near the mid price, in quote currency.
 */
@Getter
@Builder
public class MarketSnapshot {

    private final String marketId;
    private final boolean open;
    private final BigDecimal price;

    /** Age of the price at the time the snapshot was taken. */
    private final Duration priceAge;

    private final BigDecimal volatility;
    private final BigDecimal liquidity;
    private final BigDecimal spread;

    public boolean hasPrice() {
        return price != null && price.signum() > 0;
    }
}
