package com.hedgetrader.simulator;

import com.hedgetrader.market.MarketSnapshot;
import com.hedgetrader.market.MarketSnapshotProvider;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Simulated market data: every market starts at the configured price and takes a small
 * Gaussian random-walk step each time it is polled. Markets are always open and prices are
 * always fresh; volatility, liquidity and spread are the configured constants.
 */
@Service
@ConditionalOnProperty(prefix = "hedgetrader.simulator", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PaperMarketDataProvider implements MarketSnapshotProvider {

    private final SimulatorProperties simulatorProperties;
    private final Random random;
    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();

    public PaperMarketDataProvider(SimulatorProperties simulatorProperties) {
        this.simulatorProperties = simulatorProperties;
        this.random = simulatorProperties.getSeed() != 0 ? new Random(simulatorProperties.getSeed()) : new Random();
    }

    @Override
    public MarketSnapshot getSnapshot(String marketId) {
        BigDecimal price = prices.compute(marketId, (id, current) -> {
            if (current == null) {
                return simulatorProperties.getStartPrice();
            }
            double step = random.nextGaussian() * simulatorProperties.getPriceStep();
            return current.multiply(BigDecimal.valueOf(1 + step)).setScale(8, RoundingMode.HALF_UP);
        });

        return MarketSnapshot.builder()
                .marketId(marketId)
                .open(true)
                .price(price)
                .priceAge(Duration.ZERO)
                .volatility(simulatorProperties.getVolatility())
                .liquidity(simulatorProperties.getLiquidity())
                .spread(simulatorProperties.getSpread())
                .build();
    }

    /** Last price handed out for the market, or the start price if never polled. */
    public BigDecimal getLastPrice(String marketId) {
        return prices.getOrDefault(marketId, simulatorProperties.getStartPrice());
    }
}
