package com.hedgetrader.simulator;

import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Paper trading settings, bound from {@code hedgetrader.simulator.*}.
 *
 * <p>When {@code enabled} is true (the default) the paper order executor and market data
 * provider stand in for a real exchange client.
 */
@Configuration
@ConfigurationProperties(prefix = "hedgetrader.simulator")
@Getter
@Setter
public class SimulatorProperties {

    private boolean enabled = true;

    /** Delay between order acceptance and its fill or rejection. */
    private long fillDelayMs = 200;

    /** Probability (0..1) that an accepted order is later rejected. */
    private double rejectProbability = 0.0;

    /** Starting price of every simulated market. */
    private BigDecimal startPrice = new BigDecimal("100");

    /** Standard deviation of the per-snapshot relative price step. */
    private double priceStep = 0.001;

    /** Fraction of price applied against the order on fills. */
    private BigDecimal slippage = new BigDecimal("0.0005");

    private BigDecimal volatility = new BigDecimal("0.02");
    private BigDecimal liquidity = new BigDecimal("50000");
    private BigDecimal spread = new BigDecimal("0.001");

    /** Random seed; 0 picks a time-based seed. */
    private long seed = 0;
}
