package com.hedgetrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * Market-quality bounds a pair requires before opening a hedge. Spread and volatility are
 * fractions of price (0.01 = 1%).
 */
@Getter
@Builder
public class PriceConditions {

    public static final BigDecimal DEFAULT_MAX_SPREAD = new BigDecimal("0.01");
    public static final BigDecimal DEFAULT_MAX_VOLATILITY = new BigDecimal("0.20");
    public static final BigDecimal DEFAULT_MIN_LIQUIDITY = new BigDecimal("1000");

    @Builder.Default
    private final BigDecimal maxSpreadPercent = DEFAULT_MAX_SPREAD;

    @Builder.Default
    private final BigDecimal maxVolatilityPercent = DEFAULT_MAX_VOLATILITY;

    @Builder.Default
    private final BigDecimal minLiquidity = DEFAULT_MIN_LIQUIDITY;

    public static PriceConditions defaults() {
        return PriceConditions.builder().build();
    }
}
