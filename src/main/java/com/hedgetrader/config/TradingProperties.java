package com.hedgetrader.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Raw account and trading pair definitions bound from {@code hedgetrader.trading.*}.
 *
 * <p>Nothing here is used directly by the engine. {@link TradingConfigLoader} validates these
 * definitions and converts them into immutable domain objects once at startup.
 */
@Configuration
@ConfigurationProperties(prefix = "hedgetrader.trading")
@Getter
@Setter
public class TradingProperties {

    private List<AccountDefinition> accounts = new ArrayList<>();
    private List<PairDefinition> pairs = new ArrayList<>();

    @Getter
    @Setter
    public static class AccountDefinition {
        private String address;
        private Integer index;
        private BigDecimal balance;
        private boolean active = true;
        private int maxDailyTrades = 100;
        private BigDecimal maxDailyLoss;
        private BigDecimal minBalance;
    }

    @Getter
    @Setter
    public static class PairDefinition {
        private String id;
        private String name;
        private String marketId;
        private BigDecimal baseAmount;
        private Integer maxPositions = 3;
        private int cooldownMinutes = 10;
        private List<String> accounts = new ArrayList<>();
        private int requiredAccounts = 2;
        private boolean enabled = true;
        private BigDecimal maxDailyLoss;
        private BigDecimal maxPositionSize;
        private BigDecimal maxSpreadPercent;
        private BigDecimal maxVolatilityPercent;
        private BigDecimal minLiquidity;
        private BigDecimal stopTakeDistancePercent;
    }
}
