package com.hedgetrader.config;

import java.time.Clock;
import java.time.LocalDate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the account and pair definitions once at startup. A {@link com.hedgetrader.exception.ConfigException}
 * thrown here fails context startup.
 */
@Configuration
public class TradingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TradingConfiguration tradingConfiguration(TradingProperties tradingProperties, Clock clock) {
        return new TradingConfigLoader().load(tradingProperties, LocalDate.now(clock));
    }
}
