package com.hedgetrader.config;

import com.hedgetrader.risk.RiskLimits;
import java.math.BigDecimal;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the global {@link RiskLimits} bean.
 *
 * <p>The global daily loss limit defaults to 5000. Setting it to an empty value disables
 * the global tier (null = check skipped).
 *
 * <p>Properties prefix: {@code hedgetrader.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public RiskLimits riskLimits(
            @Value("${hedgetrader.risk.global-max-daily-loss:5000}") BigDecimal globalMaxDailyLoss,
            @Value("${hedgetrader.engine.daily-loss-warning-threshold:0.8}") BigDecimal dailyLossWarningThreshold) {
        return RiskLimits.builder()
                .globalMaxDailyLoss(globalMaxDailyLoss)
                .dailyLossWarningThreshold(dailyLossWarningThreshold)
                .build();
    }
}
