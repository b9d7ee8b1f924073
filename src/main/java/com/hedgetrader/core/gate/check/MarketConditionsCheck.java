package com.hedgetrader.core.gate.check;

import com.hedgetrader.config.EngineProperties;
import com.hedgetrader.core.gate.AdmissionCheck;
import com.hedgetrader.core.gate.AdmissionContext;
import com.hedgetrader.core.gate.CheckResult;
import com.hedgetrader.domain.enums.GateCondition;
import com.hedgetrader.domain.model.PriceConditions;
import com.hedgetrader.exception.ExchangeException;
import com.hedgetrader.market.MarketSnapshot;
import org.springframework.stereotype.Component;

/**
 * Market must be open, with a fresh price, volatility and spread at or below the pair's
 * maximums and liquidity at or above its minimum. Missing values fail the check.
 */
@Component
public class MarketConditionsCheck implements AdmissionCheck {

    private final EngineProperties engineProperties;

    public MarketConditionsCheck(EngineProperties engineProperties) {
        this.engineProperties = engineProperties;
    }

    @Override
    public GateCondition condition() {
        return GateCondition.MARKET_CONDITIONS;
    }

    @Override
    public CheckResult check(AdmissionContext context) {
        MarketSnapshot snapshot;
        try {
            snapshot = context.getSnapshot();
        } catch (ExchangeException e) {
            return CheckResult.fail("Market data unavailable: " + e.getMessage());
        }

        String marketId = context.getPair().getMarketId();
        if (snapshot == null || !snapshot.hasPrice()) {
            return CheckResult.fail("No price data for " + marketId);
        }
        if (!snapshot.isOpen()) {
            return CheckResult.fail("Market " + marketId + " is closed");
        }
        if (snapshot.getPriceAge() == null
                || snapshot.getPriceAge().compareTo(engineProperties.getPriceStaleness()) >= 0) {
            return CheckResult.fail("Price for " + marketId + " is stale (age " + snapshot.getPriceAge() + ")");
        }

        PriceConditions bounds = context.getPair().getPriceConditions();
        if (snapshot.getVolatility() == null
                || snapshot.getVolatility().compareTo(bounds.getMaxVolatilityPercent()) > 0) {
            return CheckResult.fail(
                    "Volatility " + snapshot.getVolatility() + " above " + bounds.getMaxVolatilityPercent());
        }
        if (snapshot.getLiquidity() == null || snapshot.getLiquidity().compareTo(bounds.getMinLiquidity()) < 0) {
            return CheckResult.fail("Liquidity " + snapshot.getLiquidity() + " below " + bounds.getMinLiquidity());
        }
        if (snapshot.getSpread() == null || snapshot.getSpread().compareTo(bounds.getMaxSpreadPercent()) > 0) {
            return CheckResult.fail("Spread " + snapshot.getSpread() + " above " + bounds.getMaxSpreadPercent());
        }
        return CheckResult.pass();
    }
}
