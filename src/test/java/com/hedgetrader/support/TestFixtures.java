package com.hedgetrader.support;

import com.hedgetrader.domain.model.Account;
import com.hedgetrader.domain.model.AccountRiskLimits;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.market.MarketSnapshot;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public final class TestFixtures {

    public static final Instant START = Instant.parse("2026-03-02T10:00:00Z");
    public static final LocalDate START_DATE = LocalDate.of(2026, 3, 2);

    public static final String ALICE = "0xA11CE";
    public static final String BOB = "0xB0B";
    public static final String CAROL = "0xCA401";
    public static final String DAVE = "0xDA7E";

    private TestFixtures() {}

    public static Account account(String address, String balance) {
        return Account.builder()
                .address(address)
                .balance(new BigDecimal(balance))
                .lastResetDate(START_DATE)
                .build();
    }

    public static Account account(String address, String balance, String maxDailyLoss, String minBalance) {
        return Account.builder()
                .address(address)
                .balance(new BigDecimal(balance))
                .lastResetDate(START_DATE)
                .riskLimits(AccountRiskLimits.builder()
                        .maxDailyLoss(maxDailyLoss != null ? new BigDecimal(maxDailyLoss) : null)
                        .minBalance(minBalance != null ? new BigDecimal(minBalance) : null)
                        .build())
                .build();
    }

    /** Pair with base amount 100000, 10 minute cooldown, market id = upper-cased id. */
    public static TradingPair pair(String id, int maxPositions, String... accounts) {
        return pairBuilder(id, accounts).maxPositions(maxPositions).build();
    }

    public static TradingPair.TradingPairBuilder pairBuilder(String id, String... accounts) {
        return TradingPair.builder()
                .id(id)
                .name(id)
                .marketId(id.toUpperCase())
                .baseAmount(new BigDecimal("100000"))
                .maxPositions(1)
                .cooldownMinutes(10)
                .accountAddresses(List.of(accounts));
    }

    public static MarketSnapshot healthySnapshot(String marketId, String price) {
        return MarketSnapshot.builder()
                .marketId(marketId)
                .open(true)
                .price(new BigDecimal(price))
                .priceAge(Duration.ofSeconds(1))
                .volatility(new BigDecimal("0.02"))
                .liquidity(new BigDecimal("50000"))
                .spread(new BigDecimal("0.001"))
                .build();
    }
}
