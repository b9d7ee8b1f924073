package com.hedgetrader.config;

import com.hedgetrader.config.TradingProperties.AccountDefinition;
import com.hedgetrader.config.TradingProperties.PairDefinition;
import com.hedgetrader.domain.model.Account;
import com.hedgetrader.domain.model.AccountRiskLimits;
import com.hedgetrader.domain.model.PairRiskLimits;
import com.hedgetrader.domain.model.PriceConditions;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.exception.ConfigException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts bound {@link TradingProperties} into immutable {@link Account} and
 * {@link TradingPair} definitions.
 *
 * <p>All problems are collected and reported together in one {@link ConfigException}:
 * <ul>
 *   <li>accounts need a unique address and a non-negative balance</li>
 *   <li>pairs need a unique id, a market, a positive base amount and max positions &ge; 0</li>
 *   <li>every account a pair references must exist</li>
 *   <li>an enabled pair needs at least {@code requiredAccounts} (&ge; 2) active accounts</li>
 *   <li>the loss of one leg closed at the stop-take distance must fit every eligible
 *       account's max daily loss</li>
 * </ul>
 * Inactive accounts are dropped from the pairs that list them.
 */
public class TradingConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(TradingConfigLoader.class);

    public TradingConfiguration load(TradingProperties properties, LocalDate today) {
        List<String> errors = new ArrayList<>();

        Map<String, Account> accounts = new LinkedHashMap<>();
        Set<String> inactive = new HashSet<>();
        int position = 0;
        for (AccountDefinition definition : properties.getAccounts()) {
            position++;
            String address = definition.getAddress();
            if (address == null || address.isBlank()) {
                errors.add("account #" + position + ": address is required");
                continue;
            }
            if (accounts.containsKey(address) || inactive.contains(address)) {
                errors.add("account " + address + ": duplicate address");
                continue;
            }
            if (definition.getBalance() == null || definition.getBalance().signum() < 0) {
                errors.add("account " + address + ": balance must be >= 0");
                continue;
            }
            if (definition.getMaxDailyTrades() < 1) {
                errors.add("account " + address + ": max-daily-trades must be >= 1");
                continue;
            }
            if (!definition.isActive()) {
                inactive.add(address);
                continue;
            }
            accounts.put(address, Account.builder()
                    .address(address)
                    .index(definition.getIndex() != null ? definition.getIndex() : position - 1)
                    .balance(definition.getBalance())
                    .maxDailyTrades(definition.getMaxDailyTrades())
                    .lastResetDate(today)
                    .riskLimits(AccountRiskLimits.builder()
                            .maxDailyLoss(definition.getMaxDailyLoss())
                            .minBalance(definition.getMinBalance())
                            .build())
                    .build());
        }

        List<TradingPair> pairs = new ArrayList<>();
        Set<String> pairIds = new HashSet<>();
        for (PairDefinition definition : properties.getPairs()) {
            String id = definition.getId();
            if (id == null || id.isBlank()) {
                errors.add("pair: id is required");
                continue;
            }
            if (!pairIds.add(id)) {
                errors.add("pair " + id + ": duplicate id");
                continue;
            }
            List<String> pairErrors = validatePair(definition, accounts, inactive);
            if (!pairErrors.isEmpty()) {
                errors.addAll(pairErrors);
                continue;
            }
            pairs.add(toPair(definition, accounts.keySet()));
        }

        if (!errors.isEmpty()) {
            throw new ConfigException(errors);
        }

        log.info("Loaded trading configuration: {} accounts ({} inactive), {} pairs ({} enabled)",
                accounts.size(), inactive.size(), pairs.size(),
                pairs.stream().filter(TradingPair::isEnabled).count());
        return new TradingConfiguration(new ArrayList<>(accounts.values()), pairs);
    }

    private List<String> validatePair(PairDefinition definition, Map<String, Account> active, Set<String> inactive) {
        List<String> errors = new ArrayList<>();
        String prefix = "pair " + definition.getId() + ": ";

        if (definition.getMarketId() == null || definition.getMarketId().isBlank()) {
            errors.add(prefix + "market-id is required");
        }
        if (definition.getBaseAmount() == null || definition.getBaseAmount().signum() <= 0) {
            errors.add(prefix + "base-amount must be > 0");
        }
        if (definition.getMaxPositions() == null || definition.getMaxPositions() < 0) {
            errors.add(prefix + "max-positions must be >= 0");
        }
        if (definition.getCooldownMinutes() < 0) {
            errors.add(prefix + "cooldown-minutes must be >= 0");
        }
        if (definition.getRequiredAccounts() < 2) {
            errors.add(prefix + "required-accounts must be >= 2");
        } else if (definition.getRequiredAccounts() % 2 != 0) {
            errors.add(prefix + "required-accounts must be even so LONG and SHORT legs net to zero");
        }
        if (isNegative(definition.getStopTakeDistancePercent())) {
            errors.add(prefix + "stop-take-distance-percent must be >= 0");
        }

        long usable = 0;
        Set<String> seen = new HashSet<>();
        for (String address : definition.getAccounts()) {
            if (!seen.add(address)) {
                errors.add(prefix + "account " + address + " listed twice");
            } else if (active.containsKey(address)) {
                usable++;
                checkStopTakeLoss(definition, active.get(address), prefix).ifPresent(errors::add);
            } else if (!inactive.contains(address)) {
                errors.add(prefix + "unknown account " + address);
            }
        }
        if (definition.isEnabled() && usable < Math.max(2, definition.getRequiredAccounts())) {
            errors.add(prefix + "needs at least " + Math.max(2, definition.getRequiredAccounts())
                    + " active accounts, has " + usable);
        }
        return errors;
    }

    private static Optional<String> checkStopTakeLoss(PairDefinition definition, Account account, String prefix) {
        BigDecimal distance = definition.getStopTakeDistancePercent();
        BigDecimal maxDailyLoss = account.getRiskLimits().getMaxDailyLoss();
        if (distance == null || distance.signum() <= 0 || maxDailyLoss == null || definition.getBaseAmount() == null) {
            return Optional.empty();
        }
        BigDecimal legLoss = definition.getBaseAmount().multiply(distance);
        if (legLoss.compareTo(maxDailyLoss) <= 0) {
            return Optional.empty();
        }
        return Optional.of(prefix + "a stop-take close loses " + legLoss.stripTrailingZeros().toPlainString()
                + " on one leg, above max-daily-loss " + maxDailyLoss.stripTrailingZeros().toPlainString()
                + " of account " + account.getAddress());
    }

    private TradingPair toPair(PairDefinition definition, Set<String> active) {
        List<String> eligible = definition.getAccounts().stream().filter(active::contains).collect(Collectors.toList());

        PriceConditions.PriceConditionsBuilder conditions = PriceConditions.builder();
        if (definition.getMaxSpreadPercent() != null) {
            conditions.maxSpreadPercent(definition.getMaxSpreadPercent());
        }
        if (definition.getMaxVolatilityPercent() != null) {
            conditions.maxVolatilityPercent(definition.getMaxVolatilityPercent());
        }
        if (definition.getMinLiquidity() != null) {
            conditions.minLiquidity(definition.getMinLiquidity());
        }

        return TradingPair.builder()
                .id(definition.getId())
                .name(definition.getName() != null ? definition.getName() : definition.getId())
                .marketId(definition.getMarketId())
                .baseAmount(definition.getBaseAmount())
                .maxPositions(definition.getMaxPositions())
                .cooldownMinutes(definition.getCooldownMinutes())
                .accountAddresses(eligible)
                .requiredAccounts(definition.getRequiredAccounts())
                .enabled(definition.isEnabled())
                .riskLimits(PairRiskLimits.builder()
                        .maxDailyLoss(definition.getMaxDailyLoss())
                        .maxPositionSize(definition.getMaxPositionSize())
                        .build())
                .priceConditions(conditions.build())
                .stopTakeDistancePercent(definition.getStopTakeDistancePercent())
                .build();
    }

    private static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }
}
