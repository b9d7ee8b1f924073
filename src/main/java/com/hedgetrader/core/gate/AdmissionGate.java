package com.hedgetrader.core.gate;

import com.hedgetrader.account.AccountRegistry;
import com.hedgetrader.domain.model.Account;
import com.hedgetrader.domain.model.Hedge;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.market.MarketSnapshot;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Ordered, short-circuiting evaluation of the admission conditions for a pair.
 *
 * <p>Checks run in {@link com.hedgetrader.domain.enums.GateCondition} order regardless of
 * bean registration order. The first failing check ends evaluation and names the reason.
 * Evaluation is read-only; the caller reserves the selected accounts separately.
 */
@Component
public class AdmissionGate {

    private static final Logger log = LoggerFactory.getLogger(AdmissionGate.class);

    private final List<AdmissionCheck> checks;
    private final AccountRegistry accountRegistry;
    private final AccountSelector accountSelector;
    private final Clock clock;

    public AdmissionGate(
            List<AdmissionCheck> checks,
            AccountRegistry accountRegistry,
            AccountSelector accountSelector,
            Clock clock) {
        this.checks = checks.stream()
                .sorted(Comparator.comparingInt(check -> check.condition().getOrder()))
                .collect(Collectors.toList());
        this.accountRegistry = accountRegistry;
        this.accountSelector = accountSelector;
        this.clock = clock;
    }

    /**
     * @param pair the pair to evaluate
     * @param pairHedges the pair's hedges; terminal ones are ignored
     * @param snapshotSupplier market data source, called at most once
     */
    public AdmissionDecision evaluate(
            TradingPair pair, List<Hedge> pairHedges, Supplier<MarketSnapshot> snapshotSupplier) {
        List<Account> eligible = accountRegistry.getAccounts(pair.getAccountAddresses());
        AdmissionContext context = AdmissionContext.builder()
                .pair(pair)
                .now(clock.instant())
                .pairHedges(pairHedges.stream()
                        .filter(hedge -> !hedge.isTerminal())
                        .collect(Collectors.toList()))
                .eligibleAccounts(eligible)
                .selectedAccounts(accountSelector.select(pair, eligible))
                .snapshotSupplier(snapshotSupplier)
                .build();

        for (AdmissionCheck check : checks) {
            CheckResult result = check.check(context);
            if (!result.passed()) {
                log.debug("Pair {} denied by {}: {}", pair.getId(), check.condition(), result.reason());
                return AdmissionDecision.deny(check.condition(), result.reason());
            }
        }
        return AdmissionDecision.admit(context.getSelectedAccounts());
    }

    public List<AdmissionCheck> getChecks() {
        return List.copyOf(checks);
    }
}
