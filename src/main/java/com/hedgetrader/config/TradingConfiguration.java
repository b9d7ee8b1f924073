package com.hedgetrader.config;

import com.hedgetrader.domain.model.Account;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.exception.ResourceNotFoundException;
import java.util.List;
import java.util.stream.Collectors;

/** Validated accounts and pairs, fixed for the life of the process. */
public class TradingConfiguration {

    private final List<Account> accounts;
    private final List<TradingPair> pairs;

    public TradingConfiguration(List<Account> accounts, List<TradingPair> pairs) {
        this.accounts = List.copyOf(accounts);
        this.pairs = List.copyOf(pairs);
    }

    /** Initial account definitions. Live account state is held by the AccountRegistry. */
    public List<Account> getAccounts() {
        return accounts;
    }

    public List<TradingPair> getPairs() {
        return pairs;
    }

    public List<TradingPair> getEnabledPairs() {
        return pairs.stream().filter(TradingPair::isEnabled).collect(Collectors.toList());
    }

    public TradingPair getPair(String pairId) {
        return pairs.stream()
                .filter(pair -> pair.getId().equals(pairId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("Trading pair", pairId));
    }
}
