package com.hedgetrader.core.gate;

import com.hedgetrader.domain.enums.PositionSide;
import com.hedgetrader.domain.model.Account;
import com.hedgetrader.domain.model.TradingPair;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deterministic account selection for a new hedge.
 *
 * <p>Candidates are the pair's eligible accounts that are unlocked, unreserved, below their
 * daily trade limit and have available balance for the base amount. They are kept in
 * configured order, stable-sorted by lowest daily trade count, and the first
 * {@code requiredAccounts} are taken.
 *
 * <p><b>Sides:</b> exactly half the legs are LONG and half SHORT. Each account takes the
 * opposite of the side it held in the pair's previous hedge where the split allows it, so
 * the losing side rotates across accounts. Accounts without history on the pair fill the
 * remaining slots in selection order, LONG first.
 */
@Component
public class AccountSelector {

    private static final Logger log = LoggerFactory.getLogger(AccountSelector.class);

    /** pairId -> (account address -> side taken in that pair's last hedge). */
    private final Map<String, Map<String, PositionSide>> lastSides = new ConcurrentHashMap<>();

    public List<Account> select(TradingPair pair, List<Account> eligibleAccounts) {
        return eligibleAccounts.stream()
                .filter(account -> isCandidate(account, pair))
                .sorted(Comparator.comparingInt(Account::getDailyTrades))
                .limit(pair.getRequiredAccounts())
                .collect(Collectors.toList());
    }

    public boolean isCandidate(Account account, TradingPair pair) {
        return !account.isLocked()
                && !account.isReserved()
                && account.hasTradesRemaining()
                && account.getAvailableBalance().compareTo(pair.getBaseAmount()) >= 0;
    }

    /**
     * Assigns a side to each selected account. Nothing is remembered until
     * {@link #recordSides} is called for the hedge actually opened.
     *
     * @return sides aligned with {@code addresses}
     * @throws IllegalArgumentException if the number of accounts is odd
     */
    public List<PositionSide> assignSides(String pairId, List<String> addresses) {
        if (addresses.size() % 2 != 0) {
            throw new IllegalArgumentException("Pair " + pairId + " needs an even number of accounts to stay "
                    + "delta-neutral, got " + addresses.size());
        }
        Map<String, PositionSide> history = lastSides.getOrDefault(pairId, Map.of());

        // Rank for LONG: last SHORT, then no history, then last LONG. Sorting is stable.
        List<String> longPreference = new ArrayList<>(addresses);
        longPreference.sort(Comparator.comparingInt(address -> longRank(history.get(address))));
        List<String> longs = longPreference.subList(0, addresses.size() / 2);

        List<PositionSide> sides = new ArrayList<>();
        for (String address : addresses) {
            sides.add(longs.contains(address) ? PositionSide.LONG : PositionSide.SHORT);
        }
        return sides;
    }

    /** Remembers the sides of an opened hedge as the starting point of the next rotation. */
    public void recordSides(String pairId, List<String> addresses, List<PositionSide> sides) {
        Map<String, PositionSide> history = lastSides.computeIfAbsent(pairId, id -> new ConcurrentHashMap<>());
        for (int i = 0; i < addresses.size(); i++) {
            history.put(addresses.get(i), sides.get(i));
        }
        log.debug("Sides for pair {}: {} -> {}", pairId, addresses, sides);
    }

    /** Side the account took in the pair's most recent hedge, if any. */
    public PositionSide getLastSide(String pairId, String address) {
        Map<String, PositionSide> history = lastSides.get(pairId);
        return history != null ? history.get(address) : null;
    }

    private static int longRank(PositionSide previous) {
        if (previous == PositionSide.SHORT) {
            return 0;
        }
        return previous == null ? 1 : 2;
    }
}
