package com.hedgetrader.core.gate;

import com.hedgetrader.domain.model.Account;
import com.hedgetrader.domain.model.Hedge;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.market.MarketSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import lombok.Builder;
import lombok.Getter;

/**
 * Inputs for one evaluation of the admission gate for one pair.
 *
 * <p>Account lists are registry snapshots taken when the context was built. The market
 * snapshot is fetched at most once, on first use, so cheaper checks that fail first never
 * trigger a market data call. Confined to the evaluating thread.
 */
@Getter
public class AdmissionContext {

    private final TradingPair pair;
    private final Instant now;

    /** Non-terminal hedges of the pair. */
    private final List<Hedge> pairHedges;

    /** The pair's eligible accounts, in configured order. */
    private final List<Account> eligibleAccounts;

    /** Accounts the selection policy would use, possibly fewer than required. */
    private final List<Account> selectedAccounts;

    @Getter(lombok.AccessLevel.NONE)
    private final Supplier<MarketSnapshot> snapshotSupplier;

    @Getter(lombok.AccessLevel.NONE)
    private MarketSnapshot snapshot;

    @Getter(lombok.AccessLevel.NONE)
    private boolean snapshotLoaded;

    @Builder
    public AdmissionContext(
            TradingPair pair,
            Instant now,
            List<Hedge> pairHedges,
            List<Account> eligibleAccounts,
            List<Account> selectedAccounts,
            Supplier<MarketSnapshot> snapshotSupplier) {
        this.pair = pair;
        this.now = now;
        this.pairHedges = pairHedges;
        this.eligibleAccounts = eligibleAccounts;
        this.selectedAccounts = selectedAccounts;
        this.snapshotSupplier = snapshotSupplier;
    }

    public MarketSnapshot getSnapshot() {
        if (!snapshotLoaded) {
            snapshot = snapshotSupplier.get();
            snapshotLoaded = true;
        }
        return snapshot;
    }
}
