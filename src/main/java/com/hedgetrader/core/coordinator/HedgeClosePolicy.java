package com.hedgetrader.core.coordinator;

import com.hedgetrader.domain.enums.HedgeStatus;
import com.hedgetrader.domain.model.Hedge;
import com.hedgetrader.domain.model.TradingPair;
import com.hedgetrader.market.MarketSnapshot;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Target-hit close policy: an OPEN hedge closes once the market price has moved at least
 * the pair's {@code stopTakeDistancePercent} away from the hedge's average entry price, in
 * either direction. One leg is then in profit and the other at a loss of similar size.
 */
@Component
public class HedgeClosePolicy {

    public boolean isEnabled(TradingPair pair) {
        return pair.getStopTakeDistancePercent() != null && pair.getStopTakeDistancePercent().signum() > 0;
    }

    /**
     * @return the close reason if the hedge should close now
     */
    public Optional<String> evaluate(Hedge hedge, TradingPair pair, MarketSnapshot snapshot) {
        if (!isEnabled(pair) || hedge.getStatus() != HedgeStatus.OPEN || snapshot == null || !snapshot.hasPrice()) {
            return Optional.empty();
        }
        BigDecimal entry = hedge.averageEntryPrice();
        if (entry == null || entry.signum() == 0) {
            return Optional.empty();
        }
        BigDecimal move = snapshot.getPrice().subtract(entry).abs().divide(entry, 10, RoundingMode.HALF_UP);
        if (move.compareTo(pair.getStopTakeDistancePercent()) >= 0) {
            return Optional.of("Price " + snapshot.getPrice() + " moved " + move.setScale(4, RoundingMode.HALF_UP)
                    + " from entry " + entry.setScale(4, RoundingMode.HALF_UP));
        }
        return Optional.empty();
    }
}
