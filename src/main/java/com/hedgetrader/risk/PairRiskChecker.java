package com.hedgetrader.risk;

import com.hedgetrader.domain.model.PairRiskLimits;
import com.hedgetrader.domain.model.TradingPair;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pair-tier risk: daily realized loss attributable to each pair's hedges, and the pair's
 * position size limit.
 *
 * <p><b>Thread safety:</b> per-pair loss counters are {@link AtomicReference}s updated with
 * {@code updateAndGet}. {@code currentDate} is volatile for the daily reset check.
 */
@Component
public class PairRiskChecker {

    private static final Logger log = LoggerFactory.getLogger(PairRiskChecker.class);

    private final Clock clock;
    private final Map<String, AtomicReference<BigDecimal>> dailyLosses = new ConcurrentHashMap<>();

    private volatile LocalDate currentDate;

    public PairRiskChecker(Clock clock) {
        this.clock = clock;
        this.currentDate = LocalDate.now(clock);
    }

    /**
     * Adds a closed hedge's realized P&L to the pair. Only losses accumulate.
     */
    public void recordPnl(String pairId, BigDecimal pnl) {
        resetDailyCountersIfNeeded();
        if (pnl.signum() >= 0) {
            return;
        }
        BigDecimal loss = pnl.negate();
        BigDecimal total = dailyLosses
                .computeIfAbsent(pairId, id -> new AtomicReference<>(BigDecimal.ZERO))
                .updateAndGet(current -> current.add(loss));
        log.debug("Pair {} daily loss now {}", pairId, total);
    }

    public BigDecimal getDailyLoss(String pairId) {
        resetDailyCountersIfNeeded();
        AtomicReference<BigDecimal> loss = dailyLosses.get(pairId);
        return loss != null ? loss.get() : BigDecimal.ZERO;
    }

    public Map<String, BigDecimal> getDailyLosses() {
        resetDailyCountersIfNeeded();
        Map<String, BigDecimal> snapshot = new TreeMap<>();
        dailyLosses.forEach((pairId, loss) -> snapshot.put(pairId, loss.get()));
        return snapshot;
    }

    public LimitStatus dailyLossStatus(TradingPair pair, BigDecimal warningThreshold) {
        return LimitStatus.of(getDailyLoss(pair.getId()), pair.getRiskLimits().getMaxDailyLoss(), warningThreshold);
    }

    /** Validates a prospective hedge of {@code pair.baseAmount} per leg. */
    public List<RiskViolation> validate(TradingPair pair) {
        List<RiskViolation> violations = new ArrayList<>();
        PairRiskLimits limits = pair.getRiskLimits();

        if (dailyLossStatus(pair, null) == LimitStatus.BREACHED) {
            violations.add(RiskViolation.of(
                    "PAIR_DAILY_LOSS_LIMIT",
                    "Pair " + pair.getId() + " daily loss " + getDailyLoss(pair.getId()) + " reached limit "
                            + limits.getMaxDailyLoss()));
        }

        if (limits.getMaxPositionSize() != null && pair.getBaseAmount().compareTo(limits.getMaxPositionSize()) > 0) {
            violations.add(RiskViolation.of(
                    "POSITION_SIZE_EXCEEDED",
                    "Pair " + pair.getId() + " leg size " + pair.getBaseAmount() + " exceeds max position size "
                            + limits.getMaxPositionSize()));
        }

        return violations;
    }

    private void resetDailyCountersIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (!today.equals(currentDate)) {
            synchronized (this) {
                if (!today.equals(currentDate)) {
                    dailyLosses.clear();
                    log.info("Daily pair loss counters reset for {} (previous day: {})", today, currentDate);
                    currentDate = today;
                }
            }
        }
    }
}
