package com.hedgetrader.status;

import com.hedgetrader.risk.RiskSummary;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Read-only snapshot of the whole engine, polled by the external status API. */
@Getter
@Builder
public class EngineStatus {

    private final boolean running;
    private final boolean emergencyStop;
    private final String emergencyReason;
    private final long tickCount;
    private final Instant lastTickAt;
    private final Instant generatedAt;
    private final List<HedgeSummary> activeHedges;
    private final List<AccountSummary> accounts;
    private final List<PairSummary> pairs;
    private final RiskSummary risk;
    private final List<RiskEventSummary> recentRiskEvents;
}
