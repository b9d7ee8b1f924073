package com.hedgetrader.status;

import com.hedgetrader.domain.enums.CloseReason;
import com.hedgetrader.domain.enums.HedgeStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class HedgeSummary {

    private final String id;
    private final String pairId;
    private final HedgeStatus status;
    private final Instant createdAt;
    private final Instant openedAt;
    private final Instant closedAt;
    private final CloseReason closeReason;
    private final String failureReason;
    private final BigDecimal realizedPnl;
    private final List<LegSummary> legs;

    @Getter
    @Builder
    public static class LegSummary {
        private final String accountAddress;
        private final String side;
        private final BigDecimal size;
        private final String status;
        private final BigDecimal entryPrice;
        private final String exitStatus;
        private final BigDecimal exitPrice;
    }
}
