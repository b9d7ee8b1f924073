package com.hedgetrader.risk;

import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/** Outcome of a kill switch activation. */
@Data
@Builder
public class KillSwitchResult {

    private boolean success;
    private boolean emergencyStopActivated;
    private int hedgesClosing;
    private String reason;
    private Instant activatedAt;

    public static KillSwitchResult alreadyActive(Instant at) {
        return KillSwitchResult.builder()
                .success(false)
                .reason("Kill switch already active")
                .activatedAt(at)
                .build();
    }
}
