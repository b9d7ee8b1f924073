package com.hedgetrader.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Engine-wide timing and policy settings.
 *
 * <p>Binds to the {@code hedgetrader.engine.*} prefix. The tick and timeout-check intervals
 * are plain milliseconds because they feed {@code @Scheduled} placeholders directly.
 */
@Configuration
@ConfigurationProperties(prefix = "hedgetrader.engine")
@Validated
@Getter
@Setter
public class EngineProperties {

    /** Start ticking when the application is ready. */
    private boolean autoStart = true;

    /** Delay between monitoring ticks. Default: 5 seconds. */
    @Min(100)
    private long monitoringIntervalMs = 5000;

    /** How often pending legs are checked against {@link #orderTimeout}. */
    @Min(50)
    private long legTimeoutCheckIntervalMs = 1000;

    /** A leg pending longer than this is cancelled and treated as rejected. */
    @NotNull
    private Duration orderTimeout = Duration.ofSeconds(30);

    /** Market prices older than this fail the market-conditions check. */
    @NotNull
    private Duration priceStaleness = Duration.ofSeconds(30);

    /** Placement attempts per exit order before the leg's account is locked. */
    @Min(1)
    private int unwindMaxAttempts = 3;

    /**
     * Minimum wait before a failed exit placement is retried. A non-zero delay defers the
     * retry to the next leg timeout sweep; zero retries at once.
     */
    @NotNull
    private Duration unwindRetryDelay = Duration.ofMillis(100);

    /**
     * Largest relative difference between the filled LONG and SHORT totals for which a fully
     * filled hedge is accepted as OPEN. Anything wider is unwound.
     */
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal hedgeSizeTolerance = new BigDecimal("0.05");

    /** Cooldown after a failed hedge or a pair halt when the pair configures none. */
    @NotNull
    private Duration failureCooldown = Duration.ofMinutes(5);

    /** Order updates that match no known order are dropped after this long. */
    @NotNull
    private Duration unmatchedUpdateTtl = Duration.ofMinutes(1);

    /** Capacity of the in-memory risk event log. */
    @Min(1)
    private int riskEventLogCapacity = 500;

    /** Fraction of a daily loss limit at which a warning event is emitted. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal dailyLossWarningThreshold = new BigDecimal("0.8");

    /** Threads evaluating pairs concurrently on each tick. */
    @Min(1)
    private int pairEvaluationThreads = 4;
}
