package com.hedgetrader.core.gate;

/** Outcome of one admission check: pass, or fail with a reason. */
public record CheckResult(boolean passed, String reason) {

    private static final CheckResult PASS = new CheckResult(true, null);

    public static CheckResult pass() {
        return PASS;
    }

    public static CheckResult fail(String reason) {
        return new CheckResult(false, reason);
    }
}
