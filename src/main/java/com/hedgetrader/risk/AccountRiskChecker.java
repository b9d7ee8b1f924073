package com.hedgetrader.risk;

import com.hedgetrader.domain.model.Account;
import com.hedgetrader.domain.model.AccountRiskLimits;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Account-tier risk checks: daily loss limit and minimum balance.
 *
 * <p>Stateless. Counters live on the account snapshots passed in, so every check reflects
 * the registry state at the moment the snapshot was taken.
 */
@Component
public class AccountRiskChecker {

    /**
     * Validates an account that would join a new hedge. All checks are evaluated.
     *
     * @return violations, empty if the account may trade
     */
    public List<RiskViolation> validate(Account account) {
        List<RiskViolation> violations = new ArrayList<>();

        if (account.isLocked()) {
            violations.add(RiskViolation.of(
                    "ACCOUNT_LOCKED", "Account " + account.getAddress() + " is locked: " + account.getLockReason()));
        }

        if (dailyLossStatus(account, null) == LimitStatus.BREACHED) {
            violations.add(RiskViolation.of(
                    "ACCOUNT_DAILY_LOSS_LIMIT",
                    "Account " + account.getAddress() + " daily loss " + account.getDailyLoss() + " reached limit "
                            + account.getRiskLimits().getMaxDailyLoss()));
        }

        if (isBelowMinBalance(account)) {
            violations.add(RiskViolation.of(
                    "ACCOUNT_MIN_BALANCE",
                    "Account " + account.getAddress() + " balance " + account.getBalance() + " below minimum "
                            + account.getRiskLimits().getMinBalance()));
        }

        return violations;
    }

    public LimitStatus dailyLossStatus(Account account, BigDecimal warningThreshold) {
        AccountRiskLimits limits = account.getRiskLimits();
        return LimitStatus.of(account.getDailyLoss(), limits.getMaxDailyLoss(), warningThreshold);
    }

    public boolean isBelowMinBalance(Account account) {
        BigDecimal minBalance = account.getRiskLimits().getMinBalance();
        return minBalance != null && account.getBalance().compareTo(minBalance) < 0;
    }
}
