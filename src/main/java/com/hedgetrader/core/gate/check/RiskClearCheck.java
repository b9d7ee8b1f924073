package com.hedgetrader.core.gate.check;

import com.hedgetrader.core.gate.AdmissionCheck;
import com.hedgetrader.core.gate.AdmissionContext;
import com.hedgetrader.core.gate.CheckResult;
import com.hedgetrader.domain.enums.GateCondition;
import com.hedgetrader.risk.RiskManager;
import com.hedgetrader.risk.RiskValidationResult;
import org.springframework.stereotype.Component;

@Component
public class RiskClearCheck implements AdmissionCheck {

    private final RiskManager riskManager;

    public RiskClearCheck(RiskManager riskManager) {
        this.riskManager = riskManager;
    }

    @Override
    public GateCondition condition() {
        return GateCondition.RISK_CLEAR;
    }

    @Override
    public CheckResult check(AdmissionContext context) {
        RiskValidationResult result = riskManager.validateAdmission(context.getPair(), context.getSelectedAccounts());
        return result.isApproved() ? CheckResult.pass() : CheckResult.fail(result.describe());
    }
}
