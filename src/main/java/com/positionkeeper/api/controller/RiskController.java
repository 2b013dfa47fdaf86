package com.positionkeeper.api.controller;

import com.positionkeeper.core.engine.PositionCycleEngine;
import com.positionkeeper.risk.AccountRiskState;
import com.positionkeeper.risk.RiskLimits;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for risk state.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/risk/status -- balance, equity, drawdown, daily P&amp;L, mode, halt and suspension flags</li>
 *   <li>GET /api/risk/limits -- configured risk limits</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private final AccountRiskState accountRiskState;
    private final RiskLimits riskLimits;
    private final PositionCycleEngine positionCycleEngine;

    public RiskController(
            AccountRiskState accountRiskState, RiskLimits riskLimits, PositionCycleEngine positionCycleEngine) {
        this.accountRiskState = accountRiskState;
        this.riskLimits = riskLimits;
        this.positionCycleEngine = positionCycleEngine;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getRiskStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("balance", accountRiskState.getBalance());
        status.put("equity", accountRiskState.getEquity());
        status.put("peakEquity", accountRiskState.getPeakEquity());
        status.put("drawdown", accountRiskState.drawdown());
        status.put("dailyRealizedPnl", accountRiskState.getDailyRealizedPnl());
        status.put("dailyLimitBreached", accountRiskState.isDailyLimitBreached());
        status.put("losingStreak", accountRiskState.getLosingStreak());
        status.put("riskMode", accountRiskState.getCurrentMode());
        status.put("dispatchSuspended", positionCycleEngine.isDispatchSuspended());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/limits")
    public ResponseEntity<RiskLimits> getRiskLimits() {
        return ResponseEntity.ok(riskLimits);
    }
}
