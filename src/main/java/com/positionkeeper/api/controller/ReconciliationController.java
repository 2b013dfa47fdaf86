package com.positionkeeper.api.controller;

import com.positionkeeper.core.engine.CycleReport;
import com.positionkeeper.core.engine.PositionCycleEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual cycle trigger.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/reconciliation/run -- runs one full cycle under the cycle lock</li>
 *   <li>GET /api/reconciliation/last -- report of the most recent cycle</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationController.class);

    private final PositionCycleEngine positionCycleEngine;

    public ReconciliationController(PositionCycleEngine positionCycleEngine) {
        this.positionCycleEngine = positionCycleEngine;
    }

    @PostMapping("/run")
    public ResponseEntity<CycleReport> run() {
        log.info("Manual cycle triggered");
        return ResponseEntity.ok(positionCycleEngine.runCycle("MANUAL", true));
    }

    @GetMapping("/last")
    public ResponseEntity<CycleReport> last() {
        CycleReport report = positionCycleEngine.getLastReport();
        return report != null ? ResponseEntity.ok(report) : ResponseEntity.noContent().build();
    }
}
