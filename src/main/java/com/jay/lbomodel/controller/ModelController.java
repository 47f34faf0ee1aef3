package com.jay.lbomodel.controller;

import com.jay.lbomodel.layer1_assumptions.AssumptionFactory;
import com.jay.lbomodel.layer2_projection.ProjectionEngine;
import com.jay.lbomodel.layer4_sensitivity.SensitivityRunner;
import com.jay.lbomodel.layer5_report.ModelSummaryReportGenerator;
import com.jay.lbomodel.model.AssumptionRequest;
import com.jay.lbomodel.model.AssumptionSet;
import com.jay.lbomodel.model.ProjectionResult;
import com.jay.lbomodel.model.SensitivityReport;
import com.jay.lbomodel.model.SensitivityRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API — LBO model runs.
 *
 * Endpoints:
 *   GET  /api/model/base          — Configured base case, full statements + returns
 *   GET  /api/model/base/summary  — Base case as a plain-text report
 *   POST /api/model/run           — Run with request fields overriding the base case
 *   POST /api/model/sensitivity   — Exit multiple / growth / exit margin sweeps
 */
@Slf4j
@RestController
@RequestMapping("/api/model")
@RequiredArgsConstructor
public class ModelController {

    private final AssumptionFactory assumptionFactory;
    private final ProjectionEngine projectionEngine;
    private final SensitivityRunner sensitivityRunner;
    private final ModelSummaryReportGenerator reportGenerator;

    // ── GET /api/model/base ────────────────────────────────────────────────────

    @GetMapping("/base")
    public ResponseEntity<ProjectionResult> baseCase() {
        return ResponseEntity.ok(projectionEngine.run(assumptionFactory.baseCase()));
    }

    // ── GET /api/model/base/summary ────────────────────────────────────────────

    @GetMapping(value = "/base/summary", produces = "text/plain;charset=UTF-8")
    public ResponseEntity<String> baseCaseSummary() {
        ProjectionResult result = projectionEngine.run(assumptionFactory.baseCase());
        return ResponseEntity.ok(reportGenerator.fullReport(result, null));
    }

    // ── POST /api/model/run ────────────────────────────────────────────────────

    @PostMapping("/run")
    public ResponseEntity<ProjectionResult> run(@RequestBody(required = false) AssumptionRequest request) {
        AssumptionSet assumptions = assumptionFactory.fromRequest(request);
        log.info("Model run requested for {}", assumptions.getCompanyName());
        return ResponseEntity.ok(projectionEngine.run(assumptions));
    }

    // ── POST /api/model/sensitivity ────────────────────────────────────────────

    @PostMapping("/sensitivity")
    public ResponseEntity<SensitivityReport> sensitivity(@RequestBody(required = false) SensitivityRequest request) {
        AssumptionSet base = assumptionFactory.fromRequest(request != null ? request.getAssumptions() : null);
        log.info("Sensitivity sweep requested for {}", base.getCompanyName());
        return ResponseEntity.ok(sensitivityRunner.run(base, assumptionFactory.rangesFor(base, request)));
    }
}
