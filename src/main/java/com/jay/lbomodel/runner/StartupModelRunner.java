package com.jay.lbomodel.runner;

import com.jay.lbomodel.config.ModelConfig;
import com.jay.lbomodel.exception.LboModelException;
import com.jay.lbomodel.layer1_assumptions.AssumptionFactory;
import com.jay.lbomodel.layer2_projection.ProjectionEngine;
import com.jay.lbomodel.layer4_sensitivity.SensitivityRunner;
import com.jay.lbomodel.layer5_report.ModelSummaryReportGenerator;
import com.jay.lbomodel.model.AssumptionSet;
import com.jay.lbomodel.model.ProjectionResult;
import com.jay.lbomodel.model.SensitivityReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Runs the configured base case once at startup and logs the full report.
 * Disabled with report.print_on_startup: false.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupModelRunner implements CommandLineRunner {

    private final ModelConfig config;
    private final AssumptionFactory assumptionFactory;
    private final ProjectionEngine projectionEngine;
    private final SensitivityRunner sensitivityRunner;
    private final ModelSummaryReportGenerator reportGenerator;

    @Override
    public void run(String... args) {
        if (!config.report().isPrintOnStartup()) {
            log.debug("Startup report disabled");
            return;
        }
        try {
            AssumptionSet base = assumptionFactory.baseCase();
            ProjectionResult result = projectionEngine.run(base);
            SensitivityReport sensitivity = sensitivityRunner.run(base, assumptionFactory.rangesFor(base, null));
            log.info("\n{}", reportGenerator.fullReport(result, sensitivity));
        } catch (LboModelException e) {
            // A bad base case should not stop the API from serving ad-hoc runs
            log.error("Base-case model failed [{}]: {}", e.getErrorCode(), e.getMessage());
        }
    }
}
