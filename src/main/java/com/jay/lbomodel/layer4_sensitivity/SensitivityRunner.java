package com.jay.lbomodel.layer4_sensitivity;

import com.jay.lbomodel.config.ModelConfig;
import com.jay.lbomodel.exception.LboModelException;
import com.jay.lbomodel.layer2_projection.ProjectionEngine;
import com.jay.lbomodel.model.AssumptionSet;
import com.jay.lbomodel.model.ProjectionResult;
import com.jay.lbomodel.model.SensitivityRanges;
import com.jay.lbomodel.model.SensitivityReport;
import com.jay.lbomodel.model.SensitivityRow;
import com.jay.lbomodel.model.enums.SensitivityDimension;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Layer 4 — Sensitivity Runner.
 * Re-runs the projection engine once per swept value, changing a single assumption
 * and holding everything else at the base case. Points are independent and run on a
 * small worker pool; rows come back in the order the values were given.
 * A failure at any point fails the whole sweep.
 */
@Slf4j
@Service
public class SensitivityRunner {

    private final ProjectionEngine engine;
    private final ExecutorService executor;

    public SensitivityRunner(ProjectionEngine engine, ModelConfig config) {
        this.engine = engine;
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.sensitivity().getParallelism()));
    }

    public SensitivityReport run(AssumptionSet base, SensitivityRanges ranges) {
        SensitivityReport report = new SensitivityReport(
            base.getCompanyName(),
            sweep(base, SensitivityDimension.EXIT_MULTIPLE, ranges.exitMultiples()),
            sweep(base, SensitivityDimension.REVENUE_GROWTH, ranges.revenueGrowthPcts()),
            sweep(base, SensitivityDimension.EXIT_EBITDA_MARGIN, ranges.exitMarginPcts()));
        log.info("Sensitivity sweep complete for {}: {} exit-multiple, {} growth, {} margin points",
            base.getCompanyName(), report.exitMultiple().size(),
            report.revenueGrowth().size(), report.exitEbitdaMargin().size());
        return report;
    }

    public List<SensitivityRow> sweep(AssumptionSet base, SensitivityDimension dimension, List<Double> values) {
        List<CompletableFuture<SensitivityRow>> futures = values.stream()
            .map(value -> CompletableFuture.supplyAsync(() -> evaluate(base, dimension, value), executor))
            .toList();
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(false));
            if (e.getCause() instanceof LboModelException modelError) {
                throw modelError;
            }
            throw e;
        }
    }

    private SensitivityRow evaluate(AssumptionSet base, SensitivityDimension dimension, double value) {
        ProjectionResult result = engine.run(perturb(base, dimension, value));
        log.debug("{} = {} → IRR {}%, MOIC {}x", dimension, value, result.returns().irr(), result.returns().moic());
        return new SensitivityRow(value, result.returns().irr(), result.returns().moic());
    }

    static AssumptionSet perturb(AssumptionSet base, SensitivityDimension dimension, double value) {
        AssumptionSet.AssumptionSetBuilder builder = base.toBuilder();
        switch (dimension) {
            case EXIT_MULTIPLE -> builder.exitMultiple(value);
            case REVENUE_GROWTH -> builder.revenueGrowthPct(value);
            case EXIT_EBITDA_MARGIN -> builder.ebitdaMarginExitPct(value);
        }
        return builder.build();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
