package com.jay.lbomodel.layer4_sensitivity;

import com.jay.lbomodel.LboFixtures;
import com.jay.lbomodel.config.ModelConfig;
import com.jay.lbomodel.exception.InvalidAssumptionException;
import com.jay.lbomodel.model.AssumptionSet;
import com.jay.lbomodel.model.SensitivityRanges;
import com.jay.lbomodel.model.SensitivityReport;
import com.jay.lbomodel.model.SensitivityRow;
import com.jay.lbomodel.model.enums.SensitivityDimension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jay.lbomodel.LboFixtures.acme;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SensitivityRunner")
class SensitivityRunnerTest {

    private ModelConfig config;
    private SensitivityRunner runner;
    private AssumptionSet base;

    @BeforeEach
    void setUp() {
        config = new ModelConfig();
        runner = new SensitivityRunner(LboFixtures.engine(), config);
        base = acme().build();
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    @Test
    @DisplayName("Default ranges should be base ± 2 steps for each dimension")
    void defaultRangesBracketTheBaseCase() {
        SensitivityRanges ranges = SensitivityRanges.around(base, 1.0, 2);

        assertThat(ranges.exitMultiples()).containsExactly(8.0, 9.0, 10.0, 11.0, 12.0);
        assertThat(ranges.revenueGrowthPcts()).containsExactly(6.0, 7.0, 8.0, 9.0, 10.0);
        assertThat(ranges.exitMarginPcts()).containsExactly(28.0, 29.0, 30.0, 31.0, 32.0);
    }

    @Test
    @DisplayName("Default exit-multiple ladder should skip non-positive multiples for a low-multiple deal")
    void lowMultipleDealSweepsOnlyPositiveMultiples() {
        AssumptionSet cheap = acme().purchasePriceMultiple(1.5).debtPct(0).build();
        SensitivityRanges ranges = SensitivityRanges.around(cheap, 1.0, 2);

        SensitivityReport report = runner.run(cheap, ranges);

        assertThat(ranges.exitMultiples()).containsExactly(0.5, 1.5, 2.5, 3.5);
        assertThat(report.exitMultiple()).extracting(SensitivityRow::value)
            .containsExactly(0.5, 1.5, 2.5, 3.5);
        assertThat(report.exitMultiple().get(0).irr()).isCloseTo(48.02674074761707, within(1e-6));
        assertThat(report.revenueGrowth()).hasSize(5);
        assertThat(report.exitEbitdaMargin()).hasSize(5);
    }

    @Test
    @DisplayName("Should return one row per value, in input order, for every dimension")
    void shouldReturnRowsInInputOrder() {
        SensitivityReport report = runner.run(base, SensitivityRanges.around(base, 1.0, 2));

        assertThat(report.companyName()).isEqualTo("Acme Corp");
        assertThat(report.exitMultiple()).extracting(SensitivityRow::value)
            .containsExactly(8.0, 9.0, 10.0, 11.0, 12.0);
        assertThat(report.revenueGrowth()).extracting(SensitivityRow::value)
            .containsExactly(6.0, 7.0, 8.0, 9.0, 10.0);
        assertThat(report.exitEbitdaMargin()).extracting(SensitivityRow::value)
            .containsExactly(28.0, 29.0, 30.0, 31.0, 32.0);
    }

    @Test
    @DisplayName("Exit multiple sweep should run the full engine, keeping interim cash flows")
    void exitMultipleSweepMatchesFullRuns() {
        List<SensitivityRow> rows = runner.sweep(base, SensitivityDimension.EXIT_MULTIPLE, List.of(8.0, 10.0, 12.0));

        assertThat(rows.get(0).irr()).isCloseTo(18.031349200087053, within(1e-6));
        assertThat(rows.get(0).moic()).isCloseTo(3.52638738432, within(1e-9));
        assertThat(rows.get(1).irr()).isCloseTo(24.212350286796745, within(1e-6));
        assertThat(rows.get(2).irr()).isCloseTo(29.443843115342684, within(1e-6));
    }

    @Test
    @DisplayName("IRR and MOIC should rise with exit multiple, growth and exit margin")
    void returnsRiseWithEachDriver() {
        SensitivityReport report = runner.run(base, SensitivityRanges.around(base, 1.0, 2));

        for (List<SensitivityRow> rows : List.of(report.exitMultiple(), report.revenueGrowth(), report.exitEbitdaMargin())) {
            for (int i = 1; i < rows.size(); i++) {
                assertThat(rows.get(i).irr()).isGreaterThan(rows.get(i - 1).irr());
                assertThat(rows.get(i).moic()).isGreaterThan(rows.get(i - 1).moic());
            }
        }
        assertThat(report.revenueGrowth().get(4).irr()).isCloseTo(27.207744905733577, within(1e-6));
        assertThat(report.exitEbitdaMargin().get(3).irr()).isCloseTo(25.33755469795714, within(1e-6));
    }

    @Test
    @DisplayName("Results should not depend on the worker pool size")
    void resultsIndependentOfParallelism() {
        config.sensitivity().setParallelism(1);
        SensitivityRunner sequential = new SensitivityRunner(LboFixtures.engine(), config);
        try {
            SensitivityRanges ranges = SensitivityRanges.around(base, 0.5, 4);
            assertThat(runner.run(base, ranges)).isEqualTo(sequential.run(base, ranges));
        } finally {
            sequential.shutdown();
        }
    }

    @Test
    @DisplayName("Perturbing one dimension should leave the rest of the deal untouched")
    void perturbChangesOnlyOneField() {
        AssumptionSet faster = SensitivityRunner.perturb(base, SensitivityDimension.REVENUE_GROWTH, 11.0);

        assertThat(faster.getRevenueGrowthPct()).isEqualTo(11.0);
        assertThat(faster.toBuilder().revenueGrowthPct(8).build()).isEqualTo(base);
    }

    @Test
    @DisplayName("A failing point should fail the whole sweep")
    void failingPointFailsSweep() {
        assertThatThrownBy(() -> runner.sweep(base, SensitivityDimension.EXIT_MULTIPLE, List.of(10.0, -1.0)))
            .isInstanceOf(InvalidAssumptionException.class)
            .hasMessageContaining("Exit multiple");
    }
}
