package com.jay.lbomodel.model;

import com.jay.lbomodel.exception.InvalidAssumptionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.jay.lbomodel.LboFixtures.acme;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("AssumptionSet")
class AssumptionSetTest {

    @Test
    @DisplayName("Should derive purchase price and the debt/equity split from entry EBITDA")
    void shouldDeriveFinancingStructure() {
        AssumptionSet a = acme().build();

        assertThat(a.getEntryEbitda()).isCloseTo(125.0, within(1e-9));
        assertThat(a.getPurchasePrice()).isCloseTo(1250.0, within(1e-9));
        assertThat(a.getDebtAmount()).isCloseTo(750.0, within(1e-9));
        assertThat(a.getEquityAmount()).isCloseTo(500.0, within(1e-9));
        assertThat(a.getAnnualInstallment()).isCloseTo(150.0, within(1e-9));
    }

    @Test
    @DisplayName("Should normalise percentages but keep day counts, multiples and tax rate as given")
    void shouldNormalisePercentages() {
        AssumptionSet a = acme().build();

        assertThat(a.getEbitdaMarginEntry()).isEqualTo(0.25);
        assertThat(a.getEbitdaMarginExit()).isEqualTo(0.30);
        assertThat(a.getRevenueGrowth()).isEqualTo(0.08);
        assertThat(a.getCapexPercent()).isEqualTo(0.04);
        assertThat(a.getDebtPercentage()).isEqualTo(0.60);
        assertThat(a.getInterestRate()).isEqualTo(0.08);
        assertThat(a.getDso()).isEqualTo(45);
        assertThat(a.getPurchasePriceMultiple()).isEqualTo(10.0);
        assertThat(a.getTaxRate()).isEqualTo(AssumptionSet.DEFAULT_TAX_RATE);
    }

    @Test
    @DisplayName("Should build a contiguous year timeline from entry to exit")
    void shouldBuildTimeline() {
        AssumptionSet a = acme().build();

        assertThat(a.getHoldingPeriod()).isEqualTo(5);
        assertThat(a.getYears()).containsExactly(2023, 2024, 2025, 2026, 2027, 2028);
        assertThat(a.getNumYears()).isEqualTo(6);
    }

    @Test
    @DisplayName("Exit multiple should default to the purchase multiple")
    void exitMultipleDefaultsToPurchaseMultiple() {
        assertThat(acme().build().getExitMultiple()).isEqualTo(10.0);
        assertThat(acme().exitMultiple(12.5).build().getExitMultiple()).isEqualTo(12.5);
    }

    @Test
    @DisplayName("toBuilder should reproduce an equal set and allow a single field to change")
    void toBuilderShouldCopyRawInputs() {
        AssumptionSet base = acme().build();

        assertThat(base.toBuilder().build()).isEqualTo(base);

        AssumptionSet faster = base.toBuilder().revenueGrowthPct(10).build();
        assertThat(faster.getRevenueGrowth()).isEqualTo(0.10);
        assertThat(faster.getEbitdaMarginExit()).isEqualTo(base.getEbitdaMarginExit());
        assertThat(faster.getExitMultiple()).isEqualTo(base.getExitMultiple());
    }

    @Test
    @DisplayName("Should reject an exit year that is not after the entry year")
    void shouldRejectNonPositiveHoldingPeriod() {
        assertThatThrownBy(() -> acme().exitYear(2023).build())
            .isInstanceOf(InvalidAssumptionException.class)
            .hasMessageContaining("Exit year 2023");
        assertThatThrownBy(() -> acme().exitYear(2020).build())
            .isInstanceOf(InvalidAssumptionException.class);
    }

    @Test
    @DisplayName("Should reject non-positive amortization years and entry revenue")
    void shouldRejectNonPositiveInputs() {
        assertThatThrownBy(() -> acme().amortizationYears(0).build())
            .isInstanceOf(InvalidAssumptionException.class)
            .hasMessageContaining("Amortization");
        assertThatThrownBy(() -> acme().revenueEntry(0).build())
            .isInstanceOf(InvalidAssumptionException.class)
            .hasMessageContaining("revenue");
        assertThatThrownBy(() -> acme().revenueEntry(-10).build())
            .isInstanceOf(InvalidAssumptionException.class);
    }

    @Test
    @DisplayName("Should reject out-of-range financing and working-capital inputs")
    void shouldRejectOutOfRangeInputs() {
        assertThatThrownBy(() -> acme().purchasePriceMultiple(0).build())
            .isInstanceOf(InvalidAssumptionException.class);
        assertThatThrownBy(() -> acme().debtPct(120).build())
            .isInstanceOf(InvalidAssumptionException.class);
        assertThatThrownBy(() -> acme().dso(-1).build())
            .isInstanceOf(InvalidAssumptionException.class);
        assertThatThrownBy(() -> acme().exitMultiple(0.0).build())
            .isInstanceOf(InvalidAssumptionException.class);
        assertThatThrownBy(() -> acme().companyName(" ").build())
            .isInstanceOf(InvalidAssumptionException.class);
    }

    @Test
    @DisplayName("Should accept negative growth and margins outside [0, 100]")
    void shouldAllowNegativeGrowth() {
        AssumptionSet a = acme().revenueGrowthPct(-5).ebitdaMarginExitPct(-3).build();

        assertThat(a.getRevenueGrowth()).isEqualTo(-0.05);
        assertThat(a.getEbitdaMarginExit()).isEqualTo(-0.03);
    }
}
