package com.jay.lbomodel.layer1_assumptions;

import com.jay.lbomodel.config.ModelConfig;
import com.jay.lbomodel.model.AssumptionRequest;
import com.jay.lbomodel.model.AssumptionSet;
import com.jay.lbomodel.model.SensitivityRanges;
import com.jay.lbomodel.model.SensitivityRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Layer 1 — Assumption intake.
 * Turns the configured base case, optionally overlaid with a partial API request,
 * into a validated AssumptionSet. Validation itself lives in AssumptionSet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssumptionFactory {

    private final ModelConfig config;

    /** The base case exactly as configured in config.yaml. */
    public AssumptionSet baseCase() {
        return fromRequest(null);
    }

    /** Base case with every non-null field of the request applied on top. */
    public AssumptionSet fromRequest(AssumptionRequest request) {
        ModelConfig.Deal d = config.deal();
        AssumptionRequest r = request != null ? request : new AssumptionRequest();

        AssumptionSet set = AssumptionSet.builder()
            .companyName(or(r.getCompanyName(), d.getCompanyName()))
            .entryYear(or(r.getEntryYear(), d.getEntryYear()))
            .exitYear(or(r.getExitYear(), d.getExitYear()))
            .revenueEntry(or(r.getRevenueEntry(), d.getRevenueEntry()))
            .ebitdaMarginEntryPct(or(r.getEbitdaMarginEntryPct(), d.getEbitdaMarginEntryPct()))
            .revenueGrowthPct(or(r.getRevenueGrowthPct(), d.getRevenueGrowthPct()))
            .ebitdaMarginExitPct(or(r.getEbitdaMarginExitPct(), d.getEbitdaMarginExitPct()))
            .capexPct(or(r.getCapexPct(), d.getCapexPct()))
            .dso(or(r.getDso(), d.getDso()))
            .dpo(or(r.getDpo(), d.getDpo()))
            .dsi(or(r.getDsi(), d.getDsi()))
            .purchasePriceMultiple(or(r.getPurchasePriceMultiple(), d.getPurchasePriceMultiple()))
            .debtPct(or(r.getDebtPct(), d.getDebtPct()))
            .interestRatePct(or(r.getInterestRatePct(), d.getInterestRatePct()))
            .amortizationYears(or(r.getAmortizationYears(), d.getAmortizationYears()))
            .taxRate(or(r.getTaxRate(), d.getTaxRate()))
            .exitMultiple(r.getExitMultiple() != null ? r.getExitMultiple() : d.getExitMultiple())
            .build();

        log.debug("Assumptions built for {}: {}", set.getCompanyName(), set);
        return set;
    }

    /** Explicit sweep ranges, filling any list the request leaves out with the configured ladder. */
    public SensitivityRanges rangesFor(AssumptionSet base, SensitivityRequest request) {
        ModelConfig.Sensitivity s = config.sensitivity();
        SensitivityRanges defaults = SensitivityRanges.around(base, s.getStep(), s.getPointsEachSide());
        if (request == null) return defaults;
        return new SensitivityRanges(
            nonEmpty(request.getExitMultiples(), defaults.exitMultiples()),
            nonEmpty(request.getRevenueGrowthPcts(), defaults.revenueGrowthPcts()),
            nonEmpty(request.getExitMarginPcts(), defaults.exitMarginPcts()));
    }

    private static <T> T or(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static List<Double> nonEmpty(List<Double> values, List<Double> fallback) {
        return values != null && !values.isEmpty() ? values : fallback;
    }
}
