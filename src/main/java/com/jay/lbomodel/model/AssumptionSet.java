package com.jay.lbomodel.model;

import com.jay.lbomodel.exception.InvalidAssumptionException;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Validated, immutable inputs for one model run.
 *
 * The builder takes percentages as whole numbers (25 means 25%) and the tax rate as a
 * fraction. Percentages are normalised to fractions on construction; day counts and
 * multiples are stored unchanged. Entry EBITDA, purchase price, the debt/equity split
 * and the year timeline are derived once here.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class AssumptionSet {

    public static final double DEFAULT_TAX_RATE = 0.21;

    // ── Identifiers ───────────────────────────────────────────────────────────
    private final String companyName;
    private final int entryYear;
    private final int exitYear;

    // ── Raw inputs (as supplied) ──────────────────────────────────────────────
    private final double revenueEntry;
    private final double ebitdaMarginEntryPct;
    private final double revenueGrowthPct;
    private final double ebitdaMarginExitPct;
    private final double capexPct;
    private final double dso;
    private final double dpo;
    private final double dsi;
    private final double purchasePriceMultiple;
    private final double debtPct;
    private final double interestRatePct;
    private final int amortizationYears;
    private final double taxRate;
    @Getter(AccessLevel.NONE)
    private final Double exitMultiple;

    // ── Normalised fractions ──────────────────────────────────────────────────
    private final double ebitdaMarginEntry;
    private final double revenueGrowth;
    private final double ebitdaMarginExit;
    private final double capexPercent;
    private final double debtPercentage;
    private final double interestRate;

    // ── Derived ───────────────────────────────────────────────────────────────
    private final double entryEbitda;
    private final double purchasePrice;
    private final double debtAmount;
    private final double equityAmount;
    private final int holdingPeriod;
    private final List<Integer> years;

    @Builder(toBuilder = true)
    private AssumptionSet(String companyName, int entryYear, int exitYear, double revenueEntry,
                          double ebitdaMarginEntryPct, double revenueGrowthPct, double ebitdaMarginExitPct,
                          double capexPct, double dso, double dpo, double dsi,
                          double purchasePriceMultiple, double debtPct, double interestRatePct,
                          int amortizationYears, Double taxRate, Double exitMultiple) {
        if (companyName == null || companyName.isBlank()) {
            throw new InvalidAssumptionException("Company name is required");
        }
        // Also guarantees a holding period of at least one year
        if (exitYear <= entryYear) {
            throw new InvalidAssumptionException(String.format(
                "Exit year %d must be after entry year %d", exitYear, entryYear));
        }
        if (!(revenueEntry > 0)) {
            throw new InvalidAssumptionException(String.format("Entry revenue must be positive, was %.2f", revenueEntry));
        }
        if (amortizationYears <= 0) {
            throw new InvalidAssumptionException(String.format(
                "Amortization years must be positive, was %d", amortizationYears));
        }
        if (!(purchasePriceMultiple > 0)) {
            throw new InvalidAssumptionException(String.format(
                "Purchase price multiple must be positive, was %.2f", purchasePriceMultiple));
        }
        if (debtPct < 0 || debtPct > 100) {
            throw new InvalidAssumptionException(String.format("Debt %% must be within [0, 100], was %.2f", debtPct));
        }
        if (dso < 0 || dpo < 0 || dsi < 0) {
            throw new InvalidAssumptionException(String.format(
                "Working-capital day counts must be non-negative (DSO=%.1f, DPO=%.1f, DSI=%.1f)", dso, dpo, dsi));
        }
        if (exitMultiple != null && !(exitMultiple > 0)) {
            throw new InvalidAssumptionException(String.format("Exit multiple must be positive, was %.2f", exitMultiple));
        }

        this.companyName = companyName;
        this.entryYear = entryYear;
        this.exitYear = exitYear;
        this.revenueEntry = revenueEntry;
        this.ebitdaMarginEntryPct = ebitdaMarginEntryPct;
        this.revenueGrowthPct = revenueGrowthPct;
        this.ebitdaMarginExitPct = ebitdaMarginExitPct;
        this.capexPct = capexPct;
        this.dso = dso;
        this.dpo = dpo;
        this.dsi = dsi;
        this.purchasePriceMultiple = purchasePriceMultiple;
        this.debtPct = debtPct;
        this.interestRatePct = interestRatePct;
        this.amortizationYears = amortizationYears;
        this.taxRate = taxRate != null ? taxRate : DEFAULT_TAX_RATE;
        this.exitMultiple = exitMultiple;

        this.ebitdaMarginEntry = ebitdaMarginEntryPct / 100;
        this.revenueGrowth = revenueGrowthPct / 100;
        this.ebitdaMarginExit = ebitdaMarginExitPct / 100;
        this.capexPercent = capexPct / 100;
        this.debtPercentage = debtPct / 100;
        this.interestRate = interestRatePct / 100;

        this.entryEbitda = revenueEntry * ebitdaMarginEntry;
        this.purchasePrice = entryEbitda * purchasePriceMultiple;
        this.debtAmount = purchasePrice * debtPercentage;
        this.equityAmount = purchasePrice - debtAmount;
        this.holdingPeriod = exitYear - entryYear;
        this.years = IntStream.rangeClosed(entryYear, exitYear).boxed().toList();
    }

    /** Multiple applied to exit-year EBITDA; the purchase multiple unless one was set explicitly. */
    public double getExitMultiple() {
        return exitMultiple != null ? exitMultiple : purchasePriceMultiple;
    }

    public int getNumYears() {
        return years.size();
    }

    /** Fixed principal repayment per year. */
    public double getAnnualInstallment() {
        return debtAmount / amortizationYears;
    }
}
