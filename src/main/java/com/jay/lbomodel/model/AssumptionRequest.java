package com.jay.lbomodel.model;

import lombok.Data;

/**
 * Partial deal inputs posted to the API. Any field left null falls back to the
 * configured base case. Percentages are whole numbers; tax rate is a fraction.
 */
@Data
public class AssumptionRequest {
    private String companyName;
    private Integer entryYear;
    private Integer exitYear;
    private Double revenueEntry;
    private Double ebitdaMarginEntryPct;
    private Double revenueGrowthPct;
    private Double ebitdaMarginExitPct;
    private Double capexPct;
    private Double dso;
    private Double dpo;
    private Double dsi;
    private Double purchasePriceMultiple;
    private Double debtPct;
    private Double interestRatePct;
    private Integer amortizationYears;
    private Double taxRate;
    private Double exitMultiple;
}
