package com.jay.lbomodel.model;

/**
 * One year of the simplified balance sheet.
 * Equity is entry equity plus cumulative LFCF, a retained-value proxy rather than a full roll-forward.
 */
public record BalanceSheetLine(
    int year,
    double debtBalance,
    double equityBalance,
    double enterpriseValue,
    double impliedEvEbitda
) {}
