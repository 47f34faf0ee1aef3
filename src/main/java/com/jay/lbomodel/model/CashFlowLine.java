package com.jay.lbomodel.model;

/**
 * One year of the projected cash flow statement.
 * Outflows are negative: capex, debt amortization and interest paid are all ≤ 0.
 */
public record CashFlowLine(
    int year,
    double netIncome,
    double depreciationAndAmortization,
    double workingCapitalChange,
    double capex,
    double debtAmortization,
    double interestPaid,
    double fcf,                 // unlevered
    double lfcf,                // levered, after debt service
    double cumulativeLfcf
) {}
