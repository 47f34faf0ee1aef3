package com.jay.lbomodel.model;

/** One year of the projected income statement. Margin is a fraction. */
public record IncomeStatementLine(
    int year,
    double revenue,
    double ebitdaMargin,
    double ebitda,
    double depreciation,
    double ebit,
    double interestExpense,
    double ebt,
    double tax,
    double netIncome
) {}
