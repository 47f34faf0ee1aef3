package com.jay.lbomodel.model;

/** The three statement lines for a single projection year. */
public record YearRecord(
    int year,
    IncomeStatementLine income,
    CashFlowLine cashFlow,
    BalanceSheetLine balanceSheet
) {}
