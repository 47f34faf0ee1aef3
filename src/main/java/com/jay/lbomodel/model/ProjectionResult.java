package com.jay.lbomodel.model;

import java.util.List;

/**
 * Full output of one engine run: the year-ordered statements plus return metrics.
 * This is everything the report generator and the sensitivity runner read.
 */
public record ProjectionResult(
    AssumptionSet assumptions,
    List<YearRecord> years,
    ReturnMetrics returns
) {

    public List<IncomeStatementLine> incomeStatement() {
        return years.stream().map(YearRecord::income).toList();
    }

    public List<CashFlowLine> cashFlowStatement() {
        return years.stream().map(YearRecord::cashFlow).toList();
    }

    public List<BalanceSheetLine> balanceSheet() {
        return years.stream().map(YearRecord::balanceSheet).toList();
    }

    public YearRecord exitYear() {
        return years.get(years.size() - 1);
    }
}
