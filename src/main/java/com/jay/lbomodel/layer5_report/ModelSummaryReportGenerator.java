package com.jay.lbomodel.layer5_report;

import com.jay.lbomodel.model.AssumptionSet;
import com.jay.lbomodel.model.BalanceSheetLine;
import com.jay.lbomodel.model.CashFlowLine;
import com.jay.lbomodel.model.IncomeStatementLine;
import com.jay.lbomodel.model.ProjectionResult;
import com.jay.lbomodel.model.ReturnMetrics;
import com.jay.lbomodel.model.SensitivityReport;
import com.jay.lbomodel.model.SensitivityRow;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * Layer 5 — Model Summary Report.
 * Plain-text rendering of a projection: deal summary, return metrics, the three
 * statements, and optional sensitivity tables. Amounts are in $ millions, US number format.
 */
@Component
public class ModelSummaryReportGenerator {

    private static final String DIVIDER =
        "━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━";

    public String summary(ProjectionResult result) {
        AssumptionSet a = result.assumptions();
        ReturnMetrics r = result.returns();
        IncomeStatementLine exit = result.exitYear().income();

        StringBuilder sb = new StringBuilder();
        sb.append("LBO MODEL SUMMARY  —  ").append(a.getCompanyName()).append("\n");
        sb.append(DIVIDER).append("\n");
        sb.append(String.format(Locale.US, "ENTRY YEAR        :  %d%n", a.getEntryYear()));
        sb.append(String.format(Locale.US, "EXIT YEAR         :  %d%n", a.getExitYear()));
        sb.append(String.format(Locale.US, "HOLDING PERIOD    :  %d years%n", a.getHoldingPeriod()));
        sb.append(DIVIDER).append("\n");
        sb.append(String.format(Locale.US, "ENTRY EBITDA      :  $%,.2fM%n", a.getEntryEbitda()));
        sb.append(String.format(Locale.US, "PURCHASE PRICE    :  $%,.2fM  (%.1fx EBITDA)%n",
            a.getPurchasePrice(), a.getPurchasePriceMultiple()));
        sb.append(String.format(Locale.US, "DEBT              :  $%,.2fM  (%.1f%%)%n",
            a.getDebtAmount(), a.getDebtPercentage() * 100));
        sb.append(String.format(Locale.US, "EQUITY            :  $%,.2fM  (%.1f%%)%n",
            a.getEquityAmount(), (1 - a.getDebtPercentage()) * 100));
        sb.append(DIVIDER).append("\n");
        sb.append(String.format(Locale.US, "EXIT EBITDA       :  $%,.2fM%n", exit.ebitda()));
        sb.append(String.format(Locale.US, "EXIT EBITDA MARGIN:  %.1f%%%n", exit.ebitdaMargin() * 100));
        sb.append(String.format(Locale.US, "EXIT EV           :  $%,.2fM  (%.1fx EBITDA)%n",
            r.exitEnterpriseValue(), a.getExitMultiple()));
        sb.append(String.format(Locale.US, "EXIT EQUITY       :  $%,.2fM%n", r.exitEquityValue()));
        sb.append(DIVIDER).append("\n");
        sb.append(String.format(Locale.US, "IRR               :  %.1f%%%n", r.irr()));
        sb.append(String.format(Locale.US, "MOIC              :  %.2fx%n", r.moic()));
        sb.append(String.format(Locale.US, "DPI               :  %.2fx%n", r.dpi()));
        sb.append(String.format(Locale.US, "TVPI              :  %.2fx%n", r.tvpi()));
        sb.append(DIVIDER).append("\n");
        return sb.toString();
    }

    public String statements(ProjectionResult result) {
        List<Integer> years = result.assumptions().getYears();
        StringBuilder sb = new StringBuilder();

        List<IncomeStatementLine> is = result.incomeStatement();
        sb.append("INCOME STATEMENT\n").append(header(years));
        row(sb, "Revenue", is, IncomeStatementLine::revenue);
        row(sb, "EBITDA Margin %", is, l -> l.ebitdaMargin() * 100);
        row(sb, "EBITDA", is, IncomeStatementLine::ebitda);
        row(sb, "Depreciation", is, IncomeStatementLine::depreciation);
        row(sb, "EBIT", is, IncomeStatementLine::ebit);
        row(sb, "Interest Expense", is, IncomeStatementLine::interestExpense);
        row(sb, "EBT", is, IncomeStatementLine::ebt);
        row(sb, "Tax", is, IncomeStatementLine::tax);
        row(sb, "Net Income", is, IncomeStatementLine::netIncome);

        List<CashFlowLine> cf = result.cashFlowStatement();
        sb.append("\nCASH FLOW\n").append(header(years));
        row(sb, "Net Income", cf, CashFlowLine::netIncome);
        row(sb, "D&A", cf, CashFlowLine::depreciationAndAmortization);
        row(sb, "ΔWC", cf, CashFlowLine::workingCapitalChange);
        row(sb, "Capex", cf, CashFlowLine::capex);
        row(sb, "Debt Amortization", cf, CashFlowLine::debtAmortization);
        row(sb, "Interest Paid", cf, CashFlowLine::interestPaid);
        row(sb, "FCF", cf, CashFlowLine::fcf);
        row(sb, "LFCF", cf, CashFlowLine::lfcf);
        row(sb, "Cumulative LFCF", cf, CashFlowLine::cumulativeLfcf);

        List<BalanceSheetLine> bs = result.balanceSheet();
        sb.append("\nBALANCE SHEET\n").append(header(years));
        row(sb, "Debt", bs, BalanceSheetLine::debtBalance);
        row(sb, "Equity", bs, BalanceSheetLine::equityBalance);
        row(sb, "Enterprise Value", bs, BalanceSheetLine::enterpriseValue);
        row(sb, "Implied EV/EBITDA", bs, BalanceSheetLine::impliedEvEbitda);
        return sb.toString();
    }

    public String sensitivity(SensitivityReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("SENSITIVITY  —  ").append(report.companyName()).append("\n");
        table(sb, "Exit Multiple", "%.1fx", report.exitMultiple());
        table(sb, "Growth Rate", "%.1f%%", report.revenueGrowth());
        table(sb, "Exit Margin", "%.1f%%", report.exitEbitdaMargin());
        return sb.toString();
    }

    public String fullReport(ProjectionResult result, SensitivityReport sensitivity) {
        StringBuilder sb = new StringBuilder(summary(result)).append("\n").append(statements(result));
        if (sensitivity != null) {
            sb.append("\n").append(sensitivity(sensitivity));
        }
        return sb.toString();
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private static String header(List<Integer> years) {
        StringBuilder sb = new StringBuilder(String.format(Locale.US, "%-20s", ""));
        years.forEach(y -> sb.append(String.format(Locale.US, "%12d", y)));
        return sb.append("\n").toString();
    }

    private static <T> void row(StringBuilder sb, String label, List<T> lines, ToDoubleFunction<T> field) {
        sb.append(String.format(Locale.US, "%-20s", label));
        lines.forEach(l -> sb.append(String.format(Locale.US, "%,12.2f", field.applyAsDouble(l))));
        sb.append("\n");
    }

    private static void table(StringBuilder sb, String label, String valueFormat, List<SensitivityRow> rows) {
        sb.append(DIVIDER).append("\n");
        sb.append(String.format(Locale.US, "%-14s%10s%10s%n", label, "IRR", "MOIC"));
        for (SensitivityRow r : rows) {
            sb.append(String.format(Locale.US, "%-14s%9.1f%%%9.2fx%n",
                String.format(Locale.US, valueFormat, r.value()), r.irr(), r.moic()));
        }
    }
}
