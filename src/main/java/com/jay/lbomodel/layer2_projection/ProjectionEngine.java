package com.jay.lbomodel.layer2_projection;

import com.jay.lbomodel.exception.DegenerateHoldingPeriodException;
import com.jay.lbomodel.layer3_returns.ReturnSolver;
import com.jay.lbomodel.model.AssumptionSet;
import com.jay.lbomodel.model.BalanceSheetLine;
import com.jay.lbomodel.model.CashFlowLine;
import com.jay.lbomodel.model.IncomeStatementLine;
import com.jay.lbomodel.model.ProjectionResult;
import com.jay.lbomodel.model.ReturnMetrics;
import com.jay.lbomodel.model.YearRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 2 — Projection Engine.
 * Builds the income statement, cash flow statement and balance sheet for every year
 * from entry to exit, then derives sponsor returns.
 *
 * Each run is a pure function of its AssumptionSet: no shared state, no I/O.
 * Stages run in dependency order and only read earlier stages:
 *   1. revenue, margin, depreciation, EBIT
 *   2. income-statement debt schedule and interest
 *   3. EBT, tax, net income
 *   4. working-capital change
 *   5. cash flow (separate amortization schedule), FCF, LFCF
 *   6. balance sheet
 *   7. return metrics
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectionEngine {

    /** Depreciation is taken as 80% of the year's capex spend. Fixed convention, not configurable. */
    static final double DEPRECIATION_TO_CAPEX = 0.8;
    static final double DAYS_PER_YEAR = 365.0;

    private final ReturnSolver returnSolver;

    public ProjectionResult run(AssumptionSet a) {
        int n = a.getNumYears();
        List<Integer> years = a.getYears();

        // ── 1. Revenue & margin ───────────────────────────────────────────────
        double[] margin = interpolateMargins(a.getEbitdaMarginEntry(), a.getEbitdaMarginExit(), n);
        double[] revenue = new double[n];
        double[] ebitda = new double[n];
        double[] depreciation = new double[n];
        double[] ebit = new double[n];
        for (int t = 0; t < n; t++) {
            revenue[t] = a.getRevenueEntry() * Math.pow(1 + a.getRevenueGrowth(), t);
            ebitda[t] = revenue[t] * margin[t];
            depreciation[t] = revenue[t] * a.getCapexPercent() * DEPRECIATION_TO_CAPEX;
            ebit[t] = ebitda[t] - depreciation[t];
        }

        // ── 2. Debt schedule (income-statement view) ──────────────────────────
        // Interest is charged on the balance already reduced through year t, which keeps
        // interest independent of the cash available for paydown (no circularity).
        double installment = a.getAnnualInstallment();
        double[] remainingDebt = new double[n];
        double[] interestExpense = new double[n];
        remainingDebt[0] = a.getDebtAmount();
        for (int t = 1; t < n; t++) {
            remainingDebt[t] = Math.max(0, remainingDebt[t - 1] - installment);
        }
        for (int t = 0; t < n; t++) {
            interestExpense[t] = remainingDebt[t] * a.getInterestRate();
        }

        // ── 3. Income statement completion ────────────────────────────────────
        List<IncomeStatementLine> income = new ArrayList<>(n);
        for (int t = 0; t < n; t++) {
            double ebt = ebit[t] - interestExpense[t];
            double tax = Math.max(0, ebt * a.getTaxRate());   // no benefit on losses
            income.add(new IncomeStatementLine(years.get(t), revenue[t], margin[t], ebitda[t],
                depreciation[t], ebit[t], interestExpense[t], ebt, tax, ebt - tax));
        }

        // ── 4 & 5. Working capital and cash flow ──────────────────────────────
        List<CashFlowLine> cashFlow = new ArrayList<>(n);
        double remainingPrincipal = a.getDebtAmount();
        double cumulative = 0;
        for (int t = 0; t < n; t++) {
            double wcChange = workingCapitalChange(a, t == 0 ? 0 : revenue[t] - revenue[t - 1]);
            double capex = -revenue[t] * a.getCapexPercent();

            // Acquisition year carries no principal repayment
            double amortization = 0;
            if (t > 0) {
                double payment = Math.min(installment, remainingPrincipal);
                remainingPrincipal -= payment;
                amortization = -payment;
            }

            double netIncome = income.get(t).netIncome();
            double interestPaid = -interestExpense[t];
            double fcf = netIncome + depreciation[t] + wcChange + capex;
            double lfcf = fcf + amortization + interestPaid;
            cumulative += lfcf;
            cashFlow.add(new CashFlowLine(years.get(t), netIncome, depreciation[t], wcChange, capex,
                amortization, interestPaid, fcf, lfcf, cumulative));
        }

        // ── 6. Balance sheet ──────────────────────────────────────────────────
        List<BalanceSheetLine> balance = new ArrayList<>(n);
        double debt = a.getDebtAmount();
        for (int t = 0; t < n; t++) {
            if (t > 0) {
                debt -= -cashFlow.get(t).debtAmortization();
            }
            double equity = a.getEquityAmount() + cashFlow.get(t).cumulativeLfcf();
            double ev = debt + equity;
            balance.add(new BalanceSheetLine(years.get(t), debt, equity, ev, ev / ebitda[t]));
        }

        List<YearRecord> records = new ArrayList<>(n);
        for (int t = 0; t < n; t++) {
            records.add(new YearRecord(years.get(t), income.get(t), cashFlow.get(t), balance.get(t)));
        }

        // ── 7. Returns ────────────────────────────────────────────────────────
        ReturnMetrics returns = computeReturns(a, ebitda[n - 1], balance.get(n - 1).debtBalance(), cashFlow);

        log.info("Projection complete for {} ({}-{}): IRR={}%, MOIC={}x",
            a.getCompanyName(), a.getEntryYear(), a.getExitYear(),
            String.format("%.2f", returns.irr()), String.format("%.2f", returns.moic()));
        return new ProjectionResult(a, List.copyOf(records), returns);
    }

    /**
     * Linear margin path from entry to exit over numYears points.
     * Undefined for fewer than two points, since the step divides by numYears - 1.
     */
    public static double[] interpolateMargins(double entryMargin, double exitMargin, int numYears) {
        if (numYears < 2) {
            throw new DegenerateHoldingPeriodException(String.format(
                "Margin interpolation needs at least 2 years, got %d", numYears));
        }
        double step = (exitMargin - entryMargin) / (numYears - 1);
        double[] margins = new double[numYears];
        for (int t = 0; t < numYears; t++) {
            margins[t] = entryMargin + step * t;
        }
        return margins;
    }

    /**
     * Cash impact of the year's revenue change. Higher payables release cash;
     * higher receivables and inventory absorb it.
     */
    static double workingCapitalChange(AssumptionSet a, double revenueDiff) {
        double arChange = revenueDiff * a.getDso() / DAYS_PER_YEAR;
        double invChange = revenueDiff * a.getDsi() / DAYS_PER_YEAR;
        double apChange = revenueDiff * a.getDpo() / DAYS_PER_YEAR;
        return apChange - (arChange + invChange);
    }

    private ReturnMetrics computeReturns(AssumptionSet a, double exitEbitda, double exitDebt,
                                         List<CashFlowLine> cashFlow) {
        // Entry outflow, interim-year LFCF as distributions, then exit equity
        List<Double> flows = new ArrayList<>();
        flows.add(-a.getEquityAmount());
        for (int t = 1; t < cashFlow.size() - 1; t++) {
            flows.add(cashFlow.get(t).lfcf());
        }
        double exitEv = exitEbitda * a.getExitMultiple();
        double exitEquity = exitEv - exitDebt;
        flows.add(exitEquity);

        double irr = returnSolver.irr(flows);
        double moic = exitEquity / a.getEquityAmount();
        double distributions = flows.stream().skip(1).mapToDouble(cf -> Math.max(0, cf)).sum();
        double dpi = distributions / a.getEquityAmount();

        return new ReturnMetrics(irr, moic, dpi, moic, exitEv, exitEquity, List.copyOf(flows));
    }
}
