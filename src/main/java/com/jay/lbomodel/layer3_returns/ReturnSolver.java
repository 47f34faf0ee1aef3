package com.jay.lbomodel.layer3_returns;

import com.jay.lbomodel.config.ModelConfig;
import com.jay.lbomodel.exception.NoRootException;
import com.jay.lbomodel.exception.NonConvergentReturnException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Layer 3 — Return Solver.
 * Finds the rate r for which sum(cf[t] / (1 + r)^t) = 0, with cf[0] at time zero and
 * one period between consecutive flows.
 *
 * The rate range is scanned on a log(1 + r) grid for sign changes; each bracket is then
 * refined with Brent's method. When several roots exist the one closest to zero wins.
 * A root above max_rate is still found by widening the range a bounded number of times.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReturnSolver {

    private final ModelConfig config;

    /** IRR of the flows, in percent. */
    public double irr(List<Double> cashFlows) {
        return irr(cashFlows.stream().mapToDouble(Double::doubleValue).toArray());
    }

    /** IRR of the flows, in percent. */
    public double irr(double[] cashFlows) {
        requireSignChange(cashFlows);

        ModelConfig.Solver cfg = config.solver();
        UnivariateFunction npv = rate -> npv(cashFlows, rate);
        BrentSolver brent = new BrentSolver(cfg.getRelativeAccuracy(), cfg.getAbsoluteAccuracy());

        double lo = Math.log1p(cfg.getMinRate());
        double hi = Math.log1p(cfg.getMaxRate());
        int points = Math.max(2, cfg.getGridPoints());

        Double best = null;
        double prevRate = cfg.getMinRate();
        double prevValue = npv.value(prevRate);
        for (int i = 1; i <= points; i++) {
            double rate = Math.expm1(lo + (hi - lo) * i / points);
            double value = npv.value(rate);
            if (Double.isFinite(prevValue) && Double.isFinite(value)) {
                Double root = null;
                if (prevValue == 0) {
                    root = prevRate;
                } else if (prevValue * value < 0) {
                    root = refine(brent, npv, prevRate, rate, cfg.getMaxEvaluations());
                }
                if (root != null && (best == null || Math.abs(root) < Math.abs(best))) {
                    best = root;
                }
            }
            prevRate = rate;
            prevValue = value;
        }
        if (best == null && prevValue == 0) {
            best = prevRate;
        }
        if (best == null) {
            best = searchAboveRange(cashFlows, npv, brent, cfg, prevRate, prevValue);
        }

        if (best == null) {
            throw new NonConvergentReturnException(String.format(
                "No IRR found between %.2f%% and %.2f%% for %d cash flows",
                cfg.getMinRate() * 100, cfg.getMaxRate() * 100, cashFlows.length));
        }
        log.debug("IRR solved: {}%", best * 100);
        return best * 100;
    }

    /**
     * As r grows without bound the NPV tends to cf[0]. If the NPV at the top of the grid
     * still has the other sign, a root lies above it: double log(1 + r) until the sign flips.
     */
    private Double searchAboveRange(double[] cashFlows, UnivariateFunction npv, BrentSolver brent,
                                    ModelConfig.Solver cfg, double topRate, double topValue) {
        double limit = cashFlows[0];
        if (limit == 0 || !Double.isFinite(topValue) || topValue == 0 || Math.signum(topValue) == Math.signum(limit)) {
            return null;
        }
        double prevRate = topRate;
        double x = Math.log1p(topRate);
        if (x <= 0) {
            return null;
        }
        for (int step = 0; step < cfg.getMaxRangeExpansions(); step++) {
            x *= 2;
            double rate = Math.expm1(x);
            double value = npv.value(rate);
            if (!Double.isFinite(rate) || !Double.isFinite(value)) {
                return null;
            }
            if (value == 0) {
                return rate;
            }
            if (value * topValue < 0) {
                log.debug("IRR bracket widened to [{}, {}]", prevRate, rate);
                return refine(brent, npv, prevRate, rate, cfg.getMaxEvaluations());
            }
            prevRate = rate;
        }
        return null;
    }

    /** Net present value at the given rate (a fraction, > -1). */
    public static double npv(double[] cashFlows, double rate) {
        double sum = 0;
        double discount = 1;
        for (double cf : cashFlows) {
            sum += cf / discount;
            discount *= 1 + rate;
        }
        return sum;
    }

    private double refine(BrentSolver brent, UnivariateFunction npv, double lo, double hi, int maxEvaluations) {
        try {
            return brent.solve(maxEvaluations, npv, lo, hi);
        } catch (TooManyEvaluationsException e) {
            throw new NonConvergentReturnException(String.format(
                "IRR did not converge within %d evaluations in [%.4f, %.4f]", maxEvaluations, lo, hi), e);
        } catch (MathIllegalArgumentException e) {
            throw new NonConvergentReturnException("IRR bracket rejected by solver: " + e.getMessage(), e);
        }
    }

    private static void requireSignChange(double[] cashFlows) {
        boolean positive = false;
        boolean negative = false;
        for (double cf : cashFlows) {
            if (cf > 0) positive = true;
            if (cf < 0) negative = true;
        }
        if (!positive || !negative) {
            throw new NoRootException(String.format(
                "Cash flows never change sign (%d flows, all %s) — IRR undefined",
                cashFlows.length, positive ? "non-negative" : "non-positive"));
        }
    }
}
