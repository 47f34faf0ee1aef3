package com.jay.lbomodel.model;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Values to sweep for each sensitivity dimension.
 * Growth and margin values are whole percentages, matching the AssumptionSet builder.
 */
public record SensitivityRanges(
    List<Double> exitMultiples,
    List<Double> revenueGrowthPcts,
    List<Double> exitMarginPcts
) {

    public SensitivityRanges {
        exitMultiples = List.copyOf(exitMultiples);
        revenueGrowthPcts = List.copyOf(revenueGrowthPcts);
        exitMarginPcts = List.copyOf(exitMarginPcts);
    }

    /**
     * {base - n*step, ..., base, ..., base + n*step} around each base-case value.
     * Exit multiples at or below zero are left out of the ladder.
     */
    public static SensitivityRanges around(AssumptionSet base, double step, int pointsEachSide) {
        return new SensitivityRanges(
            ladder(base.getExitMultiple(), step, pointsEachSide).stream().filter(m -> m > 0).toList(),
            ladder(base.getRevenueGrowthPct(), step, pointsEachSide),
            ladder(base.getEbitdaMarginExitPct(), step, pointsEachSide));
    }

    static List<Double> ladder(double centre, double step, int pointsEachSide) {
        return IntStream.rangeClosed(-pointsEachSide, pointsEachSide)
            .mapToObj(i -> centre + i * step)
            .toList();
    }
}
