package com.jay.lbomodel.model.enums;

public enum SensitivityDimension {
    EXIT_MULTIPLE,      // x EBITDA at exit
    REVENUE_GROWTH,     // % per year
    EXIT_EBITDA_MARGIN  // % of revenue in the exit year
}
