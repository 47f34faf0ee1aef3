package com.jay.lbomodel.model;

import java.util.List;

public record SensitivityReport(
    String companyName,
    List<SensitivityRow> exitMultiple,
    List<SensitivityRow> revenueGrowth,
    List<SensitivityRow> exitEbitdaMargin
) {}
