package com.jay.lbomodel.model;

import lombok.Data;

import java.util.List;

/** Sweep request. Omitted lists are filled with the configured ladder around the base value. */
@Data
public class SensitivityRequest {
    private AssumptionRequest assumptions;
    private List<Double> exitMultiples;
    private List<Double> revenueGrowthPcts;
    private List<Double> exitMarginPcts;
}
