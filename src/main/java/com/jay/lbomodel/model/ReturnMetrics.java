package com.jay.lbomodel.model;

import java.util.List;

/**
 * Sponsor return metrics for one run.
 *
 * @param irr                 internal rate of return, in percent
 * @param moic                exit equity value / equity invested
 * @param dpi                 positive flows after entry / equity invested
 * @param tvpi                equal to MOIC; no realised/unrealised split is modelled
 * @param exitEnterpriseValue exit-year EBITDA times the exit multiple
 * @param exitEquityValue     exit enterprise value less exit-year debt
 * @param cashFlows           equity cash flows fed to the IRR: entry outflow, interim LFCF, exit equity
 */
public record ReturnMetrics(
    double irr,
    double moic,
    double dpi,
    double tvpi,
    double exitEnterpriseValue,
    double exitEquityValue,
    List<Double> cashFlows
) {}
