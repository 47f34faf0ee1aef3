package com.jay.lbomodel.model;

/** One swept value and the returns it produced. IRR in percent, MOIC as a multiple. */
public record SensitivityRow(double value, double irr, double moic) {}
