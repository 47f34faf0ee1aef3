package com.jay.lbomodel.exception;

// Margin interpolation needs at least an entry year and an exit year
public class DegenerateHoldingPeriodException extends LboModelException {
    public DegenerateHoldingPeriodException(String message) { super("DEGENERATE_HOLDING_PERIOD", message); }
}
