package com.jay.lbomodel.exception;

/** Raised while building an AssumptionSet, before any projection work is done. */
public class InvalidAssumptionException extends LboModelException {
    public InvalidAssumptionException(String message) { super("INVALID_ASSUMPTION", message); }
}
