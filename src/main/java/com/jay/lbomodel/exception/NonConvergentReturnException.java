package com.jay.lbomodel.exception;

/**
 * The return solver could not produce a rate for the cash-flow vector.
 * Never mapped to 0% or NaN by callers.
 */
public class NonConvergentReturnException extends LboModelException {

    public NonConvergentReturnException(String message) {
        super("NON_CONVERGENT_RETURN", message);
    }

    public NonConvergentReturnException(String message, Throwable cause) {
        super("NON_CONVERGENT_RETURN", message, cause);
    }

    protected NonConvergentReturnException(String errorCode, String message) {
        super(errorCode, message);
    }
}
