package com.jay.lbomodel.exception;

/** Cash flows never change sign, so no discount rate can zero their NPV. */
public class NoRootException extends NonConvergentReturnException {
    public NoRootException(String message) { super("NO_ROOT", message); }
}
