package com.jay.lbomodel.exception;

import lombok.Getter;

/**
 * Root of every failure the model can raise.
 * All model failures are deterministic for a given input, so none of them are retried.
 */
@Getter
public class LboModelException extends RuntimeException {

    private final String errorCode;

    public LboModelException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public LboModelException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
