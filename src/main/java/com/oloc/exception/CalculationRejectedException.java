package com.oloc.exception;

/**
 * Thrown when a supervisor cannot accept a calculation, typically because it
 * has been shut down or the calling thread was interrupted while waiting.
 */
public class CalculationRejectedException extends OlocException {

    public CalculationRejectedException(String message) {
        super(message);
    }

    public CalculationRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
