package com.oloc.exception;

/**
 * Base exception for oloc.
 */
public class OlocException extends RuntimeException {

    public OlocException(String message) {
        super(message);
    }

    public OlocException(String message, Throwable cause) {
        super(message, cause);
    }
}
