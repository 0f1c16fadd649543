package com.lensql.core;

/**
 * Base class for every failure raised by the lensql runtime.
 */
public class LensException extends RuntimeException {
    public LensException(String message) {
        super(message);
    }

    public LensException(String message, Throwable cause) {
        super(message, cause);
    }
}
