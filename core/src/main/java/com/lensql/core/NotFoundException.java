package com.lensql.core;

/**
 * Raised when a unique selector or deferred lookup matches no row.
 */
public class NotFoundException extends LensException {
    public NotFoundException(String message) {
        super(message);
    }
}
