package com.lensql.core;

/**
 * Raised for malformed queries that are the caller's fault: bad pagination, missing fetchers,
 * arithmetic that cannot be applied.
 */
public class QueryValidationException extends LensException {
    public QueryValidationException(String message) {
        super(message);
    }

    public QueryValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
