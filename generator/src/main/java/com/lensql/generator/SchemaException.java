package com.lensql.generator;

import com.lensql.core.LensException;

/**
 * A schema declaration that cannot be compiled. Generation stops at the first one.
 */
public class SchemaException extends LensException {
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
