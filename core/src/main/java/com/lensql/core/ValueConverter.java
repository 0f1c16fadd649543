package com.lensql.core;

/**
 * Converts values of a user-declared column type that the runtime does not know natively.
 * Registered per declared type name in {@link com.lensql.core.config.ClientConfig}.
 */
public interface ValueConverter {
    Object toBackend(Object value);

    Object fromBackend(Object raw);
}
