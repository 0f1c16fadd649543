package com.lensql.core;

import com.lensql.core.meta.ScalarType;

public class TypeConversionException extends LensException {
    public TypeConversionException(Object value, ScalarType target) {
        super("Cannot convert " + value + " to " + target);
    }

    public TypeConversionException(Object value, ScalarType target, Throwable cause) {
        super("Cannot convert " + value + " to " + target, cause);
    }
}
