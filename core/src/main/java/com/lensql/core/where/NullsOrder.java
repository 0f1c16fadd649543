package com.lensql.core.where;

public enum NullsOrder {
    DEFAULT,
    FIRST,
    LAST;

    public NullsOrder reverse() {
        return switch (this) {
            case FIRST -> LAST;
            case LAST -> FIRST;
            case DEFAULT -> DEFAULT;
        };
    }
}
