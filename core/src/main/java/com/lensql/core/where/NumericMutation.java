package com.lensql.core.where;

public enum NumericMutation {
    INCREMENT,
    DECREMENT,
    MULTIPLY,
    DIVIDE
}
