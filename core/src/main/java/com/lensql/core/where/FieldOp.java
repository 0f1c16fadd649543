package com.lensql.core.where;

/**
 * An operator together with its operand. The operand shape is given by {@link Operator#shape()};
 * it is null for {@link OperandShape#NONE}.
 */
public record FieldOp(Operator operator, Object operand) {
}
