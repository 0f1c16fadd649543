package com.lensql.core;

/**
 * Raised when a predicate or write parameter does not fit the entity metadata it is applied to.
 * Generated code never produces these; hand-built parameters can.
 */
public class ContractViolationException extends LensException {
    public ContractViolationException(String message) {
        super(message);
    }
}
