package com.agentpipeline.common.exception;

/**
 * Raised when a value handed to a pure engine lies outside the domain it is defined on,
 * for example a NaN score given to the decision matrix.
 */
public class InputContractViolationException extends RuntimeException {

    public InputContractViolationException(String message) {
        super(message);
    }
}
