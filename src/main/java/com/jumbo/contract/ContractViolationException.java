package com.jumbo.contract;

/**
 * Thrown when an envelope does not satisfy the event contract and must not be stored.
 */
public class ContractViolationException extends RuntimeException {

    public ContractViolationException(String message) {
        super(message);
    }
}
