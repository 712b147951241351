package com.govledger.exception;

/**
 * Required text is empty or a target identity is missing.
 */
public class InvalidInputException extends IllegalArgumentException implements GovernanceViolation {

    public InvalidInputException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "INVALID_INPUT";
    }
}
