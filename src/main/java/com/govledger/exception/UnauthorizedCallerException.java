package com.govledger.exception;

/**
 * The caller is not the current administrator.
 */
public class UnauthorizedCallerException extends SecurityException implements GovernanceViolation {

    private final String caller;

    public UnauthorizedCallerException(String caller, String action) {
        super("Address " + caller + " is not the administrator and cannot " + action);
        this.caller = caller;
    }

    public String getCaller() {
        return caller;
    }

    @Override
    public String errorCode() {
        return "UNAUTHORIZED";
    }
}
