package com.govledger.exception;

/**
 * Marker for the expected, recoverable rejections of the governance ledger.
 *
 * Every violation is raised before any state is written, so the caller can
 * rely on the ledger being unchanged when one is thrown.
 */
public interface GovernanceViolation {

    /** Stable machine-readable code, e.g. {@code DUPLICATE_VOTE}. */
    String errorCode();
}
