package com.flagship.xmbl_ledger.exception;

/**
 * Error kinds raised by the ledger.
 *
 * All of these are precondition or invariant violations, not transient faults.
 * Retrying the same call against the same ledger state fails the same way.
 */
public enum LedgerErrorCode {
    INSUFFICIENT_DEPOSIT("Deposit cannot afford a single unit at the current curve position"),
    NOT_META_OWNER("Caller does not own the meta-share"),
    NOT_A_META_SHARE("Share is not an open meta-share"),
    INVALID_MINT_COUNT("Mint count must be between 1 and the remaining meta capacity"),
    INVALID_YIELD_AMOUNT("Yield amount must be positive"),
    NO_ACTIVE_DEPOSITS("No share carries a positive deposit value"),
    NOT_SHARE_OWNER("Caller does not own the share"),
    NOTHING_TO_CLAIM("Share has no accrued yield"),
    NO_YIELD_TO_CLAIM("None of the given shares has claimable yield for the caller"),
    ARITHMETIC_OVERFLOW("Amount exceeds the representable 256-bit range"),
    SHARE_NOT_FOUND("Share does not exist"),
    DEPOSITS_PAUSED("Deposits are paused"),
    DISTRIBUTIONS_PAUSED("Distributions are paused"),
    BELOW_DISTRIBUTION_THRESHOLD("Yield amount is below the minimum distribution threshold"),
    DEPOSIT_EXCEEDS_UNIT_LIMIT("Deposit affords more units than the configured per-deposit limit");

    private final String description;

    LedgerErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
