package com.flagship.xmbl_ledger.exception;

/**
 * Typed failure surfaced by every ledger operation.
 *
 * A thrown LedgerException guarantees that the failing operation left no
 * partial state behind; the ledger remains usable.
 */
public class LedgerException extends RuntimeException {

    private final LedgerErrorCode code;

    public LedgerException(LedgerErrorCode code, String message) {
        super(code.name() + ": " + message);
        this.code = code;
    }

    public LedgerException(LedgerErrorCode code) {
        this(code, code.getDescription());
    }

    public LedgerErrorCode getCode() {
        return code;
    }
}
