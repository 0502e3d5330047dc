package com.flagship.xmbl_ledger.share;

/**
 * Persisted tag of a {@link Share} variant.
 */
public enum ShareKind {
    /** A single issued unit. */
    ORDINARY,

    /** A reserved block of units that can still be minted individually. */
    META,

    /** A meta-share whose reserved units have all been minted. Kept for accounting. */
    CLOSED_META
}
