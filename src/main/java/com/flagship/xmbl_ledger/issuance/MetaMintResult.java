package com.flagship.xmbl_ledger.issuance;

import lombok.Value;

import java.util.List;

/**
 * Outcome of materializing units from a meta-share.
 */
@Value
public class MetaMintResult {
    long metaShareId;
    List<Long> newShareIds;
    long metaRemainingCount;

    public boolean isMetaClosed() {
        return metaRemainingCount == 0;
    }
}
