package com.flagship.xmbl_ledger.ownership;

import com.flagship.xmbl_ledger.curve.BondingCurvePricer;
import com.flagship.xmbl_ledger.exception.LedgerErrorCode;
import com.flagship.xmbl_ledger.exception.LedgerException;
import com.flagship.xmbl_ledger.ledger.LedgerState;
import com.flagship.xmbl_ledger.ledger.ShareStore;
import com.flagship.xmbl_ledger.share.ClosedMetaShare;
import com.flagship.xmbl_ledger.share.MetaShare;
import com.flagship.xmbl_ledger.share.Share;

import java.math.BigInteger;

/**
 * Withdrawal and transfer of shares.
 *
 * Withdrawal deletes the share for good: its id is never reissued and the
 * curve positions it occupied stay counted as issued.
 *
 * A meta-share keeps its full deposit value for yield weighting after units
 * are minted from it, but only its unminted positions are refundable: the
 * minted units carry their own deposit value as ordinary shares.
 */
public class OwnershipEngine {

    private final BondingCurvePricer pricer;

    public OwnershipEngine(BondingCurvePricer pricer) {
        this.pricer = pricer;
    }

    /**
     * Redeems a share, returning its refundable value and any unclaimed yield.
     *
     * @throws LedgerException SHARE_NOT_FOUND or NOT_SHARE_OWNER
     */
    public WithdrawalResult withdraw(ShareStore store, long shareId, String callerId) {
        requireId(callerId, "Caller id");

        Share share = ownedShare(store, shareId, callerId);
        BigInteger refundable = refundableValue(share);
        LedgerState next = store.loadState().afterWithdrawal(refundable);

        store.delete(shareId);
        store.saveState(next);

        return new WithdrawalResult(shareId, callerId, refundable, share.getAccruedYield());
    }

    /**
     * Deposit value that leaves the ledger when {@code share} is redeemed.
     */
    public BigInteger refundableValue(Share share) {
        if (share instanceof MetaShare meta) {
            return pricer.costOf(meta.getStartPosition(), meta.getRemainingCount());
        }
        if (share instanceof ClosedMetaShare) {
            return BigInteger.ZERO;
        }
        return share.getDepositValue();
    }

    /**
     * Moves a share, with its accrued yield and any unminted meta capacity, to a new owner.
     *
     * @return the share as owned by {@code toOwnerId}
     * @throws LedgerException SHARE_NOT_FOUND or NOT_SHARE_OWNER
     */
    public Share transfer(ShareStore store, long shareId, String fromOwnerId, String toOwnerId) {
        requireId(fromOwnerId, "Sender id");
        requireId(toOwnerId, "Recipient id");

        Share share = ownedShare(store, shareId, fromOwnerId);
        Share moved = share.withOwner(toOwnerId);
        store.update(moved);
        return moved;
    }

    private Share ownedShare(ShareStore store, long shareId, String callerId) {
        Share share = store.findById(shareId)
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.SHARE_NOT_FOUND,
                "Share not found: " + shareId));
        if (!share.isOwnedBy(callerId)) {
            throw new LedgerException(LedgerErrorCode.NOT_SHARE_OWNER,
                String.format("Caller %s does not own share %d", callerId, shareId));
        }
        return share;
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
