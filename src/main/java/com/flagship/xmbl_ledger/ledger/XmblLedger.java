package com.flagship.xmbl_ledger.ledger;

import com.flagship.xmbl_ledger.curve.BondingCurvePricer;
import com.flagship.xmbl_ledger.distribution.BatchClaimResult;
import com.flagship.xmbl_ledger.distribution.DistributionEngine;
import com.flagship.xmbl_ledger.distribution.DistributionResult;
import com.flagship.xmbl_ledger.event.LedgerEventSink;
import com.flagship.xmbl_ledger.event.ShareIssuedEvent;
import com.flagship.xmbl_ledger.event.ShareTransferredEvent;
import com.flagship.xmbl_ledger.event.ShareWithdrawnEvent;
import com.flagship.xmbl_ledger.event.UnitsMintedFromMetaEvent;
import com.flagship.xmbl_ledger.event.YieldClaimedEvent;
import com.flagship.xmbl_ledger.event.YieldDistributedEvent;
import com.flagship.xmbl_ledger.exception.LedgerErrorCode;
import com.flagship.xmbl_ledger.exception.LedgerException;
import com.flagship.xmbl_ledger.issuance.IssuanceEngine;
import com.flagship.xmbl_ledger.issuance.IssuanceQuote;
import com.flagship.xmbl_ledger.issuance.IssuanceResult;
import com.flagship.xmbl_ledger.issuance.MetaMintResult;
import com.flagship.xmbl_ledger.ownership.OwnershipEngine;
import com.flagship.xmbl_ledger.ownership.WithdrawalResult;
import com.flagship.xmbl_ledger.share.Share;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * The issuance and distribution ledger.
 *
 * This class is the single writer of one ledger instance. Every mutating
 * operation runs end-to-end under one lock (plus the store's own write
 * lock), validates all preconditions before writing, and publishes exactly
 * one event per affected share or distribution to the {@link LedgerEventSink}
 * once its writes are done.
 *
 * Operations:
 * - issue: deposit to ordinary share or meta-share
 * - mintFromMeta: materialize reserved units
 * - distribute / claim / claimMultiple: yield accounting
 * - withdraw / transfer: ownership changes
 * - pause / resume of deposits and distributions
 */
public class XmblLedger {

    private final ShareStore store;
    private final IssuanceEngine issuanceEngine;
    private final DistributionEngine distributionEngine;
    private final OwnershipEngine ownershipEngine;
    private final LedgerEventSink eventSink;
    private final ReentrantLock lock = new ReentrantLock(true);

    public XmblLedger(ShareStore store,
                      IssuanceEngine issuanceEngine,
                      DistributionEngine distributionEngine,
                      OwnershipEngine ownershipEngine,
                      LedgerEventSink eventSink) {
        this.store = store;
        this.issuanceEngine = issuanceEngine;
        this.distributionEngine = distributionEngine;
        this.ownershipEngine = ownershipEngine;
        this.eventSink = eventSink;
    }

    /**
     * In-memory ledger on the default curve, for embedding and tests.
     */
    public static XmblLedger inMemory(LedgerEventSink eventSink) {
        BondingCurvePricer pricer = BondingCurvePricer.withDefaults();
        return new XmblLedger(
            new InMemoryShareStore(),
            new IssuanceEngine(pricer),
            new DistributionEngine(),
            new OwnershipEngine(pricer),
            eventSink
        );
    }

    // ==================== Issuance ====================

    public IssuanceResult issue(String depositorId, BigInteger ethEquivalentAmount) {
        return write(() -> {
            if (store.loadState().isDepositsPaused()) {
                throw new LedgerException(LedgerErrorCode.DEPOSITS_PAUSED);
            }
            IssuanceResult result = issuanceEngine.issue(store, depositorId, ethEquivalentAmount);
            Share share = result.getShare();
            long startPosition = store.loadState().getTotalUnitsIssued() - result.getUnitsIssued();
            eventSink.publish(result.isMeta()
                ? ShareIssuedEvent.meta(share.getId(), depositorId, share.getDepositValue(),
                    result.getUnitsIssued(), startPosition, result.getRemainder())
                : ShareIssuedEvent.ordinary(share.getId(), depositorId, share.getDepositValue(),
                    startPosition, result.getRemainder()));
            return result;
        });
    }

    public MetaMintResult mintFromMeta(long metaShareId, int unitsToMint, String callerId) {
        return write(() -> {
            MetaMintResult result = issuanceEngine.mintFromMeta(store, metaShareId, unitsToMint, callerId);
            eventSink.publish(UnitsMintedFromMetaEvent.of(
                metaShareId, result.getNewShareIds(), callerId, result.getMetaRemainingCount()));
            return result;
        });
    }

    // ==================== Distribution ====================

    public DistributionResult distribute(BigInteger totalYield) {
        return write(() -> {
            if (store.loadState().isDistributionsPaused()) {
                throw new LedgerException(LedgerErrorCode.DISTRIBUTIONS_PAUSED);
            }
            DistributionResult result = distributionEngine.distribute(store, totalYield);
            eventSink.publish(YieldDistributedEvent.of(
                result.getTotalYield(), result.getTotalCredited(), result.getPerShareCredits()));
            return result;
        });
    }

    public BigInteger claim(long shareId, String callerId) {
        return write(() -> {
            BigInteger amount = distributionEngine.claim(store, shareId, callerId);
            eventSink.publish(YieldClaimedEvent.of(shareId, callerId, amount));
            return amount;
        });
    }

    public BatchClaimResult claimMultiple(Collection<Long> shareIds, String callerId) {
        return write(() -> {
            BatchClaimResult result = distributionEngine.claimMultiple(store, shareIds, callerId);
            result.getClaimedPerShare().forEach((shareId, amount) ->
                eventSink.publish(YieldClaimedEvent.of(shareId, callerId, amount)));
            return result;
        });
    }

    // ==================== Ownership ====================

    public WithdrawalResult withdraw(long shareId, String callerId) {
        return write(() -> {
            WithdrawalResult result = ownershipEngine.withdraw(store, shareId, callerId);
            eventSink.publish(ShareWithdrawnEvent.of(shareId, callerId,
                result.getDepositValueReturned(), result.getYieldReturned()));
            return result;
        });
    }

    public Share transfer(long shareId, String fromOwnerId, String toOwnerId) {
        return write(() -> {
            Share moved = ownershipEngine.transfer(store, shareId, fromOwnerId, toOwnerId);
            eventSink.publish(ShareTransferredEvent.of(shareId, fromOwnerId, toOwnerId));
            return moved;
        });
    }

    // ==================== Emergency controls ====================

    public LedgerState pauseDeposits() {
        return updateState(state -> state.withDepositsPaused(true));
    }

    public LedgerState resumeDeposits() {
        return updateState(state -> state.withDepositsPaused(false));
    }

    public LedgerState pauseDistributions() {
        return updateState(state -> state.withDistributionsPaused(true));
    }

    public LedgerState resumeDistributions() {
        return updateState(state -> state.withDistributionsPaused(false));
    }

    // ==================== Queries ====================

    public Optional<Share> getShare(long shareId) {
        return read(() -> store.findById(shareId));
    }

    public List<Share> sharesOf(String ownerId) {
        return read(() -> store.findByOwner(ownerId));
    }

    public List<Share> allShares() {
        return read(store::findAll);
    }

    public Optional<HolderPosition> holderPosition(String ownerId) {
        return read(() -> store.holderPosition(ownerId));
    }

    public List<HolderPosition> holderPositions() {
        return read(store::holderPositions);
    }

    public LedgerState getState() {
        return read(store::loadState);
    }

    /**
     * What a deposit would buy right now, without reserving anything.
     */
    public IssuanceQuote quote(BigInteger ethEquivalentAmount) {
        return read(() -> issuanceEngine.quote(ethEquivalentAmount, store.loadState().getTotalUnitsIssued()));
    }

    public BigInteger priceOfNextUnit() {
        return read(() -> issuanceEngine.getPricer().price(store.loadState().getTotalUnitsIssued()));
    }

    private LedgerState updateState(UnaryOperator<LedgerState> change) {
        return write(() -> {
            LedgerState next = change.apply(store.loadState());
            store.saveState(next);
            return next;
        });
    }

    private <T> T write(Supplier<T> operation) {
        lock.lock();
        try {
            store.lockForWrite();
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }
}
