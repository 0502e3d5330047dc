package com.flagship.xmbl_ledger.vault;

import com.flagship.xmbl_ledger.distribution.BatchClaimResult;
import com.flagship.xmbl_ledger.distribution.DistributionResult;
import com.flagship.xmbl_ledger.exception.LedgerException;
import com.flagship.xmbl_ledger.issuance.IssuanceQuote;
import com.flagship.xmbl_ledger.issuance.IssuanceResult;
import com.flagship.xmbl_ledger.issuance.MetaMintResult;
import com.flagship.xmbl_ledger.ledger.HolderPosition;
import com.flagship.xmbl_ledger.ledger.LedgerState;
import com.flagship.xmbl_ledger.ledger.XmblLedger;
import com.flagship.xmbl_ledger.observability.LedgerMetrics;
import com.flagship.xmbl_ledger.ownership.WithdrawalResult;
import com.flagship.xmbl_ledger.share.Share;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Transactional entry point to the ledger.
 *
 * Each mutating call runs in one database transaction: the share rows, the
 * ledger counters and the outbox event commit together or not at all. A
 * {@link LedgerException} rolls the transaction back like any other runtime
 * exception, so a rejected operation leaves no trace.
 *
 * Logging carries {@code operation}, {@code shareId} and {@code ownerId} in the
 * MDC while the call is in flight.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultService {

    private final XmblLedger ledger;
    private final LedgerMetrics metrics;

    // ==================== Issuance ====================

    @Transactional
    public IssuanceResult deposit(String depositorId, BigInteger amount) {
        return execute("deposit", null, depositorId, () -> {
            IssuanceResult result = ledger.issue(depositorId, amount);
            metrics.recordUnitsIssued(result.getUnitsIssued(), result.isMeta());
            log.info("Deposit accepted: shareId={}, units={}, meta={}, cost={}, refund={}",
                    result.getShare().getId(), result.getUnitsIssued(), result.isMeta(),
                    result.getTotalCost(), result.getRemainder());
            return result;
        });
    }

    @Transactional
    public MetaMintResult mintFromMeta(long metaShareId, int units, String callerId) {
        return execute("mint_from_meta", metaShareId, callerId, () -> {
            MetaMintResult result = ledger.mintFromMeta(metaShareId, units, callerId);
            log.info("Minted {} shares from meta-share: newShareIds={}, remaining={}",
                    units, result.getNewShareIds(), result.getMetaRemainingCount());
            return result;
        });
    }

    // ==================== Yield ====================

    @Transactional
    public DistributionResult distributeYield(BigInteger totalYield) {
        return execute("distribute", null, null, () -> {
            DistributionResult result = ledger.distribute(totalYield);
            metrics.recordYieldDistributed(result.getTotalCredited(), result.getUndistributed());
            log.info("Yield distributed: total={}, credited={}, holders={}, shares={}, residual={}",
                    result.getTotalYield(), result.getTotalCredited(), result.getHolderCount(),
                    result.getPerShareCredits().size(), result.getUndistributed());
            return result;
        });
    }

    @Transactional
    public BigInteger claimYield(long shareId, String callerId) {
        return execute("claim", shareId, callerId, () -> {
            BigInteger amount = ledger.claim(shareId, callerId);
            metrics.recordYieldClaimed(amount);
            log.info("Yield claimed: amount={}", amount);
            return amount;
        });
    }

    @Transactional
    public BatchClaimResult claimYield(Collection<Long> shareIds, String callerId) {
        return execute("claim_multiple", null, callerId, () -> {
            BatchClaimResult result = ledger.claimMultiple(shareIds, callerId);
            metrics.recordYieldClaimed(result.getTotalClaimed());
            log.info("Batch yield claimed: shares={}, total={}",
                    result.getClaimedPerShare().keySet(), result.getTotalClaimed());
            return result;
        });
    }

    // ==================== Ownership ====================

    @Transactional
    public WithdrawalResult withdraw(long shareId, String callerId) {
        return execute("withdraw", shareId, callerId, () -> {
            WithdrawalResult result = ledger.withdraw(shareId, callerId);
            log.info("Share withdrawn: depositValue={}, yield={}",
                    result.getDepositValueReturned(), result.getYieldReturned());
            return result;
        });
    }

    @Transactional
    public Share transfer(long shareId, String fromOwnerId, String toOwnerId) {
        return execute("transfer", shareId, fromOwnerId, () -> {
            Share moved = ledger.transfer(shareId, fromOwnerId, toOwnerId);
            log.info("Share transferred to {}", toOwnerId);
            return moved;
        });
    }

    // ==================== Emergency controls ====================

    @Transactional
    public LedgerState pauseDeposits() {
        return control("pause_deposits", ledger::pauseDeposits);
    }

    @Transactional
    public LedgerState resumeDeposits() {
        return control("resume_deposits", ledger::resumeDeposits);
    }

    @Transactional
    public LedgerState pauseDistributions() {
        return control("pause_distributions", ledger::pauseDistributions);
    }

    @Transactional
    public LedgerState resumeDistributions() {
        return control("resume_distributions", ledger::resumeDistributions);
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public Optional<Share> getShare(long shareId) {
        return ledger.getShare(shareId);
    }

    @Transactional(readOnly = true)
    public List<Share> getSharesOf(String ownerId) {
        return ledger.sharesOf(ownerId);
    }

    @Transactional(readOnly = true)
    public List<Share> getAllShares() {
        return ledger.allShares();
    }

    @Transactional(readOnly = true)
    public Optional<HolderPosition> getHolderPosition(String ownerId) {
        return ledger.holderPosition(ownerId);
    }

    @Transactional(readOnly = true)
    public List<HolderPosition> getHolderPositions() {
        return ledger.holderPositions();
    }

    @Transactional(readOnly = true)
    public LedgerState getState() {
        return ledger.getState();
    }

    @Transactional(readOnly = true)
    public IssuanceQuote quote(BigInteger amount) {
        return ledger.quote(amount);
    }

    @Transactional(readOnly = true)
    public BigInteger priceOfNextUnit() {
        return ledger.priceOfNextUnit();
    }

    private LedgerState control(String operation, Supplier<LedgerState> change) {
        return execute(operation, null, null, () -> {
            LedgerState state = change.get();
            log.warn("Ledger control applied: depositsPaused={}, distributionsPaused={}",
                    state.isDepositsPaused(), state.isDistributionsPaused());
            return state;
        });
    }

    private <T> T execute(String operation, Long shareId, String ownerId, Supplier<T> body) {
        long startTime = System.currentTimeMillis();
        MDC.put("operation", operation);
        if (shareId != null) {
            MDC.put("shareId", shareId.toString());
        }
        if (ownerId != null) {
            MDC.put("ownerId", ownerId);
        }

        try {
            T result = body.get();
            metrics.recordSuccess(operation);
            return result;

        } catch (LedgerException e) {
            metrics.recordRejection(operation, e.getCode());
            log.warn("Ledger operation rejected: code={}, message={}", e.getCode(), e.getMessage());
            throw e;

        } catch (RuntimeException e) {
            metrics.recordError(operation);
            log.error("Ledger operation failed: {}", e.getMessage(), e);
            throw e;

        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove("operation");
            MDC.remove("shareId");
            MDC.remove("ownerId");
        }
    }
}
