package com.flagship.xmbl_ledger.distribution;

import com.flagship.xmbl_ledger.curve.Amounts;
import com.flagship.xmbl_ledger.exception.LedgerErrorCode;
import com.flagship.xmbl_ledger.exception.LedgerException;
import com.flagship.xmbl_ledger.ledger.HolderPosition;
import com.flagship.xmbl_ledger.ledger.ShareStore;
import com.flagship.xmbl_ledger.share.Share;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits external yield income across outstanding shares and pays it out on claim.
 *
 * Weighting is per holder: each holder receives
 * {@code totalYield * holderDeposit / totalDeposit}, split evenly over that
 * holder's shares. Both divisions truncate and the truncated amounts are
 * not redistributed.
 *
 * Like {@link com.flagship.xmbl_ledger.issuance.IssuanceEngine}, every
 * method computes its full outcome before writing to the store.
 */
public class DistributionEngine {

    private final BigInteger minimumYield;

    public DistributionEngine(BigInteger minimumYield) {
        if (minimumYield == null || minimumYield.signum() <= 0) {
            throw new IllegalArgumentException("Minimum distribution must be positive");
        }
        this.minimumYield = minimumYield;
    }

    public DistributionEngine() {
        this(BigInteger.ONE);
    }

    /**
     * Credits {@code totalYield} to every share with a positive deposit value.
     *
     * @throws LedgerException INVALID_YIELD_AMOUNT, BELOW_DISTRIBUTION_THRESHOLD or NO_ACTIVE_DEPOSITS
     */
    public DistributionResult distribute(ShareStore store, BigInteger totalYield) {
        if (totalYield == null) {
            throw new IllegalArgumentException("Yield amount is required");
        }
        if (totalYield.signum() <= 0) {
            throw new LedgerException(LedgerErrorCode.INVALID_YIELD_AMOUNT,
                "Yield amount must be positive, got " + totalYield);
        }
        Amounts.requireAmount(totalYield, "Yield amount");
        if (totalYield.compareTo(minimumYield) < 0) {
            throw new LedgerException(LedgerErrorCode.BELOW_DISTRIBUTION_THRESHOLD,
                String.format("Yield %s is below the minimum of %s", totalYield, minimumYield));
        }

        List<HolderPosition> holders = store.holderPositions();
        BigInteger totalDeposit = BigInteger.ZERO;
        for (HolderPosition holder : holders) {
            totalDeposit = Amounts.add(totalDeposit, holder.getTotalDeposit());
        }
        if (totalDeposit.signum() == 0) {
            throw new LedgerException(LedgerErrorCode.NO_ACTIVE_DEPOSITS);
        }

        Map<Long, BigInteger> credits = new LinkedHashMap<>();
        List<Share> credited = new ArrayList<>();
        BigInteger sumOfHolderShares = BigInteger.ZERO;
        BigInteger totalCredited = BigInteger.ZERO;

        for (HolderPosition holder : holders) {
            BigInteger holderShare = Amounts.multiply(totalYield, holder.getTotalDeposit()).divide(totalDeposit);
            sumOfHolderShares = Amounts.add(sumOfHolderShares, holderShare);

            BigInteger perShare = holderShare.divide(BigInteger.valueOf(holder.getShareCount()));
            if (perShare.signum() == 0) {
                continue;
            }
            for (Long shareId : holder.getShareIds()) {
                Share share = store.findById(shareId)
                    .orElseThrow(() -> new IllegalStateException("Owner index references missing share " + shareId));
                credited.add(share.creditYield(perShare));
                credits.put(shareId, perShare);
                totalCredited = Amounts.add(totalCredited, perShare);
            }
        }

        store.updateAll(credited);

        return new DistributionResult(
            totalYield,
            totalCredited,
            Collections.unmodifiableMap(credits),
            holders.size(),
            Amounts.subtract(totalYield, sumOfHolderShares),
            Amounts.subtract(sumOfHolderShares, totalCredited)
        );
    }

    /**
     * Pays out and zeroes the whole accrued yield of one share.
     *
     * @return the amount claimed
     * @throws LedgerException SHARE_NOT_FOUND, NOT_SHARE_OWNER or NOTHING_TO_CLAIM
     */
    public BigInteger claim(ShareStore store, long shareId, String callerId) {
        requireCaller(callerId);

        Share share = store.findById(shareId)
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.SHARE_NOT_FOUND,
                "Share not found: " + shareId));
        if (!share.isOwnedBy(callerId)) {
            throw new LedgerException(LedgerErrorCode.NOT_SHARE_OWNER,
                String.format("Caller %s does not own share %d", callerId, shareId));
        }
        if (!share.hasClaimableYield()) {
            throw new LedgerException(LedgerErrorCode.NOTHING_TO_CLAIM,
                "Share " + shareId + " has no accrued yield");
        }

        BigInteger amount = share.getAccruedYield();
        store.update(share.clearYield());
        return amount;
    }

    /**
     * Claims every listed share the caller owns and that has a balance.
     * Unknown, foreign and empty shares are skipped; duplicates are claimed once.
     *
     * @throws LedgerException NO_YIELD_TO_CLAIM if nothing was claimable
     */
    public BatchClaimResult claimMultiple(ShareStore store, Collection<Long> shareIds, String callerId) {
        requireCaller(callerId);
        if (shareIds == null) {
            throw new IllegalArgumentException("Share ids are required");
        }
        if (shareIds.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Share ids cannot contain null");
        }

        Map<Long, BigInteger> claimed = new LinkedHashMap<>();
        List<Share> cleared = new ArrayList<>();
        BigInteger total = BigInteger.ZERO;

        for (Long shareId : new LinkedHashSet<>(shareIds)) {
            Optional<Share> found = store.findById(shareId);
            if (found.isEmpty()) {
                continue;
            }
            Share share = found.get();
            if (!share.isOwnedBy(callerId) || !share.hasClaimableYield()) {
                continue;
            }
            claimed.put(shareId, share.getAccruedYield());
            cleared.add(share.clearYield());
            total = Amounts.add(total, share.getAccruedYield());
        }

        if (total.signum() == 0) {
            throw new LedgerException(LedgerErrorCode.NO_YIELD_TO_CLAIM,
                "No claimable yield among shares " + shareIds + " for " + callerId);
        }

        store.updateAll(cleared);
        return new BatchClaimResult(callerId, Collections.unmodifiableMap(claimed), total);
    }

    public BigInteger getMinimumYield() {
        return minimumYield;
    }

    private static void requireCaller(String callerId) {
        if (callerId == null || callerId.isBlank()) {
            throw new IllegalArgumentException("Caller id is required");
        }
    }
}
