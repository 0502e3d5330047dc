package com.flagship.xmbl_ledger.issuance;

import com.flagship.xmbl_ledger.curve.Amounts;
import com.flagship.xmbl_ledger.curve.BondingCurvePricer;
import com.flagship.xmbl_ledger.exception.LedgerErrorCode;
import com.flagship.xmbl_ledger.exception.LedgerException;
import com.flagship.xmbl_ledger.ledger.LedgerState;
import com.flagship.xmbl_ledger.ledger.ShareStore;
import com.flagship.xmbl_ledger.share.MetaShare;
import com.flagship.xmbl_ledger.share.OrdinaryShare;
import com.flagship.xmbl_ledger.share.Share;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts deposits into shares along the bonding curve.
 *
 * A deposit that affords one unit becomes an ordinary share. A deposit that
 * affords several becomes a single meta-share reserving all of them; the
 * reserved positions count as issued immediately and are materialized later
 * with {@link #mintFromMeta}.
 *
 * Every method validates and computes the full outcome before touching the
 * store, so a failure leaves the store unchanged.
 */
public class IssuanceEngine {

    /** No per-deposit limit. */
    public static final long UNLIMITED = 0L;

    private final BondingCurvePricer pricer;
    private final long maxUnitsPerDeposit;

    /**
     * @param maxUnitsPerDeposit deposits affording more units are rejected; {@link #UNLIMITED} disables the guard
     */
    public IssuanceEngine(BondingCurvePricer pricer, long maxUnitsPerDeposit) {
        if (maxUnitsPerDeposit < 0) {
            throw new IllegalArgumentException("Max units per deposit cannot be negative");
        }
        this.pricer = pricer;
        this.maxUnitsPerDeposit = maxUnitsPerDeposit;
    }

    public IssuanceEngine(BondingCurvePricer pricer) {
        this(pricer, UNLIMITED);
    }

    /**
     * Buys units from {@code totalIssued} onwards for as long as the next
     * unit's price still fits in what is left of {@code amount}.
     */
    public IssuanceQuote quote(BigInteger amount, long totalIssued) {
        Amounts.requireAmount(amount, "Deposit amount");

        long units = pricer.affordableUnits(totalIssued, amount);
        BigInteger totalCost = pricer.costOf(totalIssued, units);

        return new IssuanceQuote(totalIssued, units, totalCost, Amounts.subtract(amount, totalCost));
    }

    /**
     * Issues shares for a deposit already converted to reference units.
     *
     * @param store ledger storage
     * @param depositorId owner of the new share
     * @param ethEquivalentAmount deposit in reference units
     * @return created share id, charged cost, units issued and the refundable remainder
     * @throws LedgerException INSUFFICIENT_DEPOSIT if not even one unit is affordable,
     *         DEPOSIT_EXCEEDS_UNIT_LIMIT if a unit limit is configured and exceeded
     */
    public IssuanceResult issue(ShareStore store, String depositorId, BigInteger ethEquivalentAmount) {
        requireId(depositorId, "Depositor id");

        LedgerState state = store.loadState();
        long position = state.getTotalUnitsIssued();
        IssuanceQuote quote = quote(ethEquivalentAmount, position);

        if (!quote.isAffordable()) {
            throw new LedgerException(LedgerErrorCode.INSUFFICIENT_DEPOSIT,
                String.format("Deposit %s is below the price %s of unit #%d",
                    ethEquivalentAmount, pricer.price(position), position + 1));
        }
        if (maxUnitsPerDeposit != UNLIMITED && quote.getUnits() > maxUnitsPerDeposit) {
            throw new LedgerException(LedgerErrorCode.DEPOSIT_EXCEEDS_UNIT_LIMIT,
                String.format("Deposit %s affords %d units; the limit is %d",
                    ethEquivalentAmount, quote.getUnits(), maxUnitsPerDeposit));
        }

        long shareId = state.getNextShareId();
        Share share = quote.getUnits() == 1
            ? OrdinaryShare.issue(shareId, depositorId, quote.getTotalCost())
            : MetaShare.reserve(shareId, depositorId, quote.getTotalCost(), quote.getUnits(), position);
        LedgerState next = state.afterIssuance(quote.getUnits(), quote.getTotalCost());

        store.insert(share);
        store.saveState(next);

        return new IssuanceResult(
            List.of(shareId),
            quote.getTotalCost(),
            quote.getUnits(),
            quote.getRemainder(),
            share.isMeta(),
            share
        );
    }

    /**
     * Materializes {@code unitsToMint} units from an open meta-share, each
     * priced at its reserved curve position. The issuance counter is not
     * advanced; those positions were counted when the meta-share was created.
     *
     * @throws LedgerException SHARE_NOT_FOUND, NOT_META_OWNER, NOT_A_META_SHARE or INVALID_MINT_COUNT
     */
    public MetaMintResult mintFromMeta(ShareStore store, long metaShareId, int unitsToMint, String callerId) {
        requireId(callerId, "Caller id");

        Share target = store.findById(metaShareId)
            .orElseThrow(() -> new LedgerException(LedgerErrorCode.SHARE_NOT_FOUND,
                "Share not found: " + metaShareId));

        if (!target.isOwnedBy(callerId)) {
            throw new LedgerException(LedgerErrorCode.NOT_META_OWNER,
                String.format("Caller %s does not own share %d", callerId, metaShareId));
        }
        if (!(target instanceof MetaShare meta)) {
            throw new LedgerException(LedgerErrorCode.NOT_A_META_SHARE,
                String.format("Share %d is %s, not an open meta-share", metaShareId, target.getKind()));
        }
        if (unitsToMint <= 0 || unitsToMint > meta.getRemainingCount()) {
            throw new LedgerException(LedgerErrorCode.INVALID_MINT_COUNT,
                String.format("Cannot mint %d units; meta-share %d has %d remaining",
                    unitsToMint, metaShareId, meta.getRemainingCount()));
        }

        LedgerState state = store.loadState();
        long firstId = state.getNextShareId();
        List<Share> minted = new ArrayList<>(unitsToMint);
        for (int i = 0; i < unitsToMint; i++) {
            BigInteger unitPrice = pricer.price(meta.getStartPosition() + i);
            minted.add(OrdinaryShare.issue(firstId + i, callerId, unitPrice));
        }
        Share consumed = meta.consume(unitsToMint);
        LedgerState next = state.afterMetaMint(unitsToMint);

        minted.forEach(store::insert);
        store.update(consumed);
        store.saveState(next);

        long remaining = consumed instanceof MetaShare open ? open.getRemainingCount() : 0L;
        return new MetaMintResult(metaShareId, minted.stream().map(Share::getId).toList(), remaining);
    }

    public BondingCurvePricer getPricer() {
        return pricer;
    }

    static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
