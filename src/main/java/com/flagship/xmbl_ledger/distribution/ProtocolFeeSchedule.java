package com.flagship.xmbl_ledger.distribution;

import com.flagship.xmbl_ledger.curve.Amounts;
import com.flagship.xmbl_ledger.curve.BondingCurvePricer;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Size-banded protocol fee applied to harvested yield before distribution.
 *
 * A yield falls into the tier with the largest {@code minYield} not above it;
 * a yield below every tier pays no fee. The fee truncates toward zero.
 */
public class ProtocolFeeSchedule {

    private static final BigInteger BPS = BigInteger.valueOf(BondingCurvePricer.BPS_DENOMINATOR);

    private final List<FeeTier> tiers;

    public ProtocolFeeSchedule(List<FeeTier> tiers) {
        if (tiers == null) {
            throw new IllegalArgumentException("Fee tiers are required");
        }
        List<FeeTier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparing(FeeTier::getMinYield));
        for (int i = 0; i < sorted.size(); i++) {
            FeeTier tier = sorted.get(i);
            Amounts.requireAmount(tier.getMinYield(), "Tier minimum");
            if (tier.getFeeBps() < 0 || tier.getFeeBps() > BondingCurvePricer.BPS_DENOMINATOR) {
                throw new IllegalArgumentException("Tier fee must be between 0 and "
                    + BondingCurvePricer.BPS_DENOMINATOR + " bps: " + tier);
            }
            if (i > 0 && sorted.get(i - 1).getMinYield().equals(tier.getMinYield())) {
                throw new IllegalArgumentException("Duplicate tier minimum " + tier.getMinYield());
            }
        }
        this.tiers = List.copyOf(sorted);
    }

    public static ProtocolFeeSchedule none() {
        return new ProtocolFeeSchedule(List.of());
    }

    public FeeAssessment assess(BigInteger grossYield) {
        Amounts.requireAmount(grossYield, "Gross yield");

        int feeBps = 0;
        for (FeeTier tier : tiers) {
            if (tier.getMinYield().compareTo(grossYield) > 0) {
                break;
            }
            feeBps = tier.getFeeBps();
        }
        BigInteger fee = grossYield.multiply(BigInteger.valueOf(feeBps)).divide(BPS);
        return new FeeAssessment(grossYield, feeBps, fee, grossYield.subtract(fee));
    }

    public List<FeeTier> getTiers() {
        return tiers;
    }
}
