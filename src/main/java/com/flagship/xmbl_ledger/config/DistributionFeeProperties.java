package com.flagship.xmbl_ledger.config;

import com.flagship.xmbl_ledger.distribution.FeeTier;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds {@code xmbl.distribution.fee-tiers}. An empty list charges no protocol fee.
 */
@ConfigurationProperties(prefix = "xmbl.distribution")
@Getter
@Setter
public class DistributionFeeProperties {

    private List<Tier> feeTiers = new ArrayList<>();

    public List<FeeTier> toFeeTiers() {
        return feeTiers.stream()
                .map(tier -> new FeeTier(tier.getMinYield(), tier.getFeeBps()))
                .toList();
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Tier {
        private BigInteger minYield = BigInteger.ZERO;
        private int feeBps;
    }
}
