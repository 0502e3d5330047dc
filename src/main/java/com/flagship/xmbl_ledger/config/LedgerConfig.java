package com.flagship.xmbl_ledger.config;

import com.flagship.xmbl_ledger.curve.BondingCurvePricer;
import com.flagship.xmbl_ledger.distribution.DistributionEngine;
import com.flagship.xmbl_ledger.distribution.ProtocolFeeSchedule;
import com.flagship.xmbl_ledger.event.LedgerEventSink;
import com.flagship.xmbl_ledger.issuance.IssuanceEngine;
import com.flagship.xmbl_ledger.ledger.ShareStore;
import com.flagship.xmbl_ledger.ledger.XmblLedger;
import com.flagship.xmbl_ledger.ownership.OwnershipEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

/**
 * Wires the ledger core to the database-backed share store and the outbox.
 *
 * The curve parameters are fixed for the life of a ledger; changing them on
 * a ledger that already has meta-shares makes their reserved positions
 * unpriceable.
 */
@Configuration
@EnableConfigurationProperties(DistributionFeeProperties.class)
@Slf4j
public class LedgerConfig {

    @Bean
    public BondingCurvePricer bondingCurvePricer(
            @Value("${xmbl.curve.unit-scale:10000000000}") BigInteger unitScale,
            @Value("${xmbl.curve.fee-bps:100}") int feeBps) {
        log.info("Bonding curve configured: unitScale={}, feeBps={}", unitScale, feeBps);
        return new BondingCurvePricer(unitScale, feeBps);
    }

    @Bean
    public IssuanceEngine issuanceEngine(
            BondingCurvePricer pricer,
            @Value("${xmbl.issuance.max-units-per-deposit:0}") long maxUnitsPerDeposit) {
        return new IssuanceEngine(pricer, maxUnitsPerDeposit);
    }

    @Bean
    public DistributionEngine distributionEngine(
            @Value("${xmbl.distribution.minimum-yield:1}") BigInteger minimumYield) {
        return new DistributionEngine(minimumYield);
    }

    @Bean
    public ProtocolFeeSchedule protocolFeeSchedule(DistributionFeeProperties properties) {
        ProtocolFeeSchedule schedule = new ProtocolFeeSchedule(properties.toFeeTiers());
        log.info("Protocol fee tiers configured: {}", schedule.getTiers());
        return schedule;
    }

    @Bean
    public OwnershipEngine ownershipEngine(BondingCurvePricer pricer) {
        return new OwnershipEngine(pricer);
    }

    @Bean
    public XmblLedger xmblLedger(ShareStore shareStore,
                                 IssuanceEngine issuanceEngine,
                                 DistributionEngine distributionEngine,
                                 OwnershipEngine ownershipEngine,
                                 LedgerEventSink eventSink) {
        return new XmblLedger(shareStore, issuanceEngine, distributionEngine, ownershipEngine, eventSink);
    }
}
