package com.flagship.xmbl_ledger.event;

/**
 * Receives the event of each successful mutation, inside the same
 * serialization boundary as the mutation itself.
 */
@FunctionalInterface
public interface LedgerEventSink {

    void publish(LedgerEvent event);
}
