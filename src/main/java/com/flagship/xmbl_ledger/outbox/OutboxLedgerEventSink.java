package com.flagship.xmbl_ledger.outbox;

import com.flagship.xmbl_ledger.event.LedgerEvent;
import com.flagship.xmbl_ledger.event.LedgerEventSink;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Routes ledger events into the transactional outbox.
 */
@Component
@RequiredArgsConstructor
public class OutboxLedgerEventSink implements LedgerEventSink {

    private final OutboxService outboxService;

    @Override
    public void publish(LedgerEvent event) {
        outboxService.saveEvent(event);
    }
}
