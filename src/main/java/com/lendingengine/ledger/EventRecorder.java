package com.lendingengine.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Appends state-change records to the event log.
 *
 * Recording joins the caller's transaction: the record commits or rolls back
 * together with the change it describes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventRecorder {

    private final LedgerEventRepository eventRepository;
    private final Clock clock;

    @Transactional
    public LedgerEvent record(LedgerEvent.LedgerEventBuilder builder) {
        Instant now = clock.instant();
        LedgerEvent event = builder
            .eventId(UUID.randomUUID().toString())
            .timestamp(now.getEpochSecond())
            .createdAt(now)
            .build();
        eventRepository.save(event);

        log.debug("Recorded {}: market={}, onBehalf={}, assets={}, shares={}",
            event.getEventType(), event.getMarketId(), event.getOnBehalf(), event.getAssets(), event.getShares());

        return event;
    }

    @Transactional(readOnly = true)
    public List<LedgerEvent> getMarketEvents(String marketId) {
        return eventRepository.findByMarketIdOrderByCreatedAtAsc(marketId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEvent> getMarketEvents(String marketId, EventType eventType) {
        return eventRepository.findByMarketIdAndEventType(marketId, eventType);
    }

    @Transactional(readOnly = true)
    public List<LedgerEvent> getAccountEvents(String account) {
        return eventRepository.findByOnBehalfOrderByCreatedAtDesc(account);
    }
}
