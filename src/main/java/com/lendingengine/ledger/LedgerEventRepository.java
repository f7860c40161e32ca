package com.lendingengine.ledger;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ledger events.
 */
@Repository
public interface LedgerEventRepository extends JpaRepository<LedgerEvent, String> {

    List<LedgerEvent> findByMarketIdOrderByCreatedAtAsc(String marketId);

    List<LedgerEvent> findByMarketIdAndEventType(String marketId, EventType eventType);

    List<LedgerEvent> findByOnBehalfOrderByCreatedAtDesc(String onBehalf);
}
