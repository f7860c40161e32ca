package com.lendingengine.ledger;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Immutable record of one committed state change.
 *
 * Events are append-only and written in the same transaction as the change they
 * describe, so a rolled-back operation leaves no event behind.
 */
@Entity
@Table(name = "ledger_events", indexes = {
    @Index(name = "idx_event_market_id", columnList = "market_id"),
    @Index(name = "idx_event_caller", columnList = "caller"),
    @Index(name = "idx_event_on_behalf", columnList = "on_behalf")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEvent {

    @Id
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private EventType eventType;

    @Column(name = "market_id", length = 66)
    private String marketId;

    @Column(length = 42)
    private String caller;

    /**
     * Account whose position changed (borrower for liquidations, authorizer for authorizations).
     */
    @Column(name = "on_behalf", length = 42)
    private String onBehalf;

    @Column(length = 42)
    private String receiver;

    /**
     * Token for flash loans, delegate for authorizations, new value for address settings.
     */
    @Column(length = 66)
    private String subject;

    @Column(precision = 78, scale = 0)
    private BigInteger assets;

    @Column(precision = 78, scale = 0)
    private BigInteger shares;

    @Column(precision = 78, scale = 0)
    private BigInteger secondaryAssets;

    @Column(precision = 78, scale = 0)
    private BigInteger secondaryShares;

    private String description;

    /**
     * Engine time (epoch second) at which the change took effect.
     */
    private long timestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
