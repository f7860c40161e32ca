package com.lendingengine.governance;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A rate model address or LLTV value the owner has enabled for market creation.
 * Entries are never removed.
 */
@Entity
@Table(name = "allow_list")
@Data
@NoArgsConstructor
public class AllowListEntry {

    @Id
    private String entryId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Kind kind;

    @Column(name = "entry_value", nullable = false)
    private String value;

    @Column(name = "enabled_at", nullable = false, updatable = false)
    private Instant enabledAt;

    public AllowListEntry(Kind kind, String value, Instant enabledAt) {
        this.entryId = key(kind, value);
        this.kind = kind;
        this.value = value;
        this.enabledAt = enabledAt;
    }

    public static String key(Kind kind, String value) {
        return kind.name() + ":" + value;
    }

    public enum Kind {
        IRM,
        LLTV
    }
}
