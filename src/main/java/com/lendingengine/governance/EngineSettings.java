package com.lendingengine.governance;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Singleton row holding the engine owner and fee recipient.
 */
@Entity
@Table(name = "engine_settings")
@Data
@NoArgsConstructor
public class EngineSettings {

    public static final String SINGLETON_ID = "engine";

    @Id
    private String settingsId;

    @Column(length = 42, nullable = false)
    private String owner;

    @Column(length = 42, nullable = false)
    private String feeRecipient;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public EngineSettings(String owner, String feeRecipient, Instant updatedAt) {
        this.settingsId = SINGLETON_ID;
        this.owner = owner;
        this.feeRecipient = feeRecipient;
        this.updatedAt = updatedAt;
    }
}
