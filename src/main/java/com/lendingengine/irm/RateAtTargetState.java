package com.lendingengine.irm;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Adaptive state of the curve model for one market.
 */
@Entity
@Table(name = "irm_rate_at_target")
@Data
@NoArgsConstructor
public class RateAtTargetState {

    @Id
    @Column(length = 66)
    private String marketId;

    /**
     * Per-second rate paid at target utilization, WAD-scaled.
     */
    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger rateAtTarget;

    private long lastUpdate;

    public RateAtTargetState(String marketId, BigInteger rateAtTarget, long lastUpdate) {
        this.marketId = marketId;
        this.rateAtTarget = rateAtTarget;
        this.lastUpdate = lastUpdate;
    }
}
