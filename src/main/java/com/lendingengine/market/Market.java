package com.lendingengine.market;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Pooled state of one lending market.
 *
 * Supply and borrow sides each track assets and the shares that divide them.
 * totalBorrowAssets never exceeds totalSupplyAssets once an operation completes.
 */
@Entity
@Table(name = "markets")
@Data
@NoArgsConstructor
public class Market {

    @Id
    @Column(length = 66)
    private String marketId;

    @Embedded
    private MarketParams params;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger totalSupplyAssets = BigInteger.ZERO;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger totalSupplyShares = BigInteger.ZERO;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger totalBorrowAssets = BigInteger.ZERO;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger totalBorrowShares = BigInteger.ZERO;

    /**
     * Epoch second of the last interest accrual.
     */
    private long lastUpdate;

    /**
     * Share of accrued interest minted to the fee recipient, WAD-scaled.
     */
    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger fee = BigInteger.ZERO;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private Long version;

    public Market(String marketId, MarketParams params, long now) {
        this.marketId = marketId;
        this.params = params;
        this.lastUpdate = now;
        this.createdAt = Instant.ofEpochSecond(now);
    }

    public boolean isLiquid() {
        return totalBorrowAssets.compareTo(totalSupplyAssets) <= 0;
    }
}
