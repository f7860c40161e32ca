package com.lendingengine.market;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * An account's stake in one market.
 *
 * Supply and borrow are share-denominated; collateral is held in raw units of
 * the collateral token.
 */
@Entity
@Table(name = "positions", indexes = {
    @Index(name = "idx_position_market_id", columnList = "market_id"),
    @Index(name = "idx_position_account", columnList = "account")
})
@Data
@NoArgsConstructor
public class Position {

    @Id
    @Column(length = 109)
    private String positionId;

    @Column(name = "market_id", length = 66, nullable = false)
    private String marketId;

    @Column(length = 42, nullable = false)
    private String account;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger supplyShares = BigInteger.ZERO;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger borrowShares = BigInteger.ZERO;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger collateral = BigInteger.ZERO;

    public Position(String marketId, String account) {
        this.positionId = key(marketId, account);
        this.marketId = marketId;
        this.account = account;
    }

    public static String key(String marketId, String account) {
        return marketId + "/" + account;
    }
}
