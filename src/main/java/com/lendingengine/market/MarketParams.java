package com.lendingengine.market;

import com.lendingengine.common.Addresses;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigInteger;

/**
 * Identity of a lending market.
 *
 * The five fields are immutable once a market exists; the market identifier is
 * derived from them by {@link MarketId#of(MarketParams)}.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MarketParams {

    @Column(name = "loan_token", length = 42, nullable = false)
    private String loanToken;

    @Column(name = "collateral_token", length = 42, nullable = false)
    private String collateralToken;

    @Column(name = "oracle", length = 42, nullable = false)
    private String oracle;

    @Column(name = "irm", length = 42, nullable = false)
    private String irm;

    /**
     * Liquidation loan-to-value, WAD-scaled.
     */
    @Column(name = "lltv", precision = 78, scale = 0, nullable = false)
    private BigInteger lltv;

    @Builder
    public MarketParams(String loanToken, String collateralToken, String oracle, String irm, BigInteger lltv) {
        if (lltv == null) {
            throw new IllegalArgumentException("LLTV cannot be null");
        }
        this.loanToken = Addresses.normalize(loanToken);
        this.collateralToken = Addresses.normalize(collateralToken);
        this.oracle = Addresses.normalize(oracle);
        this.irm = Addresses.normalize(irm);
        this.lltv = lltv;
    }

    public String id() {
        return MarketId.of(this);
    }
}
