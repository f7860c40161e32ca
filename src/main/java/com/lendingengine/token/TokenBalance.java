package com.lendingengine.token;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;

@Entity
@Table(name = "token_balances", indexes = {
    @Index(name = "idx_token_balance_holder", columnList = "holder")
})
@Data
@NoArgsConstructor
public class TokenBalance {

    @Id
    @Column(length = 85)
    private String balanceId;

    @Column(length = 42, nullable = false)
    private String token;

    @Column(length = 42, nullable = false)
    private String holder;

    @Column(precision = 78, scale = 0, nullable = false)
    private BigInteger balance = BigInteger.ZERO;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public TokenBalance(String token, String holder, Instant createdAt) {
        this.balanceId = key(token, holder);
        this.token = token;
        this.holder = holder;
        this.updatedAt = createdAt;
    }

    public static String key(String token, String holder) {
        return token + "/" + holder;
    }

    public void credit(BigInteger amount, Instant at) {
        this.balance = this.balance.add(amount);
        this.updatedAt = at;
    }

    public void debit(BigInteger amount, Instant at) {
        this.balance = this.balance.subtract(amount);
        this.updatedAt = at;
    }
}
