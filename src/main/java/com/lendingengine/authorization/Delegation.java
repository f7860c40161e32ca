package com.lendingengine.authorization;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Permission of a delegate to withdraw, borrow and withdraw collateral on an
 * authorizer's behalf. No expiry; the authorizer may revoke it at any time.
 */
@Entity
@Table(name = "delegations", indexes = {
    @Index(name = "idx_delegation_authorizer", columnList = "authorizer")
})
@Data
@NoArgsConstructor
public class Delegation {

    @Id
    @Column(length = 85)
    private String delegationId;

    @Column(length = 42, nullable = false)
    private String authorizer;

    @Column(length = 42, nullable = false)
    private String authorized;

    private boolean enabled;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public Delegation(String authorizer, String authorized) {
        this.delegationId = key(authorizer, authorized);
        this.authorizer = authorizer;
        this.authorized = authorized;
    }

    public static String key(String authorizer, String authorized) {
        return authorizer + "/" + authorized;
    }
}
