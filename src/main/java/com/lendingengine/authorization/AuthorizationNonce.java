package com.lendingengine.authorization;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Next nonce expected in a signed authorization from this authorizer.
 */
@Entity
@Table(name = "authorization_nonces")
@Data
@NoArgsConstructor
public class AuthorizationNonce {

    @Id
    @Column(length = 42)
    private String authorizer;

    private long nonce;

    public AuthorizationNonce(String authorizer) {
        this.authorizer = authorizer;
    }
}
