package com.lendingengine.authorization;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AuthorizationNonceRepository extends JpaRepository<AuthorizationNonce, String> {
}
