package com.lendingengine.authorization;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DelegationRepository extends JpaRepository<Delegation, String> {

    List<Delegation> findByAuthorizerAndEnabledTrue(String authorizer);
}
