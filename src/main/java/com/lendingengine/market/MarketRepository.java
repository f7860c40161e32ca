package com.lendingengine.market;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for market state, keyed by market identifier.
 */
@Repository
public interface MarketRepository extends JpaRepository<Market, String> {
}
