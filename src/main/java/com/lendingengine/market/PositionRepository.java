package com.lendingengine.market;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PositionRepository extends JpaRepository<Position, String> {

    List<Position> findByMarketId(String marketId);

    List<Position> findByAccount(String account);
}
