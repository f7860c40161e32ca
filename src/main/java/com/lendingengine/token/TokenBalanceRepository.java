package com.lendingengine.token;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TokenBalanceRepository extends JpaRepository<TokenBalance, String> {

    List<TokenBalance> findByHolder(String holder);
}
