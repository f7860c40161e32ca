package com.lendingengine.irm;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RateAtTargetStateRepository extends JpaRepository<RateAtTargetState, String> {
}
