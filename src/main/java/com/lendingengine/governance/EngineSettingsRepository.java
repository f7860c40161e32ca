package com.lendingengine.governance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EngineSettingsRepository extends JpaRepository<EngineSettings, String> {
}
