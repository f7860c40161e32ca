package com.lendingengine.governance;

import com.lendingengine.common.Addresses;
import com.lendingengine.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;

/**
 * Installs the configured owner, fee recipient and allow-lists on first start.
 * Existing settings are left untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GovernanceInitializer implements ApplicationRunner {

    private final EngineProperties properties;
    private final EngineSettingsRepository settingsRepository;
    private final AllowListRepository allowListRepository;
    private final Clock clock;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (settingsRepository.existsById(EngineSettings.SINGLETON_ID)) {
            log.info("Engine settings already initialized");
            return;
        }

        String owner = Addresses.requireNonZero(properties.getOwner(), "owner");
        String feeRecipient = Addresses.normalize(properties.getFeeRecipient());
        Instant now = clock.instant();
        settingsRepository.save(new EngineSettings(owner, feeRecipient, now));

        for (String irm : properties.getEnabledIrms()) {
            allowListRepository.save(new AllowListEntry(AllowListEntry.Kind.IRM, Addresses.normalize(irm), now));
        }
        for (BigInteger lltv : properties.getEnabledLltvs()) {
            allowListRepository.save(new AllowListEntry(AllowListEntry.Kind.LLTV, lltv.toString(), now));
        }

        log.info("Initialized engine settings: owner={}, feeRecipient={}, irms={}, lltvs={}",
            owner, feeRecipient, properties.getEnabledIrms(), properties.getEnabledLltvs());
    }
}
