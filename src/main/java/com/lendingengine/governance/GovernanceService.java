package com.lendingengine.governance;

import com.lendingengine.common.Addresses;
import com.lendingengine.common.LedgerLock;
import com.lendingengine.common.exception.InvalidInputException;
import com.lendingengine.common.exception.UnauthorizedException;
import com.lendingengine.ledger.EventRecorder;
import com.lendingengine.ledger.EventType;
import com.lendingengine.ledger.LedgerEvent;
import com.lendingengine.math.MathLib;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

/**
 * Owner-gated settings: ownership, fee recipient and the rate model / LLTV allow-lists.
 *
 * Market fees are set through the engine because changing them requires an accrual first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GovernanceService {

    private final EngineSettingsRepository settingsRepository;
    private final AllowListRepository allowListRepository;
    private final EventRecorder eventRecorder;
    private final LedgerLock ledgerLock;
    private final Clock clock;

    @Transactional(readOnly = true)
    public String owner() {
        return settings().getOwner();
    }

    @Transactional(readOnly = true)
    public String feeRecipient() {
        return settings().getFeeRecipient();
    }

    public void requireOwner(String caller, String action) {
        if (!owner().equals(Addresses.normalize(caller))) {
            throw new UnauthorizedException(caller, action);
        }
    }

    @Transactional
    public void setOwner(String caller, String newOwner) {
        ledgerLock.acquire();
        requireOwner(caller, "set owner");
        EngineSettings settings = settings();
        String owner = Addresses.normalize(newOwner);
        if (owner.equals(settings.getOwner())) {
            throw InvalidInputException.alreadySet("owner");
        }
        settings.setOwner(owner);
        settings.setUpdatedAt(clock.instant());
        settingsRepository.save(settings);

        eventRecorder.record(LedgerEvent.builder()
            .eventType(EventType.SET_OWNER)
            .caller(Addresses.normalize(caller))
            .subject(owner));
        log.info("Owner changed to {}", owner);
    }

    @Transactional
    public void setFeeRecipient(String caller, String newFeeRecipient) {
        ledgerLock.acquire();
        requireOwner(caller, "set fee recipient");
        EngineSettings settings = settings();
        String recipient = Addresses.normalize(newFeeRecipient);
        if (recipient.equals(settings.getFeeRecipient())) {
            throw InvalidInputException.alreadySet("feeRecipient");
        }
        settings.setFeeRecipient(recipient);
        settings.setUpdatedAt(clock.instant());
        settingsRepository.save(settings);

        eventRecorder.record(LedgerEvent.builder()
            .eventType(EventType.SET_FEE_RECIPIENT)
            .caller(Addresses.normalize(caller))
            .subject(recipient));
        log.info("Fee recipient changed to {}", recipient);
    }

    @Transactional
    public void enableIrm(String caller, String irm) {
        ledgerLock.acquire();
        requireOwner(caller, "enable rate model");
        String value = Addresses.normalize(irm);
        String key = AllowListEntry.key(AllowListEntry.Kind.IRM, value);
        if (allowListRepository.existsById(key)) {
            throw InvalidInputException.alreadySet("irm " + value);
        }
        allowListRepository.save(new AllowListEntry(AllowListEntry.Kind.IRM, value, clock.instant()));

        eventRecorder.record(LedgerEvent.builder()
            .eventType(EventType.ENABLE_IRM)
            .caller(Addresses.normalize(caller))
            .subject(value));
        log.info("Enabled rate model {}", value);
    }

    @Transactional
    public void enableLltv(String caller, BigInteger lltv) {
        ledgerLock.acquire();
        requireOwner(caller, "enable LLTV");
        if (lltv.signum() < 0) {
            throw InvalidInputException.negativeAmount("lltv", lltv);
        }
        if (lltv.compareTo(MathLib.WAD) >= 0) {
            throw InvalidInputException.lltvTooHigh(lltv);
        }
        String key = AllowListEntry.key(AllowListEntry.Kind.LLTV, lltv.toString());
        if (allowListRepository.existsById(key)) {
            throw InvalidInputException.alreadySet("lltv " + lltv);
        }
        allowListRepository.save(new AllowListEntry(AllowListEntry.Kind.LLTV, lltv.toString(), clock.instant()));

        eventRecorder.record(LedgerEvent.builder()
            .eventType(EventType.ENABLE_LLTV)
            .caller(Addresses.normalize(caller))
            .assets(lltv));
        log.info("Enabled LLTV {}", lltv);
    }

    @Transactional(readOnly = true)
    public boolean isIrmEnabled(String irm) {
        return allowListRepository.existsById(AllowListEntry.key(AllowListEntry.Kind.IRM, Addresses.normalize(irm)));
    }

    @Transactional(readOnly = true)
    public boolean isLltvEnabled(BigInteger lltv) {
        return allowListRepository.existsById(AllowListEntry.key(AllowListEntry.Kind.LLTV, lltv.toString()));
    }

    @Transactional(readOnly = true)
    public List<AllowListEntry> allowList(AllowListEntry.Kind kind) {
        return allowListRepository.findByKind(kind);
    }

    private EngineSettings settings() {
        return settingsRepository.findById(EngineSettings.SINGLETON_ID)
            .orElseThrow(() -> new IllegalStateException("Engine settings not initialized"));
    }
}
