package com.lendingengine.authorization;

import com.lendingengine.common.Addresses;
import com.lendingengine.common.LedgerLock;
import com.lendingengine.common.exception.ErrorCode;
import com.lendingengine.common.exception.InvalidInputException;
import com.lendingengine.common.exception.InvalidSignatureException;
import com.lendingengine.common.exception.UnauthorizedException;
import com.lendingengine.ledger.EventRecorder;
import com.lendingengine.ledger.EventType;
import com.lendingengine.ledger.LedgerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.security.SignatureException;
import java.time.Clock;
import java.util.List;

/**
 * Service for delegated authorization.
 *
 * An account may authorize delegates to withdraw, borrow and withdraw collateral on its
 * behalf, either directly or by signing a {@link SignedAuthorization} that anyone submits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthorizationService {

    private final DelegationRepository delegationRepository;
    private final AuthorizationNonceRepository nonceRepository;
    private final EventRecorder eventRecorder;
    private final LedgerLock ledgerLock;
    private final Clock clock;

    @Transactional
    public void setAuthorization(String caller, String delegate, boolean enabled) {
        String authorizer = Addresses.normalize(caller);
        String authorized = Addresses.normalize(delegate);

        ledgerLock.acquire();
        apply(authorizer, authorized, enabled, authorizer);
    }

    @Transactional
    public void setAuthorizationWithSig(SignedAuthorization authorization, Sign.SignatureData signature) {
        String authorizer = Addresses.normalize(authorization.getAuthorizer());
        String authorized = Addresses.normalize(authorization.getAuthorized());

        ledgerLock.acquire();
        long now = clock.instant().getEpochSecond();
        if (now > authorization.getDeadline()) {
            throw new InvalidSignatureException(ErrorCode.SIGNATURE_EXPIRED,
                "Signature expired at " + authorization.getDeadline());
        }

        AuthorizationNonce nonce = nonceRepository.findById(authorizer)
            .orElseGet(() -> new AuthorizationNonce(authorizer));
        if (authorization.getNonce() != nonce.getNonce()) {
            throw new InvalidSignatureException(ErrorCode.INVALID_NONCE,
                String.format("Invalid nonce %d for %s, expected %d",
                    authorization.getNonce(), authorizer, nonce.getNonce()));
        }

        String signer = recoverSigner(authorization.digest(), signature);
        if (!authorizer.equals(signer)) {
            throw new InvalidSignatureException(ErrorCode.INVALID_SIGNATURE,
                "Signature was not produced by " + authorizer);
        }

        nonce.setNonce(nonce.getNonce() + 1);
        nonceRepository.save(nonce);
        eventRecorder.record(LedgerEvent.builder()
            .eventType(EventType.INCREMENT_NONCE)
            .caller(signer)
            .onBehalf(authorizer)
            .shares(BigInteger.valueOf(authorization.getNonce())));

        apply(authorizer, authorized, authorization.isEnabled(), signer);
    }

    @Transactional(readOnly = true)
    public boolean isAuthorized(String authorizer, String authorized) {
        return delegationRepository.findById(Delegation.key(Addresses.normalize(authorizer), Addresses.normalize(authorized)))
            .map(Delegation::isEnabled)
            .orElse(false);
    }

    /**
     * Fails with {@link UnauthorizedException} unless the caller is the account itself
     * or one of its delegates.
     */
    @Transactional(readOnly = true)
    public void requireSenderAuthorized(String caller, String onBehalf, String action) {
        String sender = Addresses.normalize(caller);
        String account = Addresses.normalize(onBehalf);
        if (!sender.equals(account) && !isAuthorized(account, sender)) {
            log.warn("Rejected {} by {} on behalf of {}", action, sender, account);
            throw new UnauthorizedException(sender, action + " on behalf of " + account);
        }
    }

    @Transactional(readOnly = true)
    public long nonce(String authorizer) {
        return nonceRepository.findById(Addresses.normalize(authorizer))
            .map(AuthorizationNonce::getNonce)
            .orElse(0L);
    }

    @Transactional(readOnly = true)
    public List<Delegation> delegatesOf(String authorizer) {
        return delegationRepository.findByAuthorizerAndEnabledTrue(Addresses.normalize(authorizer));
    }

    private void apply(String authorizer, String authorized, boolean enabled, String caller) {
        Delegation delegation = delegationRepository.findById(Delegation.key(authorizer, authorized))
            .orElseGet(() -> new Delegation(authorizer, authorized));
        if (delegation.isEnabled() == enabled) {
            throw InvalidInputException.alreadySet("authorization of " + authorized);
        }
        delegation.setEnabled(enabled);
        delegation.setUpdatedAt(clock.instant());
        delegationRepository.save(delegation);

        eventRecorder.record(LedgerEvent.builder()
            .eventType(EventType.SET_AUTHORIZATION)
            .caller(caller)
            .onBehalf(authorizer)
            .subject(authorized)
            .description(enabled ? "authorized" : "revoked"));

        log.info("{} {} as delegate of {}", enabled ? "Authorized" : "Revoked", authorized, authorizer);
    }

    private String recoverSigner(byte[] digest, Sign.SignatureData signature) {
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(digest, signature);
            return Addresses.normalize("0x" + Keys.getAddress(publicKey));
        } catch (SignatureException | IllegalArgumentException e) {
            throw new InvalidSignatureException("Malformed signature: " + e.getMessage(), e);
        }
    }
}
