package com.lendingengine.token;

import com.lendingengine.common.Addresses;
import com.lendingengine.common.LedgerLock;
import com.lendingengine.common.exception.TransferFailedException;
import com.lendingengine.config.EngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Internal token ledger backing {@link AssetTransfer}.
 *
 * Balances are persisted per (token, holder). Tokens enter the system through
 * {@link #mint}; the engine's custody account is {@code lending-engine.address}.
 * Holders may register a {@link TransferHook} that runs after they are credited.
 * Balance changes hold the {@link LedgerLock} until the surrounding transaction ends.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenLedgerService implements AssetTransfer {

    private final TokenBalanceRepository balanceRepository;
    private final EngineProperties properties;
    private final LedgerLock ledgerLock;
    private final Clock clock;

    private final Map<String, TransferHook> hooks = new ConcurrentHashMap<>();

    @Override
    @Transactional
    public void transfer(String token, String to, BigInteger amount) {
        ledgerLock.acquire();
        move(token, Addresses.normalize(properties.getAddress()), to, amount);
    }

    @Override
    @Transactional
    public void transferFrom(String token, String from, String to, BigInteger amount) {
        ledgerLock.acquire();
        move(token, from, to, amount);
    }

    @Transactional
    public void mint(String token, String to, BigInteger amount) {
        String tokenKey = Addresses.requireNonZero(token, "token");
        String holder = Addresses.requireNonZero(to, "to");
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Mint amount must be positive: " + amount);
        }
        ledgerLock.acquire();
        TokenBalance balance = load(tokenKey, holder);
        balance.credit(amount, clock.instant());
        balanceRepository.save(balance);
        log.info("Minted {} {} to {}", amount, tokenKey, holder);
    }

    @Transactional(readOnly = true)
    public BigInteger balanceOf(String token, String holder) {
        return balanceRepository.findById(TokenBalance.key(Addresses.normalize(token), Addresses.normalize(holder)))
            .map(TokenBalance::getBalance)
            .orElse(BigInteger.ZERO);
    }

    @Transactional(readOnly = true)
    public List<TokenBalance> balancesOf(String holder) {
        return balanceRepository.findByHolder(Addresses.normalize(holder));
    }

    public void registerHook(String holder, TransferHook hook) {
        hooks.put(Addresses.normalize(holder), hook);
    }

    public void removeHook(String holder) {
        hooks.remove(Addresses.normalize(holder));
    }

    private void move(String token, String from, String to, BigInteger amount) {
        String tokenKey = Addresses.normalize(token);
        String sender = Addresses.normalize(from);
        String receiver = Addresses.normalize(to);

        if (amount.signum() < 0) {
            throw new TransferFailedException(tokenKey, sender, receiver, amount, "negative amount");
        }
        if (amount.signum() == 0) {
            return;
        }
        if (Addresses.ZERO.equals(receiver)) {
            throw new TransferFailedException(tokenKey, sender, receiver, amount, "transfer to the zero address");
        }

        TokenBalance source = load(tokenKey, sender);
        if (source.getBalance().compareTo(amount) < 0) {
            log.warn("Transfer of {} {} from {} rejected: balance {}", amount, tokenKey, sender, source.getBalance());
            throw new TransferFailedException(tokenKey, sender, receiver, amount,
                "insufficient balance " + source.getBalance());
        }
        source.debit(amount, clock.instant());
        balanceRepository.save(source);

        TokenBalance target = load(tokenKey, receiver);
        target.credit(amount, clock.instant());
        balanceRepository.save(target);

        log.debug("Transferred {} {} from {} to {}", amount, tokenKey, sender, receiver);

        TransferHook hook = hooks.get(receiver);
        if (hook != null) {
            hook.onTokensReceived(tokenKey, sender, amount);
        }
    }

    private TokenBalance load(String token, String holder) {
        return balanceRepository.findById(TokenBalance.key(token, holder))
            .orElseGet(() -> balanceRepository.save(new TokenBalance(token, holder, clock.instant())));
    }
}
