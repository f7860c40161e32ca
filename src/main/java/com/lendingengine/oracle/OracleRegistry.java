package com.lendingengine.oracle;

import com.lendingengine.common.Addresses;
import com.lendingengine.common.exception.OracleUnavailableException;
import com.lendingengine.common.exception.UnknownOracleException;
import com.lendingengine.config.EngineProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves oracle addresses referenced by market params to price feeds.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OracleRegistry {

    private final EngineProperties properties;

    private final Map<String, Oracle> oracles = new ConcurrentHashMap<>();

    @PostConstruct
    void registerConfiguredOracles() {
        for (EngineProperties.FixedOracle cfg : properties.getFixedOracles()) {
            register(cfg.getAddress(), new FixedPriceOracle(cfg.getPrice()));
        }
    }

    public void register(String address, Oracle oracle) {
        String key = Addresses.requireNonZero(address, "oracle");
        oracles.put(key, oracle);
        log.info("Registered oracle {} ({})", key, oracle.getClass().getSimpleName());
    }

    public Oracle resolve(String address) {
        Oracle oracle = oracles.get(Addresses.normalize(address));
        if (oracle == null) {
            throw new UnknownOracleException(address);
        }
        return oracle;
    }

    /**
     * Read the current price. Any failure of the feed, including a missing or zero price,
     * is reported as {@link OracleUnavailableException}.
     */
    public BigInteger price(String address) {
        Oracle oracle = resolve(address);
        BigInteger price;
        try {
            price = oracle.price();
        } catch (RuntimeException e) {
            log.warn("Oracle {} failed: {}", address, e.getMessage());
            throw new OracleUnavailableException(address, e);
        }
        if (price == null) {
            throw new OracleUnavailableException(address, "no price returned");
        }
        if (price.signum() <= 0) {
            log.warn("Oracle {} returned non-positive price {}", address, price);
            throw new OracleUnavailableException(address, "non-positive price " + price);
        }
        return price;
    }
}
