package com.lendingengine.irm;

import com.lendingengine.common.Addresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves rate model addresses referenced by market params.
 *
 * Every {@link RateModel} bean is registered at startup; further models can be
 * registered at runtime. The zero address resolves to no model (interest-free market).
 */
@Service
@Slf4j
public class RateModelRegistry {

    private final Map<String, RateModel> models = new ConcurrentHashMap<>();

    public RateModelRegistry(List<RateModel> beans) {
        beans.forEach(this::register);
    }

    public void register(RateModel model) {
        String key = Addresses.requireNonZero(model.getAddress(), "irm");
        RateModel previous = models.putIfAbsent(key, model);
        if (previous != null && previous != model) {
            throw new IllegalStateException("Rate model already registered at " + key);
        }
        log.info("Registered rate model {} ({})", key, model.getClass().getSimpleName());
    }

    /**
     * @return the model at the address, empty for the zero address
     * @throws IllegalStateException if a non-zero address has no model
     */
    public Optional<RateModel> resolve(String address) {
        if (Addresses.isZero(address)) {
            return Optional.empty();
        }
        RateModel model = models.get(Addresses.normalize(address));
        if (model == null) {
            throw new IllegalStateException("No rate model registered at " + address);
        }
        return Optional.of(model);
    }

    public boolean isRegistered(String address) {
        return Addresses.isZero(address) || models.containsKey(Addresses.normalize(address));
    }
}
