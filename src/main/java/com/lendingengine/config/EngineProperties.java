package com.lendingengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "lending-engine")
@Data
public class EngineProperties {

    /**
     * Account that custodies every token deposited into the engine.
     */
    private String address;

    /**
     * Owner installed at first start; later changes go through setOwner.
     */
    private String owner;

    private String feeRecipient = "0x0000000000000000000000000000000000000000";

    /**
     * LLTVs (WAD-scaled) enabled at first start.
     */
    private List<BigInteger> enabledLltvs = new ArrayList<>();

    /**
     * Rate model addresses enabled at first start. The zero address means "no interest".
     */
    private List<String> enabledIrms = new ArrayList<>();

    private AdaptiveCurve adaptiveCurve = new AdaptiveCurve();

    private List<FixedOracle> fixedOracles = new ArrayList<>();

    @Data
    public static class AdaptiveCurve {
        private String address;
    }

    @Data
    public static class FixedOracle {
        private String address;
        private BigInteger price;
    }
}
