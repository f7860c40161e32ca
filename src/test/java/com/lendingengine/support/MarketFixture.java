package com.lendingengine.support;

import com.lendingengine.engine.LendingEngine;
import com.lendingengine.irm.FixedRateModel;
import com.lendingengine.irm.RateModelRegistry;
import com.lendingengine.market.MarketParams;
import com.lendingengine.oracle.FixedPriceOracle;
import com.lendingengine.oracle.OracleRegistry;
import com.lendingengine.token.TokenLedgerService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Creates markets with fresh tokens and oracles so tests never share state.
 */
@Component
public class MarketFixture {

    public static final String ENGINE = "0x1000000000000000000000000000000000000001";
    public static final String OWNER = "0x1000000000000000000000000000000000000002";
    public static final String FEE_RECIPIENT = "0x1000000000000000000000000000000000000003";
    public static final String ADAPTIVE_IRM = "0x1000000000000000000000000000000000000004";
    public static final String FIXED_IRM = "0x1000000000000000000000000000000000000005";
    public static final String NO_IRM = "0x0000000000000000000000000000000000000000";

    public static final BigInteger WAD = BigInteger.TEN.pow(18);
    public static final BigInteger LLTV_80 = new BigInteger("800000000000000000");

    /** 1e10 per second. */
    public static final BigInteger FIXED_RATE = BigInteger.TEN.pow(10);

    private static final SecureRandom RANDOM = new SecureRandom();

    @Autowired
    private LendingEngine lendingEngine;

    @Autowired
    private OracleRegistry oracleRegistry;

    @Autowired
    private RateModelRegistry rateModelRegistry;

    @Autowired
    private TokenLedgerService tokenLedger;

    public static String randomAddress() {
        byte[] bytes = new byte[20];
        RANDOM.nextBytes(bytes);
        StringBuilder sb = new StringBuilder("0x");
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    /**
     * Price in loan units per collateral unit, scaled to the oracle scale.
     */
    public static BigInteger price(long loanPerCollateral) {
        return BigInteger.valueOf(loanPerCollateral).multiply(BigInteger.TEN.pow(36));
    }

    public TestMarket createMarket(String irm, BigInteger lltv, BigInteger price) {
        if (FIXED_IRM.equals(irm) && !rateModelRegistry.isRegistered(FIXED_IRM)) {
            rateModelRegistry.register(new FixedRateModel(FIXED_IRM, FIXED_RATE));
        }
        String oracleAddress = randomAddress();
        FixedPriceOracle oracle = new FixedPriceOracle(price);
        oracleRegistry.register(oracleAddress, oracle);

        MarketParams params = MarketParams.builder()
            .loanToken(randomAddress())
            .collateralToken(randomAddress())
            .oracle(oracleAddress)
            .irm(irm)
            .lltv(lltv)
            .build();
        String marketId = lendingEngine.createMarket(randomAddress(), params);
        return new TestMarket(params, marketId, oracle);
    }

    /**
     * Interest-free market at LLTV 0.8 and a price of 2000.
     */
    public TestMarket createDefaultMarket() {
        return createMarket(NO_IRM, LLTV_80, price(2000));
    }

    public String fundedAccount(String token, long amount) {
        return fundedAccount(token, BigInteger.valueOf(amount));
    }

    public String fundedAccount(String token, BigInteger amount) {
        String account = randomAddress();
        tokenLedger.mint(token, account, amount);
        return account;
    }

    public void mint(String token, String to, long amount) {
        tokenLedger.mint(token, to, BigInteger.valueOf(amount));
    }

    public BigInteger balance(String token, String holder) {
        return tokenLedger.balanceOf(token, holder);
    }

    public static final class TestMarket {
        private final MarketParams params;
        private final String marketId;
        private final FixedPriceOracle oracle;

        TestMarket(MarketParams params, String marketId, FixedPriceOracle oracle) {
            this.params = params;
            this.marketId = marketId;
            this.oracle = oracle;
        }

        public MarketParams params() {
            return params;
        }

        public String id() {
            return marketId;
        }

        public FixedPriceOracle oracle() {
            return oracle;
        }

        public String loanToken() {
            return params.getLoanToken();
        }

        public String collateralToken() {
            return params.getCollateralToken();
        }
    }
}
