package com.lendingengine.irm;

import com.lendingengine.config.EngineProperties;
import com.lendingengine.market.Market;
import com.lendingengine.market.MarketParams;
import com.lendingengine.math.MathLib;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the adaptive curve model's state handling.
 */
@ExtendWith(MockitoExtension.class)
class AdaptiveCurveRateModelTest {

    private static final String IRM = "0x1000000000000000000000000000000000000004";
    private static final long NOW = 1_700_000_000L;

    @Mock
    private RateAtTargetStateRepository stateRepository;

    private AdaptiveCurveRateModel model;
    private MarketParams params;
    private Market market;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.getAdaptiveCurve().setAddress(IRM);
        Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
        model = new AdaptiveCurveRateModel(properties, stateRepository, clock);

        params = MarketParams.builder()
            .loanToken("0x00000000000000000000000000000000000000a1")
            .collateralToken("0x00000000000000000000000000000000000000b2")
            .oracle("0x00000000000000000000000000000000000000c3")
            .irm(IRM)
            .lltv(new BigInteger("800000000000000000"))
            .build();
        market = new Market(params.id(), params, NOW - 100);
    }

    @Test
    void testFirstQueryStartsAtInitialRate() {
        market.setTotalSupplyAssets(BigInteger.valueOf(100));
        market.setTotalBorrowAssets(BigInteger.valueOf(90));
        when(stateRepository.findById(market.getMarketId())).thenReturn(Optional.empty());

        BigInteger rate = model.borrowRate(params, market);

        assertEquals(AdaptiveCurve.INITIAL_RATE_AT_TARGET, rate);
        ArgumentCaptor<RateAtTargetState> saved = ArgumentCaptor.forClass(RateAtTargetState.class);
        verify(stateRepository).save(saved.capture());
        assertEquals(AdaptiveCurve.INITIAL_RATE_AT_TARGET, saved.getValue().getRateAtTarget());
        assertEquals(NOW, saved.getValue().getLastUpdate());
    }

    @Test
    void testRateAtTargetAdaptsWithElapsedTime() {
        long elapsed = 432_000;
        market.setTotalSupplyAssets(BigInteger.valueOf(100));
        market.setTotalBorrowAssets(BigInteger.valueOf(100));
        RateAtTargetState state = new RateAtTargetState(market.getMarketId(),
            AdaptiveCurve.INITIAL_RATE_AT_TARGET, NOW - elapsed);
        when(stateRepository.findById(market.getMarketId())).thenReturn(Optional.of(state));

        BigInteger rate = model.borrowRate(params, market);

        BigInteger expectedRateAtTarget = AdaptiveCurve.adapt(AdaptiveCurve.INITIAL_RATE_AT_TARGET, MathLib.WAD, elapsed);
        assertEquals(AdaptiveCurve.curve(expectedRateAtTarget, MathLib.WAD), rate);
        assertEquals(expectedRateAtTarget, state.getRateAtTarget());
        assertEquals(NOW, state.getLastUpdate());
        verify(stateRepository).save(state);
    }

    @Test
    void testViewDoesNotPersist() {
        RateAtTargetState state = new RateAtTargetState(market.getMarketId(),
            AdaptiveCurve.INITIAL_RATE_AT_TARGET, NOW - 1000);
        when(stateRepository.findById(market.getMarketId())).thenReturn(Optional.of(state));

        BigInteger rate = model.borrowRateView(market.getMarketId(), AdaptiveCurve.TARGET_UTILIZATION);

        assertEquals(AdaptiveCurve.INITIAL_RATE_AT_TARGET, rate);
        assertEquals(NOW - 1000, state.getLastUpdate());
        verify(stateRepository, never()).save(any());
    }

    @Test
    void testZeroAddressIsRejected() {
        EngineProperties properties = new EngineProperties();
        properties.getAdaptiveCurve().setAddress("0x0000000000000000000000000000000000000000");

        assertThrows(RuntimeException.class,
            () -> new AdaptiveCurveRateModel(properties, stateRepository, Clock.systemUTC()));
    }
}
