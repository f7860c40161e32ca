package com.lendingengine.api.controller;

import com.lendingengine.api.dto.CallerRequest;
import com.lendingengine.api.dto.CreateMarketRequest;
import com.lendingengine.engine.ExpectedBalances;
import com.lendingengine.engine.LendingEngine;
import com.lendingengine.engine.MarketViews;
import com.lendingengine.ledger.EventRecorder;
import com.lendingengine.ledger.LedgerEvent;
import com.lendingengine.market.Market;
import com.lendingengine.market.MarketId;
import com.lendingengine.market.MarketParams;
import com.lendingengine.market.Position;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * REST API for market creation and market/position views.
 */
@RestController
@RequestMapping("/api/v1/markets")
@RequiredArgsConstructor
@Tag(name = "Markets", description = "Market creation and views")
public class MarketController {

    private final LendingEngine lendingEngine;
    private final MarketViews marketViews;
    private final EventRecorder eventRecorder;

    @PostMapping
    @Operation(summary = "Create a new market")
    public ResponseEntity<Market> createMarket(@Valid @RequestBody CreateMarketRequest request) {
        MarketParams params = MarketParams.builder()
            .loanToken(request.getLoanToken())
            .collateralToken(request.getCollateralToken())
            .oracle(request.getOracle())
            .irm(request.getIrm())
            .lltv(request.getLltv())
            .build();

        String marketId = lendingEngine.createMarket(request.getCaller(), params);
        return ResponseEntity.status(HttpStatus.CREATED).body(marketViews.market(marketId));
    }

    @GetMapping("/{marketId}")
    @Operation(summary = "Get market totals")
    public ResponseEntity<Market> getMarket(@PathVariable String marketId) {
        return ResponseEntity.ok(marketViews.market(marketId));
    }

    @GetMapping("/{marketId}/params")
    @Operation(summary = "Get the parameters a market was created with")
    public ResponseEntity<MarketParams> getParams(@PathVariable String marketId) {
        return ResponseEntity.ok(marketViews.idToMarketParams(marketId));
    }

    @GetMapping("/id")
    @Operation(summary = "Compute the identifier of a market from its parameters")
    public ResponseEntity<Map<String, String>> computeId(
            @RequestParam String loanToken,
            @RequestParam String collateralToken,
            @RequestParam String oracle,
            @RequestParam String irm,
            @RequestParam BigInteger lltv) {

        MarketParams params = MarketParams.builder()
            .loanToken(loanToken)
            .collateralToken(collateralToken)
            .oracle(oracle)
            .irm(irm)
            .lltv(lltv)
            .build();
        return ResponseEntity.ok(Map.of("marketId", MarketId.of(params)));
    }

    @GetMapping("/{marketId}/expected-balances")
    @Operation(summary = "Get market totals including pending interest")
    public ResponseEntity<ExpectedBalances> getExpectedBalances(@PathVariable String marketId) {
        return ResponseEntity.ok(marketViews.expectedMarketBalances(marketId));
    }

    @GetMapping("/{marketId}/borrow-rate")
    @Operation(summary = "Get the current borrow rate per second (WAD)")
    public ResponseEntity<Map<String, BigInteger>> getBorrowRate(@PathVariable String marketId) {
        return ResponseEntity.ok(Map.of("borrowRate", marketViews.borrowRate(marketId)));
    }

    @PostMapping("/{marketId}/accrue")
    @Operation(summary = "Accrue pending interest")
    public ResponseEntity<Market> accrueInterest(@PathVariable String marketId,
                                                 @Valid @RequestBody CallerRequest request) {
        lendingEngine.accrueInterest(request.getCaller(), marketViews.idToMarketParams(marketId));
        return ResponseEntity.ok(marketViews.market(marketId));
    }

    @GetMapping("/{marketId}/positions")
    @Operation(summary = "Get all positions in a market")
    public ResponseEntity<List<Position>> getPositions(@PathVariable String marketId) {
        return ResponseEntity.ok(marketViews.positions(marketId));
    }

    @GetMapping("/{marketId}/positions/{account}")
    @Operation(summary = "Get an account's position")
    public ResponseEntity<Position> getPosition(@PathVariable String marketId, @PathVariable String account) {
        return ResponseEntity.ok(marketViews.position(marketId, account));
    }

    @GetMapping("/{marketId}/positions/{account}/health")
    @Operation(summary = "Get position health and expected balances")
    public ResponseEntity<Map<String, Object>> getHealth(@PathVariable String marketId, @PathVariable String account) {
        return ResponseEntity.ok(Map.of(
            "healthy", marketViews.isHealthy(marketId, account),
            "supplyAssets", marketViews.expectedSupplyAssets(marketId, account),
            "borrowAssets", marketViews.expectedBorrowAssets(marketId, account),
            "liquidationIncentiveFactor", marketViews.liquidationIncentiveFactor(marketId)
        ));
    }

    @GetMapping("/{marketId}/events")
    @Operation(summary = "Get the event log of a market")
    public ResponseEntity<List<LedgerEvent>> getEvents(@PathVariable String marketId) {
        return ResponseEntity.ok(eventRecorder.getMarketEvents(MarketId.normalize(marketId)));
    }
}
