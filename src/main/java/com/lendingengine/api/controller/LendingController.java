package com.lendingengine.api.controller;

import com.lendingengine.api.dto.AmountRequest;
import com.lendingengine.api.dto.CollateralRequest;
import com.lendingengine.api.dto.LiquidateRequest;
import com.lendingengine.engine.AssetsShares;
import com.lendingengine.engine.LendingEngine;
import com.lendingengine.engine.LiquidationResult;
import com.lendingengine.engine.MarketViews;
import com.lendingengine.market.MarketParams;
import com.lendingengine.market.Position;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for lending operations on a market.
 *
 * Callbacks are not available over HTTP: the caller must hold the tokens the
 * engine pulls before sending supply, repay, collateral or liquidation requests.
 */
@RestController
@RequestMapping("/api/v1/markets/{marketId}")
@RequiredArgsConstructor
@Tag(name = "Lending", description = "Supply, borrow, repay, collateral and liquidation API")
public class LendingController {

    private final LendingEngine lendingEngine;
    private final MarketViews marketViews;

    @PostMapping("/supply")
    @Operation(summary = "Supply loan tokens")
    public ResponseEntity<AssetsShares> supply(@PathVariable String marketId,
                                               @Valid @RequestBody AmountRequest request) {
        AssetsShares result = lendingEngine.supply(request.getCaller(), params(marketId),
            request.getAssets(), request.getShares(), request.getOnBehalf(), null, new byte[0]);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/withdraw")
    @Operation(summary = "Withdraw supplied loan tokens")
    public ResponseEntity<AssetsShares> withdraw(@PathVariable String marketId,
                                                 @Valid @RequestBody AmountRequest request) {
        AssetsShares result = lendingEngine.withdraw(request.getCaller(), params(marketId),
            request.getAssets(), request.getShares(), request.getOnBehalf(), receiver(request.getReceiver(), request.getCaller()));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/borrow")
    @Operation(summary = "Borrow loan tokens against collateral")
    public ResponseEntity<AssetsShares> borrow(@PathVariable String marketId,
                                               @Valid @RequestBody AmountRequest request) {
        AssetsShares result = lendingEngine.borrow(request.getCaller(), params(marketId),
            request.getAssets(), request.getShares(), request.getOnBehalf(), receiver(request.getReceiver(), request.getCaller()));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/repay")
    @Operation(summary = "Repay borrowed loan tokens")
    public ResponseEntity<AssetsShares> repay(@PathVariable String marketId,
                                              @Valid @RequestBody AmountRequest request) {
        AssetsShares result = lendingEngine.repay(request.getCaller(), params(marketId),
            request.getAssets(), request.getShares(), request.getOnBehalf(), null, new byte[0]);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/collateral/supply")
    @Operation(summary = "Supply collateral")
    public ResponseEntity<Position> supplyCollateral(@PathVariable String marketId,
                                                     @Valid @RequestBody CollateralRequest request) {
        lendingEngine.supplyCollateral(request.getCaller(), params(marketId),
            request.getAssets(), request.getOnBehalf(), null, new byte[0]);
        return ResponseEntity.ok(marketViews.position(marketId, request.getOnBehalf()));
    }

    @PostMapping("/collateral/withdraw")
    @Operation(summary = "Withdraw collateral")
    public ResponseEntity<Position> withdrawCollateral(@PathVariable String marketId,
                                                       @Valid @RequestBody CollateralRequest request) {
        lendingEngine.withdrawCollateral(request.getCaller(), params(marketId),
            request.getAssets(), request.getOnBehalf(), receiver(request.getReceiver(), request.getCaller()));
        return ResponseEntity.ok(marketViews.position(marketId, request.getOnBehalf()));
    }

    @PostMapping("/liquidate")
    @Operation(summary = "Liquidate an unhealthy position")
    public ResponseEntity<LiquidationResult> liquidate(@PathVariable String marketId,
                                                       @Valid @RequestBody LiquidateRequest request) {
        LiquidationResult result = lendingEngine.liquidate(request.getCaller(), params(marketId),
            request.getBorrower(), request.getSeizedAssets(), request.getRepaidShares(), null, new byte[0]);
        return ResponseEntity.ok(result);
    }

    private MarketParams params(String marketId) {
        return marketViews.idToMarketParams(marketId);
    }

    private static String receiver(String receiver, String caller) {
        return receiver != null ? receiver : caller;
    }
}
