package com.lendingengine.api.controller;

import com.lendingengine.api.dto.OwnerActionRequest;
import com.lendingengine.engine.LendingEngine;
import com.lendingengine.engine.MarketViews;
import com.lendingengine.governance.AllowListEntry;
import com.lendingengine.governance.GovernanceService;
import com.lendingengine.market.Market;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for owner-gated settings.
 */
@RestController
@RequestMapping("/api/v1/governance")
@RequiredArgsConstructor
@Tag(name = "Governance", description = "Owner, fee and allow-list API")
public class GovernanceController {

    private final GovernanceService governanceService;
    private final LendingEngine lendingEngine;
    private final MarketViews marketViews;

    @GetMapping
    @Operation(summary = "Get owner and fee recipient")
    public ResponseEntity<Map<String, String>> getSettings() {
        return ResponseEntity.ok(Map.of(
            "owner", governanceService.owner(),
            "feeRecipient", governanceService.feeRecipient()
        ));
    }

    @PostMapping("/owner")
    @Operation(summary = "Transfer ownership")
    public ResponseEntity<Void> setOwner(@Valid @RequestBody OwnerActionRequest request) {
        governanceService.setOwner(request.getCaller(), request.getAddress());
        return ResponseEntity.ok().build();
    }

    @PostMapping("/fee-recipient")
    @Operation(summary = "Set the fee recipient")
    public ResponseEntity<Void> setFeeRecipient(@Valid @RequestBody OwnerActionRequest request) {
        governanceService.setFeeRecipient(request.getCaller(), request.getAddress());
        return ResponseEntity.ok().build();
    }

    @PostMapping("/irms")
    @Operation(summary = "Enable a rate model for market creation")
    public ResponseEntity<Void> enableIrm(@Valid @RequestBody OwnerActionRequest request) {
        governanceService.enableIrm(request.getCaller(), request.getAddress());
        return ResponseEntity.ok().build();
    }

    @GetMapping("/irms")
    @Operation(summary = "List enabled rate models")
    public ResponseEntity<List<AllowListEntry>> getIrms() {
        return ResponseEntity.ok(governanceService.allowList(AllowListEntry.Kind.IRM));
    }

    @PostMapping("/lltvs")
    @Operation(summary = "Enable an LLTV for market creation")
    public ResponseEntity<Void> enableLltv(@Valid @RequestBody OwnerActionRequest request) {
        governanceService.enableLltv(request.getCaller(), request.getValue());
        return ResponseEntity.ok().build();
    }

    @GetMapping("/lltvs")
    @Operation(summary = "List enabled LLTVs")
    public ResponseEntity<List<AllowListEntry>> getLltvs() {
        return ResponseEntity.ok(governanceService.allowList(AllowListEntry.Kind.LLTV));
    }

    @PostMapping("/markets/{marketId}/fee")
    @Operation(summary = "Set the fee of a market")
    public ResponseEntity<Market> setFee(@PathVariable String marketId,
                                         @Valid @RequestBody OwnerActionRequest request) {
        lendingEngine.setFee(request.getCaller(), marketViews.idToMarketParams(marketId), request.getValue());
        return ResponseEntity.ok(marketViews.market(marketId));
    }
}
