package com.lendingengine.api.controller;

import com.lendingengine.common.Addresses;
import com.lendingengine.engine.MarketViews;
import com.lendingengine.ledger.EventRecorder;
import com.lendingengine.ledger.LedgerEvent;
import com.lendingengine.market.Position;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for account-wide views across markets.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "Account positions and history")
public class AccountController {

    private final MarketViews marketViews;
    private final EventRecorder eventRecorder;

    @GetMapping("/{account}/positions")
    @Operation(summary = "Get the positions of an account in every market")
    public ResponseEntity<List<Position>> getPositions(@PathVariable String account) {
        return ResponseEntity.ok(marketViews.positionsOf(account));
    }

    @GetMapping("/{account}/events")
    @Operation(summary = "Get the events affecting an account, newest first")
    public ResponseEntity<List<LedgerEvent>> getEvents(@PathVariable String account) {
        return ResponseEntity.ok(eventRecorder.getAccountEvents(Addresses.normalize(account)));
    }
}
