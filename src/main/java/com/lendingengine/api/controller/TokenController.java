package com.lendingengine.api.controller;

import com.lendingengine.api.dto.MintRequest;
import com.lendingengine.token.TokenBalance;
import com.lendingengine.token.TokenLedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * REST API for the internal token ledger.
 */
@RestController
@RequestMapping("/api/v1/tokens")
@RequiredArgsConstructor
@Tag(name = "Tokens", description = "Token ledger API")
public class TokenController {

    private final TokenLedgerService tokenLedgerService;

    @PostMapping("/{token}/mint")
    @Operation(summary = "Mint tokens to an account")
    public ResponseEntity<Map<String, BigInteger>> mint(@PathVariable String token,
                                                        @Valid @RequestBody MintRequest request) {
        tokenLedgerService.mint(token, request.getTo(), request.getAmount());
        return ResponseEntity.ok(Map.of("balance", tokenLedgerService.balanceOf(token, request.getTo())));
    }

    @GetMapping("/{token}/balances/{holder}")
    @Operation(summary = "Get the balance of an account")
    public ResponseEntity<Map<String, BigInteger>> balanceOf(@PathVariable String token, @PathVariable String holder) {
        return ResponseEntity.ok(Map.of("balance", tokenLedgerService.balanceOf(token, holder)));
    }

    @GetMapping("/balances/{holder}")
    @Operation(summary = "Get all balances of an account")
    public ResponseEntity<List<TokenBalance>> balancesOf(@PathVariable String holder) {
        return ResponseEntity.ok(tokenLedgerService.balancesOf(holder));
    }
}
