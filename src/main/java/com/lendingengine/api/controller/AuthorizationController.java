package com.lendingengine.api.controller;

import com.lendingengine.api.dto.SetAuthorizationRequest;
import com.lendingengine.api.dto.SignedAuthorizationRequest;
import com.lendingengine.authorization.AuthorizationService;
import com.lendingengine.authorization.Delegation;
import com.lendingengine.authorization.SignedAuthorization;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * REST API for delegated authorization.
 */
@RestController
@RequestMapping("/api/v1/authorizations")
@RequiredArgsConstructor
@Tag(name = "Authorizations", description = "Delegate management API")
public class AuthorizationController {

    private final AuthorizationService authorizationService;

    @PostMapping
    @Operation(summary = "Authorize or revoke a delegate")
    public ResponseEntity<Void> setAuthorization(@Valid @RequestBody SetAuthorizationRequest request) {
        authorizationService.setAuthorization(request.getCaller(), request.getDelegate(), request.isEnabled());
        return ResponseEntity.ok().build();
    }

    @PostMapping("/signed")
    @Operation(summary = "Submit an authorization signed by the authorizer")
    public ResponseEntity<Void> setAuthorizationWithSig(@Valid @RequestBody SignedAuthorizationRequest request) {
        SignedAuthorization authorization = SignedAuthorization.builder()
            .authorizer(request.getAuthorizer())
            .authorized(request.getAuthorized())
            .enabled(request.isEnabled())
            .nonce(request.getNonce())
            .deadline(request.getDeadline())
            .build();

        authorizationService.setAuthorizationWithSig(authorization, toSignatureData(request.getSignature()));
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{authorizer}/{authorized}")
    @Operation(summary = "Check whether a delegate is authorized")
    public ResponseEntity<Map<String, Boolean>> isAuthorized(@PathVariable String authorizer,
                                                             @PathVariable String authorized) {
        return ResponseEntity.ok(Map.of("authorized", authorizationService.isAuthorized(authorizer, authorized)));
    }

    @GetMapping("/{authorizer}")
    @Operation(summary = "Get the active delegates of an account")
    public ResponseEntity<List<Delegation>> getDelegates(@PathVariable String authorizer) {
        return ResponseEntity.ok(authorizationService.delegatesOf(authorizer));
    }

    @GetMapping("/{authorizer}/nonce")
    @Operation(summary = "Get the next signature nonce of an account")
    public ResponseEntity<Map<String, Long>> getNonce(@PathVariable String authorizer) {
        return ResponseEntity.ok(Map.of("nonce", authorizationService.nonce(authorizer)));
    }

    /**
     * Split a 65-byte r || s || v signature.
     */
    static Sign.SignatureData toSignatureData(String signatureHex) {
        byte[] bytes = Numeric.hexStringToByteArray(signatureHex);
        if (bytes.length != 65) {
            throw new IllegalArgumentException("Signature must be 65 bytes, got " + bytes.length);
        }
        byte v = bytes[64];
        if (v < 27) {
            v += 27;
        }
        return new Sign.SignatureData(v, Arrays.copyOfRange(bytes, 0, 32), Arrays.copyOfRange(bytes, 32, 64));
    }
}
