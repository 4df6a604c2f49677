package com.example.realtime.gateway.controller;

import com.example.realtime.gateway.dto.LoginAttemptRequest;
import com.example.realtime.gateway.dto.TokenRevokeRequest;
import com.example.realtime.shared.security.CounterState;
import com.example.realtime.shared.security.LoginAttemptLimiter;
import com.example.realtime.shared.security.TokenBlacklistService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Edge protection for the auth flow: login-attempt throttling and token revocation.
 * Every handler talks to the store synchronously, so the work runs on the bounded elastic pool.
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthGuardController {

    private final LoginAttemptLimiter loginAttemptLimiter;
    private final TokenBlacklistService tokenBlacklistService;

    @PostMapping("/login-attempts")
    public Mono<ResponseEntity<CounterState>> recordLoginAttempt(@Valid @RequestBody LoginAttemptRequest request) {
        return offload(() -> ResponseEntity.ok(loginAttemptLimiter.recordAttempt(request.getIdentity())));
    }

    @DeleteMapping("/login-attempts")
    public Mono<ResponseEntity<Void>> resetLoginAttempts(@RequestParam String identity) {
        return offload(() -> {
            loginAttemptLimiter.reset(identity);
            return ResponseEntity.noContent().<Void>build();
        });
    }

    @PostMapping("/tokens/revoke")
    public Mono<ResponseEntity<Map<String, Object>>> revokeToken(@Valid @RequestBody TokenRevokeRequest request) {
        return offload(() -> {
            boolean blacklisted = tokenBlacklistService.blacklist(request.getTokenId(), request.getExpiresAt());
            return ResponseEntity.ok(Map.<String, Object>of("tokenId", request.getTokenId(), "blacklisted", blacklisted));
        });
    }

    @PostMapping("/users/{userId}/revoke")
    public Mono<ResponseEntity<Void>> revokeAllForUser(@PathVariable long userId) {
        return offload(() -> {
            tokenBlacklistService.revokeAllForUser(userId);
            return ResponseEntity.accepted().<Void>build();
        });
    }

    @GetMapping("/tokens/{tokenId}/valid")
    public Mono<ResponseEntity<Map<String, Object>>> isTokenValid(@PathVariable String tokenId,
                                                                  @RequestParam long userId,
                                                                  @RequestParam long issuedAt) {
        return offload(() -> {
            boolean valid = tokenBlacklistService.isTokenValid(tokenId, userId, Instant.ofEpochSecond(issuedAt));
            return ResponseEntity.ok(Map.<String, Object>of("tokenId", tokenId, "valid", valid));
        });
    }

    private static <T> Mono<T> offload(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
