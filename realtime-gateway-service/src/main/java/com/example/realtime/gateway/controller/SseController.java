package com.example.realtime.gateway.controller;

import com.example.realtime.gateway.routing.SectorCache;
import com.example.realtime.gateway.session.ClientScope;
import com.example.realtime.gateway.session.ClientSessionRegistry;
import com.example.realtime.shared.security.TokenBlacklistService;
import com.example.realtime.shared.util.Constants.ClientRole;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/realtime/sse")
@RequiredArgsConstructor
@Slf4j
public class SseController {

    private final ClientSessionRegistry sessionRegistry;
    private final TokenBlacklistService tokenBlacklistService;
    private final SectorCache sectorCache;

    @GetMapping(value = "/connect", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @RateLimiter(name = "sseConnectLimiter", fallbackMethod = "connectFallback")
    public Flux<ServerSentEvent<String>> connect(
            @RequestParam long userId,
            @RequestParam long tenantId,
            @RequestParam ClientRole role,
            @RequestParam(required = false) List<Long> branchIds,
            @RequestParam(required = false) Long sessionId,
            @RequestParam String tokenId,
            @RequestParam long issuedAt,
            @RequestParam(required = false) String connectionId,
            ServerWebExchange exchange) {

        final String resolvedConnectionId = (connectionId == null || connectionId.isBlank())
                ? UUID.randomUUID().toString()
                : connectionId;

        log.info("[CONNECT_START] SSE connection request for userId='{}', tenantId='{}', role='{}', connectionId='{}', IP='{}'",
                userId, tenantId, role, resolvedConnectionId,
                exchange.getRequest().getRemoteAddress() != null ? exchange.getRequest().getRemoteAddress().getAddress().getHostAddress() : "unknown");

        // Token and sector lookups block on the store.
        return Mono.fromCallable(() -> authorize(userId, tenantId, role, branchIds, sessionId, tokenId, Instant.ofEpochSecond(issuedAt)))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(scope -> sessionRegistry.register(resolvedConnectionId, scope));
    }

    public Flux<ServerSentEvent<String>> connectFallback(long userId, long tenantId, ClientRole role, List<Long> branchIds,
                                                         Long sessionId, String tokenId, long issuedAt, String connectionId,
                                                         ServerWebExchange exchange, RequestNotPermitted ex) {
        log.warn("Connection rate limit exceeded for user: {}. IP: {}. Details: {}",
                userId,
                exchange.getRequest().getRemoteAddress(),
                ex.getMessage());
        return Flux.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, "Connection rate limit exceeded. Please try again later."));
    }

    @PostMapping("/disconnect")
    public ResponseEntity<String> disconnect(@RequestParam String connectionId) {
        log.info("Disconnect request for connection: {}", connectionId);
        sessionRegistry.remove(connectionId);
        return ResponseEntity.ok("Disconnected successfully");
    }

    private ClientScope authorize(long userId, long tenantId, ClientRole role, List<Long> branchIds,
                                  Long sessionId, String tokenId, Instant issuedAt) {
        if (userId <= 0 || tenantId <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId and tenantId must be positive");
        }
        if (!tokenBlacklistService.isTokenValid(tokenId, userId, issuedAt)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Token is revoked or could not be verified");
        }
        ClientScope.ClientScopeBuilder scope = ClientScope.builder()
                .userId(userId)
                .tenantId(tenantId)
                .role(role);
        if (role == ClientRole.DINER) {
            if (sessionId == null || sessionId <= 0) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Diner connections need a table session id");
            }
            return scope.sessionId(sessionId).build();
        }
        if (branchIds != null) {
            scope.branchIds(branchIds);
        }
        if (role == ClientRole.WAITER) {
            scope.sectorIds(sectorCache.get(userId, tenantId));
        }
        return scope.build();
    }
}
