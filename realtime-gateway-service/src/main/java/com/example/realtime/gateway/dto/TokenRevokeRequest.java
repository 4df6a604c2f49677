package com.example.realtime.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenRevokeRequest {
    @NotBlank(message = "Token id is required")
    private String tokenId;
    /** When the token would expire on its own; the blacklist entry lives until then. */
    @NotNull(message = "Token expiry is required")
    private Instant expiresAt;
}
