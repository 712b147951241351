package com.govledger.controller;

import com.govledger.domain.Member;
import com.govledger.security.JwtTokenProvider;
import com.govledger.service.MemberService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Authentication controller.
 *
 * POST /auth/login  - validates credentials, returns a signed JWT.
 *
 * The JWT must be included in subsequent mutating requests as:
 *   Authorization: Bearer <token>
 */
@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Login and token management")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final MemberService    memberService;
    private final JwtTokenProvider tokenProvider;
    private final Clock            clock;

    public AuthController(MemberService    memberService,
                          JwtTokenProvider tokenProvider,
                          Clock            clock) {
        this.memberService = memberService;
        this.tokenProvider = tokenProvider;
        this.clock         = clock;
    }

    // ── Request / Response DTOs (local, no domain leakage) ───────────────────

    public record LoginRequest(
            @NotBlank String address,
            @NotBlank String password
    ) {}

    public record LoginResponse(
            String  token,
            String  tokenType,
            Long    memberId,
            String  address,
            Instant expiresAt
    ) {}

    public record LoginError(String error, String message) {}

    // ── Endpoint ─────────────────────────────────────────────────────────────

    @PostMapping("/login")
    @Operation(summary = "Login", description = "Returns a JWT for the member's address")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request) {
        return memberService.authenticate(request.address(), request.password())
                .<ResponseEntity<?>>map(this::issueToken)
                .orElseGet(() -> {
                    log.warn("✗ Login failed - address={}", request.address());
                    // Same message for unknown address and wrong password
                    return ResponseEntity
                            .status(HttpStatus.UNAUTHORIZED)
                            .body(new LoginError("UNAUTHENTICATED", "Invalid address or password"));
                });
    }

    private ResponseEntity<?> issueToken(Member member) {
        String token = tokenProvider.generateToken(member.getId(), member.getAddress());
        log.info("✓ Login success - memberId={}, address={}", member.getId(), member.getAddress());
        return ResponseEntity.ok(new LoginResponse(
                token,
                "Bearer",
                member.getId(),
                member.getAddress(),
                Instant.now(clock).plusMillis(tokenProvider.getExpiryMs())
        ));
    }
}
