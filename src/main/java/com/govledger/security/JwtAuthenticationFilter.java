package com.govledger.security;

import com.govledger.repository.MemberRepository;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Per-request JWT authentication filter.
 *
 * FLOW:
 *   1. Extract "Authorization: Bearer <token>" header
 *   2. Validate token signature and expiry via JwtTokenProvider
 *   3. Load the member by address (verifies the member still exists)
 *   4. Set UsernamePasswordAuthenticationToken with the Member as principal
 *   5. Continue filter chain
 *
 * Administrator rights are NOT granted here. The ledger checks the caller
 * address against its own administrator on every privileged operation, so a
 * transfer takes effect immediately without re-issuing tokens.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final JwtTokenProvider tokenProvider;
    private final MemberRepository memberRepository;

    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider,
                                   MemberRepository memberRepository) {
        this.tokenProvider = tokenProvider;
        this.memberRepository = memberRepository;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest  request,
                                    HttpServletResponse response,
                                    FilterChain         chain)
            throws ServletException, IOException {

        String token = extractBearerToken(request);

        if (StringUtils.hasText(token)) {
            if (tokenProvider.isValid(token)) {
                String address = tokenProvider.extractAddress(token);
                MDC.put("caller", address);

                memberRepository.findByAddress(address).ifPresentOrElse(member -> {
                    var auth = new UsernamePasswordAuthenticationToken(
                            member,
                            null,
                            List.of(new SimpleGrantedAuthority("ROLE_MEMBER"))
                    );
                    SecurityContextHolder.getContext().setAuthentication(auth);
                    log.debug("✓ Member authenticated - memberId={}, address={}", member.getId(), address);
                }, () -> log.warn("✗ Authentication rejected - no member with address {}", address));
            } else {
                log.warn("✗ Invalid JWT token - signature or expiry check failed");
            }
        } else {
            log.debug("No JWT token in request (public endpoint or unauthenticated)");
        }

        try {
            chain.doFilter(request, response);
        } finally {
            MDC.remove("caller");
        }
    }

    /**
     * Extract the raw token from "Authorization: Bearer <token>".
     * Returns null if the header is absent or malformed.
     */
    private String extractBearerToken(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (StringUtils.hasText(header) && header.startsWith("Bearer ")) {
            return header.substring(7).strip();
        }
        return null;
    }
}
