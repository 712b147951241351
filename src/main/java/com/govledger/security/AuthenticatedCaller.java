package com.govledger.security;

import com.govledger.domain.Member;
import org.springframework.security.core.Authentication;

/**
 * Resolves the ledger identity of the authenticated caller.
 */
public final class AuthenticatedCaller {

    private AuthenticatedCaller() {
    }

    /**
     * @return the caller's address
     * @throws SecurityException if the request is not authenticated
     */
    public static String addressOf(Authentication authentication) {
        if (authentication == null || authentication.getPrincipal() == null) {
            throw new SecurityException("Not authenticated");
        }
        // JwtAuthenticationFilter sets a Member principal. In @WebMvcTest with
        // @WithMockUser the principal is a Spring User; its username is the address.
        if (authentication.getPrincipal() instanceof Member member) {
            return member.getAddress();
        }
        return authentication.getName();
    }
}
