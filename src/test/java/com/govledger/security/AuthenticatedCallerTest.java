package com.govledger.security;

import com.govledger.domain.Member;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AuthenticatedCallerTest {

    @Test @DisplayName("Member principal → member address")
    void memberPrincipal() {
        Member member = new Member("0xalice", "hash", Instant.EPOCH);
        var authentication = new UsernamePasswordAuthenticationToken(member, null, List.of());

        assertThat(AuthenticatedCaller.addressOf(authentication)).isEqualTo("0xalice");
    }

    @Test @DisplayName("other principal → authentication name")
    void namedPrincipal() {
        var authentication = new UsernamePasswordAuthenticationToken("0xbob", null, List.of());

        assertThat(AuthenticatedCaller.addressOf(authentication)).isEqualTo("0xbob");
    }

    @Test @DisplayName("no authentication → SecurityException")
    void anonymous() {
        assertThatThrownBy(() -> AuthenticatedCaller.addressOf(null))
            .isInstanceOf(SecurityException.class);
    }
}
