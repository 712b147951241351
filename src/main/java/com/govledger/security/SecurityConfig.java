package com.govledger.security;

import com.govledger.repository.MemberRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security configuration.
 *
 * ENDPOINT ACCESS RULES:
 *
 *   PUBLIC  (no token required):
 *     POST /api/auth/login          - obtain JWT
 *     POST /api/members/register    - create member
 *     GET  /api/proposals/**        - proposal queries and tallies
 *     GET  /api/governance          - administrator and proposal count
 *     GET  /api/events              - notification feed
 *     GET  /api/actuator/health     - health probe
 *     GET  /api/swagger-ui/**, /api/v3/api-docs/**
 *
 *   PROTECTED (valid JWT required):
 *     Everything else (create, vote, close, administrator transfer)
 *
 * Authentication only establishes WHO the caller is. Whether that caller may
 * create or close proposals is decided by the ledger itself.
 *
 * SESSION: Stateless. CSRF: Disabled (API-only).
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final JwtTokenProvider tokenProvider;
    private final MemberRepository memberRepository;

    public SecurityConfig(JwtTokenProvider tokenProvider,
                          MemberRepository memberRepository) {
        this.tokenProvider    = tokenProvider;
        this.memberRepository = memberRepository;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm ->
                sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .exceptionHandling(eh ->
                eh.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.POST, "/auth/login").permitAll()
                .requestMatchers(HttpMethod.POST, "/members/register").permitAll()
                .requestMatchers(HttpMethod.GET, "/proposals", "/proposals/**").permitAll()
                .requestMatchers(HttpMethod.GET, "/governance", "/events").permitAll()
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                .requestMatchers(
                    "/swagger-ui/**",
                    "/swagger-ui.html",
                    "/v3/api-docs/**").permitAll()
                .anyRequest().authenticated()
            )
            .addFilterBefore(
                new JwtAuthenticationFilter(tokenProvider, memberRepository),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(12);
    }
}
