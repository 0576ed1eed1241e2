package com.coachvault.vaultbackend.auth;

import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class JwtAuthenticationFilterTest {

    private static final String SECRET = "access-token-test-secret-0123456789abcdef";

    private JwtAuthenticationFilter filter;
    private Locale previousLocale;

    @BeforeEach
    void setUp() {
        filter = new JwtAuthenticationFilter(new JwtService(SECRET));
        previousLocale = Locale.getDefault();
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(previousLocale);
        SecurityContextHolder.clearContext();
    }

    private static String accessToken(String subject, String role) {
        Instant now = Instant.now();
        JwtBuilder builder = Jwts.builder()
                .setSubject(subject)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(300)));
        if (role != null) {
            builder.claim("role", role);
        }
        return builder
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();
    }

    private Authentication run(String token) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/downloads/5");
        if (token != null) {
            request.addHeader("Authorization", "Bearer " + token);
        }
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertNotNull(chain.getRequest(), "chain must always continue");
        return SecurityContextHolder.getContext().getAuthentication();
    }

    private static List<String> authorities(Authentication auth) {
        return auth.getAuthorities().stream().map(GrantedAuthority::getAuthority).toList();
    }

    @Test
    void roleIsUpperCasedIndependentOfDefaultLocale() throws Exception {
        Locale.setDefault(new Locale("tr", "TR"));

        Authentication auth = run(accessToken("user-1", "admin"));

        assertEquals("user-1", auth.getName());
        assertEquals(List.of("ROLE_ADMIN"), authorities(auth));
    }

    @Test
    void missingRoleDefaultsToUser() throws Exception {
        Authentication auth = run(accessToken("user-1", null));

        assertEquals(List.of("ROLE_USER"), authorities(auth));
    }

    @Test
    void tokenSignedWithOtherSecretLeavesRequestAnonymous() throws Exception {
        String forged = Jwts.builder()
                .setSubject("user-1")
                .signWith(Keys.hmacShaKeyFor("some-other-secret-0123456789abcdefgh".getBytes(StandardCharsets.UTF_8)),
                        SignatureAlgorithm.HS256)
                .compact();

        assertNull(run(forged));
    }

    @Test
    void requestWithoutHeaderPassesThrough() throws Exception {
        assertNull(run(null));
    }
}
