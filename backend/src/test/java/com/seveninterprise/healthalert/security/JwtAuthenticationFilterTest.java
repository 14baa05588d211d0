package com.seveninterprise.healthalert.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class JwtAuthenticationFilterTest {

    private static final String SECRET =
        "aGVhbHRoYWxlcnQtdGVzdC1zaWduaW5nLWtleS1mb3ItdW5pdC1hbmQtaXQtdGVzdHMtMDAwMQ==";

    private JwtProvider jwtProvider;
    private JwtAuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        jwtProvider = newProvider(10);
        filter = new JwtAuthenticationFilter(jwtProvider);
        SecurityContextHolder.clearContext();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private JwtProvider newProvider(long expirationHours) {
        JwtProvider provider = new JwtProvider();
        ReflectionTestUtils.setField(provider, "secretKeyString", SECRET);
        ReflectionTestUtils.setField(provider, "expirationHours", expirationHours);
        provider.init();
        return provider;
    }

    @Test
    void testDoFilter_WithValidToken_ShouldAuthenticateUserWithRoleAuthority() throws Exception {
        // Given
        String token = jwtProvider.generateToken("official-1", "health_official");
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/alerts");
        request.addHeader("Authorization", "Bearer " + token);
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, response, chain);

        // Then
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertNotNull(authentication);
        assertEquals("official-1", authentication.getName());
        assertTrue(authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .anyMatch("ROLE_HEALTH_OFFICIAL"::equals));
        assertNotNull(chain.getRequest());
        assertEquals(200, response.getStatus());
    }

    @Test
    void testDoFilter_WithoutAuthorizationHeader_ShouldPassThroughUnauthenticated() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/alerts");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, response, chain);

        // Then
        assertNull(SecurityContextHolder.getContext().getAuthentication());
        assertNotNull(chain.getRequest());
    }

    @Test
    void testDoFilter_WithExpiredToken_ShouldReturnUnauthorizedWithReason() throws Exception {
        // Given
        String expired = newProvider(-1).generateToken("asha-7", "ASHA_WORKER");
        MockHttpServletRequest request = new MockHttpServletRequest("PUT", "/api/alerts/ALT-SYS-0001/acknowledge");
        request.addHeader("Authorization", "Bearer " + expired);
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, response, chain);

        // Then
        assertEquals(401, response.getStatus());
        assertEquals("TOKEN_EXPIRED", response.getHeader("X-Auth-Reason"));
        assertEquals("LOGOUT", response.getHeader("X-Auth-Event"));
        assertNull(chain.getRequest());
    }

    @Test
    void testDoFilter_WithTamperedToken_ShouldReturnInvalidToken() throws Exception {
        // Given
        String token = jwtProvider.generateToken("asha-7", "ASHA_WORKER");
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/alerts");
        request.addHeader("Authorization", "Bearer " + token.substring(0, token.length() - 4) + "abcd");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, response, chain);

        // Then
        assertEquals(401, response.getStatus());
        assertEquals("INVALID_TOKEN", response.getHeader("X-Auth-Reason"));
        assertTrue(response.getContentAsString().contains("INVALID_TOKEN"));
        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }
}
