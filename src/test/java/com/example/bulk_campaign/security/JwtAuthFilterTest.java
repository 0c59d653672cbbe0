package com.example.bulk_campaign.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

import jakarta.servlet.FilterChain;

class JwtAuthFilterTest {

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void bearerHeader_authenticatesRequest() throws Exception {
        JwtTokenService tokens = mock(JwtTokenService.class);
        when(tokens.checkSession("abc")).thenReturn(AuthSession.of("42"));
        JwtAuthFilter filter = new JwtAuthFilter(tokens);

        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer abc");
        FilterChain chain = mock(FilterChain.class);

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertEquals("42", SecurityContextHolder.getContext().getAuthentication().getName());
        verify(chain).doFilter(eq(request), any());
    }

    @Test
    void tokenQueryParam_isUsedWhenNoHeader() {
        JwtAuthFilter filter = new JwtAuthFilter(mock(JwtTokenService.class));
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setParameter("token", "from-redirect");

        assertEquals("from-redirect", filter.resolveToken(request));
    }

    @Test
    void invalidToken_leavesRequestAnonymous() throws Exception {
        JwtTokenService tokens = mock(JwtTokenService.class);
        when(tokens.checkSession("bad")).thenReturn(AuthSession.anonymous());
        JwtAuthFilter filter = new JwtAuthFilter(tokens);

        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer bad");

        filter.doFilter(request, new MockHttpServletResponse(), mock(FilterChain.class));

        assertNull(SecurityContextHolder.getContext().getAuthentication());
    }
}
