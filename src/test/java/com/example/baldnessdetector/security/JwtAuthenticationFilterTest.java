package com.example.baldnessdetector.security;

import com.example.baldnessdetector.exception.ExpiredTokenException;
import com.example.baldnessdetector.exception.MalformedTokenException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JwtAuthenticationFilterTest {

    @Mock
    private JwtUtil jwtUtil;

    @InjectMocks
    private JwtAuthenticationFilter filter;

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void authenticatesValidBearerToken() throws Exception {
        when(jwtUtil.validateToken("good-token")).thenReturn(42L);
        MockHttpServletRequest request = request("Bearer good-token");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        assertThat(auth).isNotNull();
        assertThat(auth.getPrincipal()).isEqualTo(42L);
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    void acceptsLowercaseScheme() throws Exception {
        when(jwtUtil.validateToken("good-token")).thenReturn(5L);

        filter.doFilter(request("bearer good-token"), new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication().getPrincipal()).isEqualTo(5L);
    }

    @Test
    void leavesRequestAnonymousWithoutHeader() throws Exception {
        MockHttpServletRequest request = request(null);
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthenticationFilter.AUTH_ERROR_ATTRIBUTE)).isNull();
        assertThat(chain.getRequest()).isSameAs(request);
        verify(jwtUtil, never()).validateToken(anyString());
    }

    @Test
    void recordsMalformedHeader() throws Exception {
        MockHttpServletRequest request = request("Basic dXNlcjpwYXNz");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthenticationFilter.AUTH_ERROR_ATTRIBUTE))
                .isInstanceOf(MalformedTokenException.class);
        verify(jwtUtil, never()).validateToken(anyString());
    }

    @Test
    void recordsEmptyBearerToken() throws Exception {
        MockHttpServletRequest request = request("Bearer   ");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(request.getAttribute(JwtAuthenticationFilter.AUTH_ERROR_ATTRIBUTE))
                .isInstanceOf(MalformedTokenException.class);
    }

    @Test
    void recordsRejectedToken() throws Exception {
        when(jwtUtil.validateToken("old-token"))
                .thenThrow(new ExpiredTokenException("Token has expired", null));
        MockHttpServletRequest request = request("Bearer old-token");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(request.getAttribute(JwtAuthenticationFilter.AUTH_ERROR_ATTRIBUTE))
                .isInstanceOf(ExpiredTokenException.class);
        assertThat(chain.getRequest()).isSameAs(request);
    }

    private static MockHttpServletRequest request(String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/auth/me");
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return request;
    }
}
