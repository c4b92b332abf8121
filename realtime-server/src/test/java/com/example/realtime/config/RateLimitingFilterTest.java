package com.example.realtime.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RateLimitingFilter Tests")
class RateLimitingFilterTest {

    private RateLimitingFilter filter;

    @BeforeEach
    void setUp() {
        RealtimeProperties properties = new RealtimeProperties();
        properties.getRateLimit().setCapacity(2);
        properties.getRateLimit().setRefillTokens(2);
        filter = new RateLimitingFilter(properties);
    }

    private MockHttpServletResponse call(String uri, String profileId) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", uri);
        if (profileId != null) {
            request.addHeader("X-Profile-Id", profileId);
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }

    @Test
    @DisplayName("Should answer 429 once a profile used up its bucket")
    void shouldLimitPerProfile() throws Exception {
        // Given
        call("/api/push-tokens", "p1");
        call("/api/push-tokens", "p1");

        // When
        MockHttpServletResponse limited = call("/api/push-tokens", "p1");
        MockHttpServletResponse other = call("/api/push-tokens", "p2");

        // Then
        assertThat(limited.getStatus()).isEqualTo(429);
        assertThat(limited.getHeader("Retry-After")).isEqualTo("60");
        assertThat(limited.getContentAsString()).contains("too_many_requests");
        assertThat(other.getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("Health checks should never be limited")
    void shouldSkipHealth() throws Exception {
        for (int i = 0; i < 5; i++) {
            assertThat(call("/api/health", null).getStatus()).isEqualTo(200);
        }
    }
}
