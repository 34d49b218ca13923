package com.shoplytic.common.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class SessionIdResolverTest {

    @Test
    @DisplayName("Uses the first forwarded address when present")
    void prefersForwardedFor() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        request.addHeader("X-Real-IP", "198.51.100.2");
        request.setRemoteAddr("127.0.0.1");

        assertThat(SessionIdResolver.clientIp(request)).isEqualTo("203.0.113.7");
    }

    @Test
    void fallsBackToRealIpThenSocket() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Real-IP", "198.51.100.2");
        request.setRemoteAddr("127.0.0.1");
        assertThat(SessionIdResolver.clientIp(request)).isEqualTo("198.51.100.2");

        MockHttpServletRequest plain = new MockHttpServletRequest();
        plain.setRemoteAddr("127.0.0.1");
        assertThat(SessionIdResolver.clientIp(plain)).isEqualTo("127.0.0.1");
    }

    @Test
    @DisplayName("Session id is a stable md5 prefix of the client address")
    void sessionIdIsStableHash() {
        // md5("127.0.0.1") = f528764d624db129b32c21fbca0cb8d6
        assertThat(SessionIdResolver.fromClientIp("127.0.0.1")).isEqualTo("session_f528764d624db129");
        assertThat(SessionIdResolver.fromClientIp("127.0.0.1"))
                .isEqualTo(SessionIdResolver.fromClientIp("127.0.0.1"))
                .hasSize("session_".length() + 16);
    }
}
