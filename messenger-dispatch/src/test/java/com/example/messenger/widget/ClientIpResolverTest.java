package com.example.messenger.widget;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientIpResolverTest {

    private final ClientIpResolver resolver = new ClientIpResolver();

    @Test
    void forwardedForWinsAndSkipsUnknownEntries() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Forwarded-For", "unknown, 198.51.100.7:5123, 10.0.0.1");
        request.addHeader("X-Real-IP", "10.0.0.2");
        request.setRemoteAddr("10.0.0.3");

        assertThat(resolver.resolve(request)).isEqualTo("198.51.100.7");
    }

    @Test
    void fallsBackThroughRealIpAndForwardedHeader() {
        MockHttpServletRequest realIp = new MockHttpServletRequest();
        realIp.addHeader("X-Real-IP", " 203.0.113.4 ");
        assertThat(resolver.resolve(realIp)).isEqualTo("203.0.113.4");

        MockHttpServletRequest forwarded = new MockHttpServletRequest();
        forwarded.addHeader("Forwarded", "proto=https;for=\"[2001:db8::17]:4711\", for=10.0.0.1");
        assertThat(resolver.resolve(forwarded)).isEqualTo("2001:db8::17");
    }

    @Test
    void usesSocketAddressLast() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr("192.0.2.10");

        assertThat(resolver.resolve(request)).isEqualTo("192.0.2.10");
        assertThat(resolver.resolve(null)).isEqualTo("unknown");
    }
}
