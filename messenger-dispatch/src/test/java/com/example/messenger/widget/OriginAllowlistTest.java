package com.example.messenger.widget;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class OriginAllowlistTest {

    private final OriginAllowlist allowlist = new OriginAllowlist();

    @Test
    void emptyListAllowsAnyOrigin() {
        assertThat(allowlist.isAllowed(List.of(), "shop.example.com")).isTrue();
        assertThat(allowlist.isAllowed(null, "")).isTrue();
        assertThat(allowlist.isAllowed(Arrays.asList(" ", null), "anything.test")).isTrue();
    }

    @Test
    void exactHostsMatchCaseInsensitively() {
        List<String> allowed = List.of("Example.com", "https://help.example.org:8443/path");

        assertThat(allowlist.isAllowed(allowed, "example.com")).isTrue();
        assertThat(allowlist.isAllowed(allowed, "EXAMPLE.COM")).isTrue();
        assertThat(allowlist.isAllowed(allowed, "help.example.org")).isTrue();
        assertThat(allowlist.isAllowed(allowed, "www.example.com")).isFalse();
        assertThat(allowlist.isAllowed(allowed, "")).isFalse();
    }

    @Test
    void wildcardCoversSubdomainsButNotTheApex() {
        List<String> allowed = List.of("*.example.com");

        assertThat(allowlist.isAllowed(allowed, "shop.example.com")).isTrue();
        assertThat(allowlist.isAllowed(allowed, "a.b.example.com")).isTrue();
        assertThat(allowlist.isAllowed(allowed, "example.com")).isFalse();
        assertThat(allowlist.isAllowed(allowed, "badexample.com")).isFalse();
    }

    @Test
    void originHostComesFromOriginThenReferer() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Origin", "https://Shop.Example.com");
        request.addHeader("Referer", "https://other.test/page");
        assertThat(allowlist.resolveOriginHost(request)).isEqualTo("shop.example.com");

        MockHttpServletRequest nullOrigin = new MockHttpServletRequest();
        nullOrigin.addHeader("Origin", "null");
        nullOrigin.addHeader("Referer", "https://other.test/page?x=1");
        assertThat(allowlist.resolveOriginHost(nullOrigin)).isEqualTo("other.test");

        assertThat(allowlist.resolveOriginHost(new MockHttpServletRequest())).isEmpty();
    }
}
