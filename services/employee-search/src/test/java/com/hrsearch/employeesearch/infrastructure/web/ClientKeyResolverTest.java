package com.hrsearch.employeesearch.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.hrsearch.employeesearch.config.SearchProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("ClientKeyResolver")
class ClientKeyResolverTest {

    private final ClientKeyResolver resolver =
            new ClientKeyResolver(new SearchProperties(null, null, null, null));

    @Test
    @DisplayName("prefers the X-Client-IP header")
    void prefersHeader() {
        var request = new MockHttpServletRequest();
        request.setRemoteAddr("192.168.1.9");
        request.addHeader("X-Client-IP", " 203.0.113.5 ");

        assertThat(resolver.resolve(request)).isEqualTo("203.0.113.5");
    }

    @Test
    @DisplayName("falls back to the remote address when the header is blank")
    void fallsBackToRemoteAddress() {
        var request = new MockHttpServletRequest();
        request.setRemoteAddr("192.168.1.9");
        request.addHeader("X-Client-IP", "");

        assertThat(resolver.resolve(request)).isEqualTo("192.168.1.9");
    }

    @Test
    @DisplayName("uses unknown_client when nothing identifies the caller")
    void unknownClient() {
        var request = new MockHttpServletRequest();
        request.setRemoteAddr(null);

        assertThat(resolver.resolve(request)).isEqualTo(ClientKeyResolver.UNKNOWN_CLIENT);
    }

    @Test
    @DisplayName("honours a custom header name")
    void customHeader() {
        var custom = new ClientKeyResolver(new SearchProperties(null, "X-Api-Key", null, null));
        var request = new MockHttpServletRequest();
        request.addHeader("X-Api-Key", "partner-42");
        request.addHeader("X-Client-IP", "203.0.113.5");

        assertThat(custom.resolve(request)).isEqualTo("partner-42");
    }
}
