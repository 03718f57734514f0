package com.recoveryos.utils;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class DefaultClientKeyTest {

    @Test
    void sameSubnetAndAgentFamilyShareKey() {
        DefaultClientKey strategy = new DefaultClientKey("salt");

        String first = strategy.generate(request("203.0.113.7", "Mozilla/5.0 Firefox/121.0"));
        String second = strategy.generate(request("203.0.113.99", "Mozilla/5.0 Firefox/122.1"));

        assertEquals(first, second);
    }

    @Test
    void forwardingHeadersDoNotChangeKey() {
        DefaultClientKey strategy = new DefaultClientKey("salt");
        String direct = strategy.generate(request("10.0.0.1", "curl"));

        for (String header : new String[]{"X-Forwarded-For", "X-Real-IP", "CF-Connecting-IP", "True-Client-IP"}) {
            for (int i = 1; i <= 5; i++) {
                MockHttpServletRequest spoofed = request("10.0.0.1", "curl");
                spoofed.addHeader(header, "198.51." + i + ".4");
                assertEquals(direct, strategy.generate(spoofed), header);
            }
        }
    }

    @Test
    void differentSocketPeersGetDifferentKeys() {
        DefaultClientKey strategy = new DefaultClientKey("salt");

        assertNotEquals(
                strategy.generate(request("198.51.100.20", "curl")),
                strategy.generate(request("203.0.113.20", "curl"))
        );
    }

    @Test
    void saltChangesKeyAndRawValuesNeverLeak() {
        MockHttpServletRequest request = request("203.0.113.7", "agent");

        String salted = new DefaultClientKey("one").generate(request);

        assertNotEquals(salted, new DefaultClientKey("two").generate(request));
        assertFalse(salted.contains("203.0.113"));
        assertFalse(salted.contains("agent"));
    }

    private static MockHttpServletRequest request(String ip, String userAgent) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr(ip);
        request.addHeader("User-Agent", userAgent);
        return request;
    }
}
