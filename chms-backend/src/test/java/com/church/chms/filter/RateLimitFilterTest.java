package com.church.chms.filter;

import com.church.chms.config.ChmsProperties;
import com.church.chms.util.RateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RateLimitFilterTest {

    private ChmsProperties properties;
    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        properties = new ChmsProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC);
        filter = new RateLimitFilter(new RateLimiter(clock, properties), properties, new ObjectMapper());
    }

    private MockHttpServletResponse call(String remoteAddr, String forwardedFor) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/members");
        request.setRemoteAddr(remoteAddr);
        if (forwardedFor != null) {
            request.addHeader("X-Forwarded-For", forwardedFor);
        }
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, new MockFilterChain());
        return response;
    }

    // 不受信的来源每次伪造不同的 X-Forwarded-For，仍按直连地址计数 (默认 120 次 / 60 秒)
    @Test
    void testRotatingForwardedForFromUntrustedPeerIsLimited() throws Exception {
        int rejected = 0;
        for (int i = 0; i < 1000; i++) {
            MockHttpServletResponse response = call("10.0.0.1", "198.51." + (i / 256) + "." + (i % 256));
            if (i < 120) {
                assertEquals(200, response.getStatus(), "request " + i);
            } else {
                assertEquals(429, response.getStatus(), "request " + i);
                rejected++;
            }
        }

        assertEquals(880, rejected);
        MockHttpServletResponse last = call("10.0.0.1", "192.0.2.1");
        assertEquals("60", last.getHeader("Retry-After"));
        assertTrue(last.getContentAsString().contains("Too many requests. Please try again in 1 minute(s)."));
    }

    @Test
    void testForwardedForHonouredBehindTrustedProxy() throws Exception {
        properties.getWeb().setTrustedProxies(List.of("10.0.0.254"));
        for (int i = 0; i < 120; i++) {
            assertEquals(200, call("10.0.0.254", "203.0.113.5").getStatus());
        }

        assertEquals(429, call("10.0.0.254", "203.0.113.5").getStatus());
        // 同一代理后面的另一个客户端单独计数
        assertEquals(200, call("10.0.0.254", "203.0.113.6").getStatus());
    }

    @Test
    void testDisabledPassesThrough() throws Exception {
        properties.getRateLimit().setEnabled(false);

        for (int i = 0; i < 200; i++) {
            assertEquals(200, call("10.0.0.1", null).getStatus());
        }
    }
}
