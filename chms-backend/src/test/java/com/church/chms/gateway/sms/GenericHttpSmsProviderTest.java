package com.church.chms.gateway.sms;

import com.church.chms.config.ChmsProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GenericHttpSmsProviderTest {

    @Test
    void testRenderBody_FillsPlaceholders() {
        String body = GenericHttpSmsProvider.renderBody(
                "{\"to\":\"{to}\",\"text\":\"{message}\",\"from\":\"{sender}\"}", "233241234567", "Hi", "AliveChMS");

        assertEquals("{\"to\":\"233241234567\",\"text\":\"Hi\",\"from\":\"AliveChMS\"}", body);
    }

    @Test
    void testParseHeaders_SkipsMalformedLines() {
        HttpHeaders headers = GenericHttpSmsProvider.parseHeaders(
                "Content-Type: application/json\nbroken line\n\nAuthorization: Bearer abc:123");

        assertEquals(List.of("application/json"), headers.get("Content-Type"));
        assertEquals("Bearer abc:123", headers.getFirst("Authorization"));
        assertEquals(2, headers.size());
    }

    @Test
    void testSend_WithoutUrlFails() {
        GenericHttpSmsProvider provider = new GenericHttpSmsProvider(null, new ChmsProperties());

        SmsResult result = provider.send("0241234567", "Hi");

        assertFalse(result.isSuccess());
        assertEquals("Generic SMS URL not configured", result.getError());
    }
}
