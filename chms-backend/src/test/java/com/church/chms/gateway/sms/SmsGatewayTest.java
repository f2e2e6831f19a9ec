package com.church.chms.gateway.sms;

import com.church.chms.config.ChmsProperties;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class SmsGatewayTest {

    private final RestTemplate restTemplate = new RestTemplate();
    private final ChmsProperties properties = new ChmsProperties();

    private final List<SmsProvider> providers = List.of(
            new HubtelSmsProvider(restTemplate, properties),
            new TextMeSmsProvider(restTemplate, properties),
            new GenericHttpSmsProvider(restTemplate, properties));

    @Test
    void testSelect_ConfiguredProvider() {
        assertEquals("textme", SmsGateway.select(providers, "TextMe").name());
        assertEquals("generic", SmsGateway.select(providers, " generic ").name());
    }

    // 未知或未配置时回退到 Hubtel
    @Test
    void testSelect_FallsBackToHubtel() {
        assertEquals("hubtel", SmsGateway.select(providers, "twilio").name());
        assertEquals("hubtel", SmsGateway.select(providers, null).name());
    }

    @Test
    void testSend_ReturnsProviderResult() {
        SmsProvider textMe = mock(SmsProvider.class);
        when(textMe.name()).thenReturn("textme");
        when(textMe.send("0241234567", "Hi")).thenReturn(SmsResult.failed("TextMe failed | Code: 500"));
        properties.getSms().setProvider("textme");

        SmsResult result = new SmsGateway(List.of(textMe), properties).send("0241234567", "Hi");

        assertFalse(result.isSuccess());
        assertEquals("TextMe failed | Code: 500", result.getError());
    }
}
