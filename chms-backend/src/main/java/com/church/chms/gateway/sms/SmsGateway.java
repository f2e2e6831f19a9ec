package com.church.chms.gateway.sms;

import com.church.chms.config.ChmsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 短信发送入口，按 chms.sms.provider 选择服务商，未知取值回退到 Hubtel
 */
@Slf4j
@Component
public class SmsGateway {

    private static final String DEFAULT_PROVIDER = "hubtel";

    private final SmsProvider provider;

    public SmsGateway(List<SmsProvider> providers, ChmsProperties properties) {
        this.provider = select(providers, properties.getSms().getProvider());
        log.info("短信服务商: {}", provider.name());
    }

    public SmsResult send(String phone, String message) {
        SmsResult result = provider.send(phone, message);
        if (!result.isSuccess()) {
            log.error("SMS delivery failed | Provider: {} | Error: {}", provider.name(), result.getError());
        }
        return result;
    }

    static SmsProvider select(List<SmsProvider> providers, String configured) {
        String wanted = configured == null ? DEFAULT_PROVIDER : configured.trim();
        return providers.stream()
                .filter(p -> p.name().equalsIgnoreCase(wanted))
                .findFirst()
                .or(() -> providers.stream().filter(p -> p.name().equals(DEFAULT_PROVIDER)).findFirst())
                .orElseThrow(() -> new IllegalStateException("No SMS provider available"));
    }
}
