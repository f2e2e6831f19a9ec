package com.church.chms.gateway.sms;

import com.church.chms.config.ChmsProperties;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 通用 HTTP 服务商：URL、方法、请求头与请求体模板全部来自配置
 */
@Component
public class GenericHttpSmsProvider extends AbstractSmsProvider {

    private final RestTemplate restTemplate;
    private final ChmsProperties.Sms settings;

    public GenericHttpSmsProvider(RestTemplate restTemplate, ChmsProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getSms();
    }

    @Override
    public String name() {
        return "generic";
    }

    @Override
    public SmsResult send(String to, String message) {
        ChmsProperties.Generic generic = settings.getGeneric();
        if (generic.getUrl() == null || generic.getUrl().isBlank()) {
            return SmsResult.failed("Generic SMS URL not configured");
        }

        String body = renderBody(generic.getBody(), to, message, settings.getSenderId());
        HttpEntity<String> request = new HttpEntity<>(body, parseHeaders(generic.getHeaders()));

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    generic.getUrl(), HttpMethod.valueOf(generic.getMethod().toUpperCase()), request, String.class);
            if (response.getStatusCode().is2xxSuccessful()) {
                return SmsResult.ok();
            }
            return SmsResult.failed("Generic SMS failed | Code: " + response.getStatusCode().value());
        } catch (RestClientException e) {
            return SmsResult.failed("Generic SMS failed | Error: " + e.getMessage());
        }
    }

    static HttpHeaders parseHeaders(String raw) {
        HttpHeaders headers = new HttpHeaders();
        if (raw == null) {
            return headers;
        }
        for (String line : raw.split("\n")) {
            int colon = line.indexOf(':');
            if (line.isBlank() || colon < 0) {
                continue;
            }
            headers.add(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
        }
        return headers;
    }

    static String renderBody(String template, String to, String message, String sender) {
        if (template == null) {
            return "";
        }
        return template.replace("{to}", to)
                .replace("{message}", message)
                .replace("{sender}", sender);
    }
}
