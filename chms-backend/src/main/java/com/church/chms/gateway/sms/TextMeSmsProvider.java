package com.church.chms.gateway.sms;

import com.church.chms.config.ChmsProperties;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class TextMeSmsProvider extends AbstractSmsProvider {

    private final RestTemplate restTemplate;
    private final ChmsProperties.Sms settings;

    public TextMeSmsProvider(RestTemplate restTemplate, ChmsProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getSms();
    }

    @Override
    public String name() {
        return "textme";
    }

    @Override
    public SmsResult send(String to, String message) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("to", normalizePhone(to));
        form.add("message", message);
        form.add("sender_id", settings.getSenderId());
        form.add("api_key", settings.getTextme().getApiKey());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    settings.getTextme().getUrl(), new HttpEntity<>(form, headers), String.class);
            // TextMe 只认 200
            if (response.getStatusCode() == HttpStatus.OK) {
                return SmsResult.ok();
            }
            return SmsResult.failed("TextMe failed | Code: " + response.getStatusCode().value()
                    + " | Response: " + abbreviate(response.getBody()));
        } catch (RestClientException e) {
            return SmsResult.failed("TextMe failed | Error: " + e.getMessage());
        }
    }
}
