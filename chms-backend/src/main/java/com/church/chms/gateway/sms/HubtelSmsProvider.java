package com.church.chms.gateway.sms;

import com.church.chms.config.ChmsProperties;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class HubtelSmsProvider extends AbstractSmsProvider {

    private final RestTemplate restTemplate;
    private final ChmsProperties.Sms settings;

    public HubtelSmsProvider(RestTemplate restTemplate, ChmsProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getSms();
    }

    @Override
    public String name() {
        return "hubtel";
    }

    @Override
    public SmsResult send(String to, String message) {
        String phone = normalizePhone(to);
        // Hubtel 只受理 233 开头的 12 位号码
        if (phone.length() != 12 || !phone.startsWith("233")) {
            return SmsResult.failed("Invalid Ghana phone number: " + phone);
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("from", settings.getSenderId());
        form.add("to", phone);
        form.add("content", message);
        form.add("clientid", settings.getHubtel().getClientId());
        form.add("clientsecret", settings.getHubtel().getClientSecret());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    settings.getHubtel().getUrl(), new HttpEntity<>(form, headers), String.class);
            if (response.getStatusCode().is2xxSuccessful()) {
                return SmsResult.ok();
            }
            return SmsResult.failed("Hubtel failed | Code: " + response.getStatusCode().value()
                    + " | Response: " + abbreviate(response.getBody()));
        } catch (RestClientException e) {
            return SmsResult.failed("Hubtel failed | Error: " + e.getMessage());
        }
    }
}
