package com.gdin.radiology.report.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 以 JSON 形式 POST 到配置的 webhook 地址
 */
@Slf4j
public class WebhookNotificationDispatcher implements NotificationDispatcher {
    private final RestTemplate restTemplate;
    private final String webhookUrl;

    public WebhookNotificationDispatcher(RestTemplate restTemplate, String webhookUrl) {
        this.restTemplate = restTemplate;
        this.webhookUrl = webhookUrl;
    }

    @Override
    public boolean dispatch(CriticalFindingNotification notification) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(webhookUrl, new HttpEntity<>(notification, headers), String.class);
            if (response.getStatusCode().is2xxSuccessful()) {
                log.info("Critical finding notification {} sent to {}", notification.getNotificationId(), notification.getRecipient());
                return true;
            }
            log.error("Webhook rejected notification {}: HTTP {}", notification.getNotificationId(), response.getStatusCode().value());
            return false;
        } catch (RestClientException e) {
            log.error("Failed to send notification {} to webhook: {}", notification.getNotificationId(), e.getMessage());
            return false;
        }
    }
}
