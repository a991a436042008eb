package com.gdin.radiology.report.config;

import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.config.properties.NotificationProperties;
import com.gdin.radiology.report.notification.LoggingNotificationDispatcher;
import com.gdin.radiology.report.notification.NotificationDispatcher;
import com.gdin.radiology.report.notification.WebhookNotificationDispatcher;
import com.gdin.radiology.report.util.HttpClientUtil;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.security.GeneralSecurityException;

@Configuration
@Slf4j
public class NotificationConfig {
    @Resource
    private NotificationProperties notificationProperties;

    @Bean
    public NotificationDispatcher notificationDispatcher() throws GeneralSecurityException {
        String webhookUrl = notificationProperties.getWebhookUrl();
        if (StrUtil.isBlank(webhookUrl)) {
            log.info("No notification webhook configured, critical finding alerts will only be logged");
            return new LoggingNotificationDispatcher();
        }
        RestTemplate restTemplate = new RestTemplate(new HttpComponentsClientHttpRequestFactory(
                HttpClientUtil.getApacheClient(notificationProperties.getTimeoutSeconds(),
                        Boolean.TRUE.equals(notificationProperties.getTrustAllCertificates()))));
        return new WebhookNotificationDispatcher(restTemplate, webhookUrl);
    }
}
