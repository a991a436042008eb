package com.gdin.radiology.report.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.Serializable;

@Data
@ConfigurationProperties(prefix = "gdin.radiology.notification")
@Component
public class NotificationProperties implements Serializable {
    private Boolean enabled = true;
    // 为空时只记录日志，不推送
    private String webhookUrl;
    // 转诊医生不是邮箱时补全的域名
    private String recipientDomain = "hospital.com";
    private Long timeoutSeconds = 10L;
    private Boolean trustAllCertificates = false;
}
