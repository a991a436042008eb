package com.gdin.radiology.report.notification;

import com.gdin.radiology.report.models.CriticalFinding;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 未配置 webhook 时使用，只把告警写进日志
 */
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public boolean dispatch(CriticalFindingNotification notification) {
        String findings = notification.getFindings().stream()
                .map(LoggingNotificationDispatcher::describe)
                .collect(Collectors.joining("; "));
        log.warn("CRITICAL FINDING ALERT [{}] to {} - patient: {}, accession: {}, radiologist: {}, findings: {}",
                notification.getPriority(), notification.getRecipient(), notification.getPatientName(),
                notification.getAccession(), notification.getRadiologistName(), findings);
        return true;
    }

    static String describe(CriticalFinding finding) {
        return String.format(Locale.ROOT, "[%s] %s (category: %s, confidence: %.0f%%)",
                finding.getSeverity().getValue().toUpperCase(Locale.ROOT), finding.getText(),
                finding.getCategory().getValue(), finding.getConfidence() * 100);
    }
}
