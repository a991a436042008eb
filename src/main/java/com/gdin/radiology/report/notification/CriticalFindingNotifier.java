package com.gdin.radiology.report.notification;

import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.gdin.radiology.report.config.properties.NotificationProperties;
import com.gdin.radiology.report.models.CriticalFindingsResult;
import com.gdin.radiology.report.models.ReportMeta;
import jakarta.annotation.Resource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 需要通知且有转诊医生时，向转诊医生发送危急值告警
 */
@Service
@Slf4j
public class CriticalFindingNotifier {
    static final int EXCERPT_LENGTH = 500;

    @Resource
    private NotificationProperties notificationProperties;
    @Resource
    private NotificationDispatcher notificationDispatcher;

    /**
     * @return 不需要通知时为 empty；否则为已尝试投递的通知（delivered 标记是否成功）
     */
    public Optional<CriticalFindingNotification> notifyIfRequired(CriticalFindingsResult result, ReportMeta meta,
                                                                  String reportText, Long reportId) {
        if (result == null || !result.isRequiresNotification()) return Optional.empty();
        if (!Boolean.TRUE.equals(notificationProperties.getEnabled())) {
            log.info("Critical notifications disabled, skipping alert for report {}", reportId);
            return Optional.empty();
        }
        if (meta == null || StrUtil.isBlank(meta.getReferrer())) {
            log.warn("Critical findings detected for report {} but no referrer to notify", reportId);
            return Optional.empty();
        }

        CriticalFindingNotification notification = CriticalFindingNotification.builder()
                .notificationId(IdUtil.getSnowflakeNextIdStr())
                .reportId(reportId)
                .recipient(recipientOf(meta.getReferrer()))
                .priority(NotificationPriority.of(result.getHighestSeverity()))
                .findings(result.getFindings())
                .patientName(StrUtil.blankToDefault(meta.getPatientName(), "Unknown Patient"))
                .accession(StrUtil.blankToDefault(meta.getAccession(), "N/A"))
                .reportExcerpt(excerpt(reportText))
                .radiologistName(meta.getDoctorName())
                .createdAt(LocalDateTime.now())
                .build();

        boolean delivered = notificationDispatcher.dispatch(notification);
        if (!delivered) log.warn("Critical finding notification {} was not delivered", notification.getNotificationId());
        return Optional.of(notification.toBuilder().delivered(delivered).build());
    }

    String recipientOf(String referrer) {
        String trimmed = referrer.strip();
        if (trimmed.contains("@")) return trimmed;
        return trimmed + "@" + notificationProperties.getRecipientDomain();
    }

    static String excerpt(String reportText) {
        String text = StrUtil.nullToEmpty(reportText);
        if (text.length() <= EXCERPT_LENGTH) return text;
        return text.substring(0, EXCERPT_LENGTH - 3) + "...";
    }
}
