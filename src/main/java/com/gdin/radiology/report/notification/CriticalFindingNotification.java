package com.gdin.radiology.report.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gdin.radiology.report.models.CriticalFinding;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.List;

@Value
@Jacksonized
@Builder(toBuilder = true)
public class CriticalFindingNotification {

    @JsonProperty("notification_id")
    String notificationId;

    @JsonProperty("report_id")
    Long reportId;

    @JsonProperty("recipient")
    String recipient;

    @JsonProperty("priority")
    NotificationPriority priority;

    @JsonProperty("findings")
    List<CriticalFinding> findings;

    @JsonProperty("patient_name")
    String patientName;

    @JsonProperty("accession")
    String accession;

    @JsonProperty("report_excerpt")
    String reportExcerpt;

    @JsonProperty("radiologist_name")
    String radiologistName;

    @JsonProperty("created_at")
    LocalDateTime createdAt;

    /**
     * 是否已成功投递
     */
    @JsonProperty("delivered")
    boolean delivered;
}
