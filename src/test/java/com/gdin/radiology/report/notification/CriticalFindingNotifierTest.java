package com.gdin.radiology.report.notification;

import com.gdin.radiology.report.config.properties.NotificationProperties;
import com.gdin.radiology.report.models.CriticalFinding;
import com.gdin.radiology.report.models.CriticalFindingsResult;
import com.gdin.radiology.report.models.FindingCategory;
import com.gdin.radiology.report.models.FindingSeverity;
import com.gdin.radiology.report.models.ReportMeta;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class CriticalFindingNotifierTest {
    @Spy
    private NotificationProperties notificationProperties = new NotificationProperties();
    @Mock
    private NotificationDispatcher notificationDispatcher;

    @InjectMocks
    private CriticalFindingNotifier notifier;

    private static CriticalFindingsResult result(FindingSeverity severity, boolean requiresNotification) {
        CriticalFinding finding = CriticalFinding.builder()
                .text("pulmonary embolism")
                .severity(severity)
                .category(FindingCategory.VASCULAR)
                .confidence(0.8)
                .context("acute pulmonary embolism")
                .build();
        return CriticalFindingsResult.builder()
                .hasCritical(true)
                .findings(List.of(finding))
                .highestSeverity(severity)
                .requiresNotification(requiresNotification)
                .build();
    }

    @Test
    public void testReferrerNameGetsRecipientDomain() {
        when(notificationDispatcher.dispatch(any())).thenReturn(true);
        ReportMeta meta = ReportMeta.builder().referrer("house").doctorName("Dr. Cuddy").build();

        Optional<CriticalFindingNotification> sent =
                notifier.notifyIfRequired(result(FindingSeverity.URGENT, true), meta, "x".repeat(600), 7L);

        assertTrue(sent.isPresent());
        CriticalFindingNotification notification = sent.get();
        assertEquals("house@hospital.com", notification.getRecipient());
        assertEquals(NotificationPriority.URGENT, notification.getPriority());
        assertEquals("Unknown Patient", notification.getPatientName());
        assertEquals("N/A", notification.getAccession());
        assertEquals("Dr. Cuddy", notification.getRadiologistName());
        assertEquals(7L, notification.getReportId());
        assertEquals(500, notification.getReportExcerpt().length());
        assertTrue(notification.getReportExcerpt().endsWith("..."));
        assertTrue(notification.isDelivered());
    }

    @Test
    public void testEmailReferrerAndFailedDelivery() {
        when(notificationDispatcher.dispatch(any())).thenReturn(false);
        ReportMeta meta = ReportMeta.builder().referrer(" dr.house@clinic.org ").patientName("Jane Roe").accession("CR-42").build();

        CriticalFindingNotification notification =
                notifier.notifyIfRequired(result(FindingSeverity.CRITICAL, true), meta, "short report", 1L).orElseThrow();

        ArgumentCaptor<CriticalFindingNotification> dispatched = ArgumentCaptor.forClass(CriticalFindingNotification.class);
        verify(notificationDispatcher).dispatch(dispatched.capture());
        assertEquals("dr.house@clinic.org", dispatched.getValue().getRecipient());
        assertEquals(NotificationPriority.CRITICAL, notification.getPriority());
        assertEquals("Jane Roe", notification.getPatientName());
        assertEquals("short report", notification.getReportExcerpt());
        assertFalse(notification.isDelivered());
    }

    @Test
    public void testNothingSentWhenNotRequiredOrNoReferrer() {
        ReportMeta withReferrer = ReportMeta.builder().referrer("house").build();
        assertTrue(notifier.notifyIfRequired(result(FindingSeverity.HIGH, false), withReferrer, "r", 1L).isEmpty());
        assertTrue(notifier.notifyIfRequired(result(FindingSeverity.URGENT, true), new ReportMeta(), "r", 1L).isEmpty());

        notificationProperties.setEnabled(false);
        assertTrue(notifier.notifyIfRequired(result(FindingSeverity.URGENT, true), withReferrer, "r", 1L).isEmpty());
        verifyNoInteractions(notificationDispatcher);
    }
}
