package com.gdin.radiology.report.notification;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

public class WebhookNotificationDispatcherTest {
    private static final String URL = "http://alerts.local/hook";

    private final RestTemplate restTemplate = new RestTemplate();
    private final MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
    private final WebhookNotificationDispatcher dispatcher = new WebhookNotificationDispatcher(restTemplate, URL);

    private static CriticalFindingNotification notification() {
        return CriticalFindingNotification.builder()
                .notificationId("n-1")
                .reportId(3L)
                .recipient("house@hospital.com")
                .priority(NotificationPriority.URGENT)
                .findings(List.of())
                .patientName("Jane Roe")
                .accession("CR-1")
                .reportExcerpt("excerpt")
                .radiologistName("Dr. Cuddy")
                .createdAt(LocalDateTime.of(2024, 5, 1, 14, 30))
                .build();
    }

    @Test
    public void testPostsJson() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.recipient").value("house@hospital.com"))
                .andExpect(jsonPath("$.report_id").value(3))
                .andRespond(withSuccess());

        assertTrue(dispatcher.dispatch(notification()));
        server.verify();
    }

    @Test
    public void testServerErrorIsReportedAsNotDelivered() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));
        assertFalse(dispatcher.dispatch(notification()));
        server.verify();
    }
}
