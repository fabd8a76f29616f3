package com.cloudcostbuddy.notification;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookNotificationDispatcherTest {

    private static final String URL = "http://push.local/notify";

    private MockRestServiceServer server;
    private WebhookNotificationDispatcher dispatcher;

    private final NotificationMessage message = new NotificationMessage(
            "user-1", "Budget Threshold Exceeded", "Budget threshold exceeded for AWS.",
            Map.of("type", "budget_threshold", "ruleId", "1"));

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        dispatcher = new WebhookNotificationDispatcher(restTemplate, URL);
    }

    @Test
    @DisplayName("Should POST the message as JSON and report delivery on 2xx")
    void shouldDeliverOnSuccess() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.userId").value("user-1"))
                .andExpect(jsonPath("$.title").value("Budget Threshold Exceeded"))
                .andExpect(jsonPath("$.data.ruleId").value("1"))
                .andRespond(withSuccess());

        DispatchResult result = dispatcher.send(message);

        assertThat(result.delivered()).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("Should report a non-2xx answer that is not an error as not delivered")
    void shouldReportRedirectAsNotDelivered() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.MULTIPLE_CHOICES));

        DispatchResult result = dispatcher.send(message);

        assertThat(result.delivered()).isFalse();
        assertThat(result.detail()).isEqualTo("HTTP 300");
    }

    @Test
    @DisplayName("Should wrap transport and server errors")
    void shouldWrapServerError() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> dispatcher.send(message))
                .isInstanceOf(NotificationDeliveryException.class)
                .hasMessageContaining("user-1");
    }
}
