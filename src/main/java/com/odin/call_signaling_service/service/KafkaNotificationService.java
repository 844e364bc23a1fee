package com.odin.call_signaling_service.service;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.dto.NotificationMessage;
import com.odin.call_signaling_service.enums.NotificationChannel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Service for producing call push notifications to Kafka.
 * Push is the fallback for invitees that are not listening on the invites
 * channel; it is fire-and-forget and never fails the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KafkaNotificationService {

    private final KafkaTemplate<String, NotificationMessage> kafkaTemplate;

    @Value("${kafka.notification.topic:notification-events}")
    private String notificationTopic;

    @Value("${offline.notification.enabled:true}")
    private boolean notificationEnabled;

    /**
     * Publish one push notification per user, keyed by user id.
     */
    public void publishCallNotification(Collection<String> userIds, String title, String body, String tag) {
        if (!notificationEnabled) {
            log.debug("Notification publishing is disabled via configuration");
            return;
        }
        if (userIds == null || userIds.isEmpty()) {
            log.warn("publishCallNotification: no recipients for tag={}", tag);
            return;
        }

        for (String userId : userIds) {
            Long customerId = toCustomerId(userId);
            if (customerId == null) {
                log.warn("publishCallNotification: skipping userId={}, not a customer id", userId);
                continue;
            }
            try {
                Map<String, String> notificationMap = new HashMap<>();
                notificationMap.put(ApplicationConstants.NOTIFICATION_MAP_TITLE, title);
                notificationMap.put(ApplicationConstants.NOTIFICATION_MAP_BODY, body);
                notificationMap.put(ApplicationConstants.NOTIFICATION_MAP_TAG, tag);

                NotificationMessage notification = NotificationMessage.builder()
                        .customerId(customerId)
                        .notificationId(ApplicationConstants.CALL_NOTIFICATION_ID)
                        .channel(NotificationChannel.PUSH)
                        .map(notificationMap)
                        .build();

                kafkaTemplate.send(notificationTopic, userId, notification)
                        .whenComplete((result, ex) -> {
                            if (ex != null) {
                                log.error("Kafka rejected call notification for userId={}: {}",
                                        userId, ex.getMessage(), ex);
                            }
                        });

                log.info("Published call notification to Kafka - topic={}, userId={}, tag={}",
                        notificationTopic, userId, tag);
            } catch (Exception e) {
                log.error("Failed to publish call notification to Kafka for userId={}: {}",
                        userId, e.getMessage(), e);
            }
        }
    }

    private Long toCustomerId(String userId) {
        try {
            return Long.parseLong(userId);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
