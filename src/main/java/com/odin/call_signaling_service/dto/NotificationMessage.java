package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.call_signaling_service.enums.NotificationChannel;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Push notification request sent to Kafka and consumed by the notification
 * service, which delivers it to devices that are not listening for invites.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationMessage {

    private Long customerId;
    private Long notificationId;
    private NotificationChannel channel;
    private Map<String, String> map;  // title, body, tag
}
