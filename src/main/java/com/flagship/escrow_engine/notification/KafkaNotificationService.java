package com.flagship.escrow_engine.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Publishes notifications to the notifications topic, keyed by recipient.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KafkaNotificationService implements NotificationService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${kafka.topic.notifications:notifications}")
    private String notificationsTopic;

    @Override
    public void send(Notification notification) {
        try {
            String payload = objectMapper.writeValueAsString(notification);
            kafkaTemplate.send(notificationsTopic, notification.getRecipientId().toString(), payload)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.warn("Notification delivery failed: type={}, recipient={}, contractId={}, error={}",
                                notification.getType(), notification.getRecipientId(),
                                notification.getContractId(), error.getMessage());
                    } else {
                        log.debug("Notification sent: type={}, recipient={}",
                                notification.getType(), notification.getRecipientId());
                    }
                });
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Notification not sent: type={}, recipient={}, error={}",
                    notification.getType(), notification.getRecipientId(), e.getMessage());
        }
    }
}
