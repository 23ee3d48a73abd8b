package com.agronet.marketplace.infrastructure.messaging;

import com.agronet.marketplace.config.MarketplaceProperties;
import com.agronet.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.agronet.marketplace.service.notification.NotificationDispatcher;
import com.agronet.marketplace.service.notification.NotificationEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes lifecycle notifications to Kafka.
 *
 * Partitioning: records are keyed by recipient id, so one user's notifications stay ordered.
 *
 * @author Agronet Marketplace Team
 */
@Service
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(KafkaNotificationDispatcher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MarketplaceMetricsService metricsService;
    private final String topic;

    public KafkaNotificationDispatcher(
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            MarketplaceMetricsService metricsService,
            MarketplaceProperties properties
    ) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.topic = properties.getNotifications().getTopic();
    }

    /**
     * Publish a notification event. Delivery failures are logged from the send callback.
     *
     * @param event Notification event
     */
    @Override
    public void emit(NotificationEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing notification event {}", event.getEventId(), e);
            metricsService.recordNotificationFailure(event.getEventType().name());
            return;
        }

        CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                topic,
                event.getRecipientId(),
                payload
        );

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                logger.debug("Published {} event {} for user {}, partition: {}",
                        event.getEventType(), event.getEventId(), event.getRecipientId(),
                        result.getRecordMetadata().partition());
            } else {
                logger.error("Failed to publish {} event {} for user {}",
                        event.getEventType(), event.getEventId(), event.getRecipientId(), ex);
                metricsService.recordNotificationFailure(event.getEventType().name());
            }
        });
    }
}
