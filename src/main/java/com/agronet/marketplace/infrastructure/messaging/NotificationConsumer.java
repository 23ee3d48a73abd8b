package com.agronet.marketplace.infrastructure.messaging;

import com.agronet.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.agronet.marketplace.service.notification.NotificationEvent;
import com.agronet.marketplace.service.notification.NotificationService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Consumes notification events in batches and stores them in the recipients' inboxes.
 *
 * Each record is handled in isolation: an unparseable or failing record is logged and skipped,
 * and the batch is acknowledged once every record has been attempted. Redelivered records are
 * stored once, keyed by event id.
 *
 * @author Agronet Marketplace Team
 */
@Service
public class NotificationConsumer {

    private static final Logger logger = LoggerFactory.getLogger(NotificationConsumer.class);

    private final NotificationService notificationService;
    private final ObjectMapper objectMapper;
    private final MarketplaceMetricsService metricsService;

    public NotificationConsumer(
            NotificationService notificationService,
            ObjectMapper objectMapper,
            MarketplaceMetricsService metricsService
    ) {
        this.notificationService = notificationService;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
    }

    @KafkaListener(
            topics = "${marketplace.notifications.topic:marketplace-notifications}",
            groupId = "${spring.kafka.consumer.group-id:marketplace-notification-inbox}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeNotifications(
            List<ConsumerRecord<String, String>> records,
            Acknowledgment acknowledgment
    ) {
        if (records == null || records.isEmpty()) {
            acknowledge(acknowledgment);
            return;
        }

        int stored = 0;
        int skipped = 0;

        for (ConsumerRecord<String, String> record : records) {
            try {
                NotificationEvent event = objectMapper.readValue(record.value(), NotificationEvent.class);
                if (notificationService.store(event)) {
                    stored++;
                } else {
                    skipped++;
                }
            } catch (JsonProcessingException e) {
                skipped++;
                logger.error("Skipping malformed notification record at partition {} offset {}",
                        record.partition(), record.offset(), e);
                metricsService.recordError("NOTIFICATION_PARSE_ERROR", "consumeNotifications");
            } catch (Exception e) {
                skipped++;
                logger.error("Failed to store notification record at partition {} offset {}",
                        record.partition(), record.offset(), e);
                metricsService.recordError("NOTIFICATION_STORE_ERROR", "consumeNotifications");
            }
        }

        logger.info("Processed notification batch: {} stored, {} skipped", stored, skipped);
        acknowledge(acknowledgment);
    }

    private void acknowledge(Acknowledgment acknowledgment) {
        if (acknowledgment != null) {
            acknowledgment.acknowledge();
        }
    }
}
