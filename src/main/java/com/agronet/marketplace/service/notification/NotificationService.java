package com.agronet.marketplace.service.notification;

import com.agronet.marketplace.domain.model.Notification;
import com.agronet.marketplace.exception.ResourceNotFoundException;
import com.agronet.marketplace.repository.NotificationRepository;
import com.agronet.marketplace.service.PageRequests;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * Notification inbox: storage of dispatched events and the recipient's read/seen operations.
 *
 * @author Agronet Marketplace Team
 */
@Service
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    private static final TypeReference<Map<String, String>> DATA_TYPE = new TypeReference<>() {
    };

    private final NotificationRepository notificationRepository;
    private final PageRequests pageRequests;
    private final ObjectMapper objectMapper;

    public NotificationService(
            NotificationRepository notificationRepository,
            PageRequests pageRequests,
            ObjectMapper objectMapper
    ) {
        this.notificationRepository = notificationRepository;
        this.pageRequests = pageRequests;
        this.objectMapper = objectMapper;
    }

    /**
     * Store a dispatched event in the recipient's inbox.
     *
     * @param event Notification event
     * @return true if stored, false if the event was already stored
     */
    @Transactional
    public boolean store(NotificationEvent event) {
        if (notificationRepository.existsByEventId(event.getEventId())) {
            logger.debug("Notification event {} already stored, skipping", event.getEventId());
            return false;
        }

        Notification notification = Notification.builder()
                .eventId(event.getEventId())
                .userId(event.getRecipientId())
                .type(event.getEventType().name())
                .title(event.getTitle())
                .body(event.getBody())
                .dataJson(writeData(event.getData()))
                .createdAt(event.getOccurredAt())
                .build();

        notificationRepository.save(notification);
        return true;
    }

    /**
     * List a user's notifications, newest first.
     *
     * @param userId Recipient
     * @param seen Seen filter, null for all
     * @param type Type filter, null for all
     * @param page 1-based page number
     * @param limit Page size
     * @return Page of notifications
     */
    @Transactional(readOnly = true)
    public Page<Notification> list(String userId, Boolean seen, String type, Integer page, Integer limit) {
        return notificationRepository.findForUser(
                userId, seen, type, pageRequests.of(page, limit, Sort.by(Sort.Direction.DESC, "createdAt")));
    }

    @Transactional(readOnly = true)
    public long unreadCount(String userId) {
        return notificationRepository.countByUserIdAndSeenFalse(userId);
    }

    /**
     * Mark one notification as seen. Marking an already seen notification is a no-op.
     *
     * @throws ResourceNotFoundException if the notification does not exist or belongs to someone else
     */
    @Transactional
    public Notification markSeen(String userId, String notificationId) {
        Notification notification = notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
        notification.markSeen();
        return notificationRepository.save(notification);
    }

    /**
     * @return number of notifications that were marked
     */
    @Transactional
    public int markAllSeen(String userId) {
        int updated = notificationRepository.markAllSeen(userId, Instant.now());
        logger.info("Marked {} notifications as seen for user {}", updated, userId);
        return updated;
    }

    public Map<String, String> readData(Notification notification) {
        if (notification.getDataJson() == null || notification.getDataJson().isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(notification.getDataJson(), DATA_TYPE);
        } catch (JsonProcessingException e) {
            logger.warn("Unreadable data on notification {}: {}", notification.getId(), e.getMessage());
            return Collections.emptyMap();
        }
    }

    private String writeData(Map<String, String> data) {
        if (data == null || data.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unserializable notification data: {}", e.getMessage());
            return null;
        }
    }
}
