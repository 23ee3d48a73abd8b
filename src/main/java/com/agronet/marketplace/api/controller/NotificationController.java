package com.agronet.marketplace.api.controller;

import com.agronet.marketplace.api.dto.NotificationResponse;
import com.agronet.marketplace.api.dto.PageResponse;
import com.agronet.marketplace.domain.model.Notification;
import com.agronet.marketplace.security.SecurityUtils;
import com.agronet.marketplace.service.notification.NotificationService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * The caller's notification inbox.
 *
 * @author Agronet Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/notifications")
@PreAuthorize("isAuthenticated()")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @GetMapping
    public ResponseEntity<PageResponse<NotificationResponse>> list(
            @RequestParam(required = false) Boolean seen,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        String userId = SecurityUtils.requireCurrentUser().getId();
        return ResponseEntity.ok(PageResponse.of(
                notificationService.list(userId, seen, type, page, limit), this::toResponse));
    }

    @GetMapping("/unread-count")
    public ResponseEntity<Map<String, Long>> unreadCount() {
        String userId = SecurityUtils.requireCurrentUser().getId();
        return ResponseEntity.ok(Map.of("unread", notificationService.unreadCount(userId)));
    }

    @PostMapping("/{id}/seen")
    public ResponseEntity<NotificationResponse> markSeen(@PathVariable String id) {
        String userId = SecurityUtils.requireCurrentUser().getId();
        return ResponseEntity.ok(toResponse(notificationService.markSeen(userId, id)));
    }

    @PostMapping("/seen")
    public ResponseEntity<Map<String, Integer>> markAllSeen() {
        String userId = SecurityUtils.requireCurrentUser().getId();
        return ResponseEntity.ok(Map.of("updated", notificationService.markAllSeen(userId)));
    }

    private NotificationResponse toResponse(Notification notification) {
        return NotificationResponse.fromEntity(notification, notificationService.readData(notification));
    }
}
