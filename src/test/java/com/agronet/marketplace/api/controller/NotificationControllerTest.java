package com.agronet.marketplace.api.controller;

import com.agronet.marketplace.api.exception.GlobalExceptionHandler;
import com.agronet.marketplace.domain.model.Notification;
import com.agronet.marketplace.exception.ResourceNotFoundException;
import com.agronet.marketplace.service.notification.NotificationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for NotificationController using MockMvc.
 */
@WebMvcTest(NotificationController.class)
@ContextConfiguration(classes = {NotificationController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("NotificationController Tests")
class NotificationControllerTest {

    private static final String USER_ID = "owner-001";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private NotificationService notificationService;

    @BeforeEach
    void authenticate() {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                USER_ID, null, List.of(new SimpleGrantedAuthority("ROLE_USER"))));
    }

    @AfterEach
    void clearSecurityContext() {
        SecurityContextHolder.clearContext();
    }

    private static Notification notification(boolean seen) {
        return Notification.builder()
                .id("NTF-001")
                .eventId("evt-001")
                .userId(USER_ID)
                .type("APPLICATION_CREATED")
                .title("New application")
                .body("Armen Petrosyan applied for 40 kg")
                .dataJson("{\"announcementId\":\"ANN-001\"}")
                .seen(seen)
                .seenAt(seen ? Instant.parse("2026-01-10T09:00:00Z") : null)
                .createdAt(Instant.parse("2026-01-10T08:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("GET /notifications - Returns decoded data and paging")
    void list_ReturnsPage() throws Exception {
        // Given
        Notification unread = notification(false);
        when(notificationService.list(USER_ID, false, null, null, null))
                .thenReturn(new PageImpl<>(List.of(unread), PageRequest.of(0, 20), 1));
        when(notificationService.readData(unread)).thenReturn(Map.of("announcementId", "ANN-001"));

        // When / Then
        mockMvc.perform(get("/api/v1/notifications").param("seen", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].type").value("APPLICATION_CREATED"))
                .andExpect(jsonPath("$.items[0].data.announcementId").value("ANN-001"))
                .andExpect(jsonPath("$.items[0].seen").value(false))
                .andExpect(jsonPath("$.total").value(1));
    }

    @Test
    @DisplayName("GET /notifications/unread-count - Returns count")
    void unreadCount_ReturnsCount() throws Exception {
        // Given
        when(notificationService.unreadCount(USER_ID)).thenReturn(3L);

        // When / Then
        mockMvc.perform(get("/api/v1/notifications/unread-count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unread").value(3));
    }

    @Test
    @DisplayName("POST /notifications/{id}/seen - Returns seen notification")
    void markSeen_ReturnsNotification() throws Exception {
        // Given
        Notification seen = notification(true);
        when(notificationService.markSeen(USER_ID, "NTF-001")).thenReturn(seen);
        when(notificationService.readData(seen)).thenReturn(Map.of());

        // When / Then
        mockMvc.perform(post("/api/v1/notifications/NTF-001/seen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("NTF-001"))
                .andExpect(jsonPath("$.seen").value(true));
    }

    @Test
    @DisplayName("POST /notifications/{id}/seen - Other user's notification returns 404")
    void markSeen_NotFound_Returns404() throws Exception {
        // Given
        when(notificationService.markSeen(USER_ID, "NTF-999"))
                .thenThrow(new ResourceNotFoundException("Notification", "NTF-999"));

        // When / Then
        mockMvc.perform(post("/api/v1/notifications/NTF-999/seen"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("POST /notifications/seen - Returns number updated")
    void markAllSeen_ReturnsUpdated() throws Exception {
        // Given
        when(notificationService.markAllSeen(USER_ID)).thenReturn(4);

        // When / Then
        mockMvc.perform(post("/api/v1/notifications/seen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(4));
    }

    @Test
    @DisplayName("GET /notifications - Anonymous caller returns 401")
    void list_Anonymous_Returns401() throws Exception {
        // Given
        SecurityContextHolder.clearContext();

        // When / Then
        mockMvc.perform(get("/api/v1/notifications"))
                .andExpect(status().isUnauthorized());

        verify(notificationService, never()).list(any(), any(), any(), any(), any());
    }
}
