package com.agronet.marketplace.api.controller;

import com.agronet.marketplace.api.dto.CreateApplicationRequest;
import com.agronet.marketplace.api.dto.UpdateApplicationRequest;
import com.agronet.marketplace.api.exception.GlobalExceptionHandler;
import com.agronet.marketplace.domain.model.Application;
import com.agronet.marketplace.domain.model.Application.ApplicationStatus;
import com.agronet.marketplace.exception.ConflictException;
import com.agronet.marketplace.exception.InvalidTransitionException;
import com.agronet.marketplace.exception.QuantityExceededException;
import com.agronet.marketplace.exception.ValidationException;
import com.agronet.marketplace.security.CurrentUser;
import com.agronet.marketplace.service.ApplicationService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static com.agronet.marketplace.testutil.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for ApplicationController using MockMvc.
 */
@WebMvcTest(ApplicationController.class)
@ContextConfiguration(classes = {ApplicationController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("ApplicationController Tests")
class ApplicationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ApplicationService applicationService;

    @AfterEach
    void clearSecurityContext() {
        SecurityContextHolder.clearContext();
    }

    private static void authenticate(String userId) {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                userId, null, List.of(new SimpleGrantedAuthority("ROLE_USER"))));
    }

    // ========================================
    // POST /announcements/{id}/applications Tests
    // ========================================

    @Test
    @DisplayName("POST /applications - Valid request returns 201 Created")
    void create_ValidRequest_Returns201() throws Exception {
        // Given
        authenticate(APPLICANT_ID);
        String requestBody = """
                {
                    "count": 40,
                    "deliveryDates": ["2026-01-20"],
                    "notes": "Pickup in the morning"
                }
                """;
        when(applicationService.create(eq(CurrentUser.user(APPLICANT_ID)), eq("ANN-001"), any()))
                .thenReturn(application().notes("Pickup in the morning").build());

        // When
        mockMvc.perform(post("/api/v1/announcements/ANN-001/applications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("APP-001"))
                .andExpect(jsonPath("$.announcementId").value("ANN-001"))
                .andExpect(jsonPath("$.applicantId").value(APPLICANT_ID))
                .andExpect(jsonPath("$.count").value(40))
                .andExpect(jsonPath("$.deliveryDates[0]").value("2026-01-20"))
                .andExpect(jsonPath("$.status").value("PENDING"));

        // Then
        ArgumentCaptor<CreateApplicationRequest> request = ArgumentCaptor.forClass(CreateApplicationRequest.class);
        verify(applicationService).create(eq(CurrentUser.user(APPLICANT_ID)), eq("ANN-001"), request.capture());
        assertThat(request.getValue().getCount()).isEqualByComparingTo(new BigDecimal("40"));
        assertThat(request.getValue().getDeliveryDates()).containsExactly("2026-01-20");
    }

    @Test
    @DisplayName("POST /applications - Missing delivery dates returns 400")
    void create_NoDeliveryDates_Returns400() throws Exception {
        // Given
        authenticate(APPLICANT_ID);

        // When / Then
        mockMvc.perform(post("/api/v1/announcements/ANN-001/applications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\": 40, \"deliveryDates\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.deliveryDates")
                        .value("At least one delivery date is required"));

        verifyNoInteractions(applicationService);
    }

    @Test
    @DisplayName("POST /applications - Duplicate pending application returns 409")
    void create_Duplicate_Returns409() throws Exception {
        // Given
        authenticate(APPLICANT_ID);
        when(applicationService.create(any(), any(), any()))
                .thenThrow(new ConflictException("You already have a pending application for this announcement"));

        // When / Then
        mockMvc.perform(post("/api/v1/announcements/ANN-001/applications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\": 40, \"deliveryDates\": [\"2026-01-20\"]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Conflict"))
                .andExpect(jsonPath("$.message")
                        .value("You already have a pending application for this announcement"));
    }

    @Test
    @DisplayName("POST /applications - Past delivery date returns 400 with field")
    void create_PastDate_Returns400() throws Exception {
        // Given
        authenticate(APPLICANT_ID);
        when(applicationService.create(any(), any(), any()))
                .thenThrow(new ValidationException("deliveryDates", "Delivery dates cannot be in the past: 2026-01-01"));

        // When / Then
        mockMvc.perform(post("/api/v1/announcements/ANN-001/applications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\": 40, \"deliveryDates\": [\"2026-01-01\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"))
                .andExpect(jsonPath("$.details.field").value("deliveryDates"));
    }

    @Test
    @DisplayName("POST /applications - Anonymous caller returns 401")
    void create_Anonymous_Returns401() throws Exception {
        // When / Then
        mockMvc.perform(post("/api/v1/announcements/ANN-001/applications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\": 40, \"deliveryDates\": [\"2026-01-20\"]}"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(applicationService);
    }

    // ========================================
    // Owner Decision Tests
    // ========================================

    @Test
    @DisplayName("POST /approve - Returns approved application")
    void approve_Returns200() throws Exception {
        // Given
        authenticate(OWNER_ID);
        when(applicationService.approve(CurrentUser.user(OWNER_ID), "ANN-001", "APP-001"))
                .thenReturn(application().status(ApplicationStatus.APPROVED).build());

        // When / Then
        mockMvc.perform(post("/api/v1/announcements/ANN-001/applications/APP-001/approve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"));
    }

    @Test
    @DisplayName("POST /approve - Quantity exceeded returns 409 with quantities")
    void approve_QuantityExceeded_Returns409() throws Exception {
        // Given
        authenticate(OWNER_ID);
        when(applicationService.approve(CurrentUser.user(OWNER_ID), "ANN-001", "APP-002"))
                .thenThrow(new QuantityExceededException("ANN-001", new BigDecimal("70"), new BigDecimal("60")));

        // When / Then
        mockMvc.perform(post("/api/v1/announcements/ANN-001/applications/APP-002/approve"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Quantity Exceeded"))
                .andExpect(jsonPath("$.details.announcementId").value("ANN-001"))
                .andExpect(jsonPath("$.details.requestedQuantity").value(70))
                .andExpect(jsonPath("$.details.availableQuantity").value(60));
    }

    @Test
    @DisplayName("POST /reject - Already rejected returns 409")
    void reject_AlreadyRejected_Returns409() throws Exception {
        // Given
        authenticate(OWNER_ID);
        when(applicationService.reject(CurrentUser.user(OWNER_ID), "ANN-001", "APP-001"))
                .thenThrow(new InvalidTransitionException("Application",
                        ApplicationStatus.REJECTED, ApplicationStatus.REJECTED,
                        List.of(ApplicationStatus.PENDING, ApplicationStatus.CLOSED)));

        // When / Then
        mockMvc.perform(post("/api/v1/announcements/ANN-001/applications/APP-001/reject"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.allowedStatuses", contains("PENDING", "CLOSED")));
    }

    @Test
    @DisplayName("POST /announcements/{aid}/applications/{id}/close - Owner close is scoped to the announcement")
    void closeByOwner_PassesAnnouncementId() throws Exception {
        // Given
        authenticate(OWNER_ID);
        when(applicationService.close(CurrentUser.user(OWNER_ID), "ANN-001", "APP-001"))
                .thenReturn(application().status(ApplicationStatus.CLOSED).build());

        // When / Then
        mockMvc.perform(post("/api/v1/announcements/ANN-001/applications/APP-001/close"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CLOSED"));
    }

    @Test
    @DisplayName("GET /announcements/{id}/applications - Returns page of applications")
    void listForAnnouncement_ReturnsPage() throws Exception {
        // Given
        authenticate(OWNER_ID);
        when(applicationService.listForAnnouncement(CurrentUser.user(OWNER_ID), "ANN-001", null, 10))
                .thenReturn(new PageImpl<>(List.of(application().build(), application().id("APP-002").build()),
                        PageRequest.of(0, 10), 2));

        // When / Then
        mockMvc.perform(get("/api/v1/announcements/ANN-001/applications").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(2)))
                .andExpect(jsonPath("$.items[1].id").value("APP-002"))
                .andExpect(jsonPath("$.limit").value(10))
                .andExpect(jsonPath("$.totalPages").value(1));
    }

    // ========================================
    // Applicant Endpoint Tests
    // ========================================

    @Test
    @DisplayName("POST /applications/{id}/close - Applicant close has no announcement scope")
    void close_Applicant_NullAnnouncement() throws Exception {
        // Given
        authenticate(APPLICANT_ID);
        when(applicationService.close(CurrentUser.user(APPLICANT_ID), null, "APP-001"))
                .thenReturn(application().status(ApplicationStatus.CLOSED).build());

        // When / Then
        mockMvc.perform(post("/api/v1/applications/APP-001/close"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CLOSED"));

        verify(applicationService).close(CurrentUser.user(APPLICANT_ID), null, "APP-001");
    }

    @Test
    @DisplayName("POST /applications/{id}/reopen - Returns pending application")
    void reopen_Returns200() throws Exception {
        // Given
        authenticate(APPLICANT_ID);
        when(applicationService.reopen(CurrentUser.user(APPLICANT_ID), "APP-001"))
                .thenReturn(application().build());

        // When / Then
        mockMvc.perform(post("/api/v1/applications/APP-001/reopen"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    @DisplayName("PUT /applications/{id} - Editing approved application returns 409")
    void edit_Approved_Returns409() throws Exception {
        // Given
        authenticate(APPLICANT_ID);
        when(applicationService.edit(eq(CurrentUser.user(APPLICANT_ID)), eq("APP-001"), any(UpdateApplicationRequest.class)))
                .thenThrow(new InvalidTransitionException("Application", ApplicationStatus.APPROVED, "edited",
                        List.of(ApplicationStatus.PENDING)));

        // When / Then
        mockMvc.perform(put("/api/v1/applications/APP-001")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\": 30}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message")
                        .value("Application in status APPROVED cannot be edited. Allowed only in: PENDING"));
    }

    @Test
    @DisplayName("GET /applications/mine - Passes announcement filter")
    void listMine_WithAnnouncementFilter() throws Exception {
        // Given
        authenticate(APPLICANT_ID);
        when(applicationService.listMine(CurrentUser.user(APPLICANT_ID), "ANN-001", null, null))
                .thenReturn(new PageImpl<>(List.of(application().build()), PageRequest.of(0, 20), 1));

        // When / Then
        mockMvc.perform(get("/api/v1/applications/mine").param("announcementId", "ANN-001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0].announcementId").value("ANN-001"))
                .andExpect(jsonPath("$.page").value(1));
    }
}
