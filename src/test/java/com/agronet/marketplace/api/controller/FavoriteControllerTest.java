package com.agronet.marketplace.api.controller;

import com.agronet.marketplace.api.exception.GlobalExceptionHandler;
import com.agronet.marketplace.domain.model.Favorite;
import com.agronet.marketplace.exception.ConflictException;
import com.agronet.marketplace.exception.ResourceNotFoundException;
import com.agronet.marketplace.exception.ValidationException;
import com.agronet.marketplace.integration.ImageStore;
import com.agronet.marketplace.security.CurrentUser;
import com.agronet.marketplace.service.FavoriteService;
import com.agronet.marketplace.service.FavoriteStatus;
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
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static com.agronet.marketplace.testutil.TestDataBuilder.*;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for FavoriteController using MockMvc.
 */
@WebMvcTest(FavoriteController.class)
@ContextConfiguration(classes = {FavoriteController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("FavoriteController Tests")
class FavoriteControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FavoriteService favoriteService;

    @MockBean
    private ImageStore imageStore;

    @BeforeEach
    void authenticate() {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                APPLICANT_ID, null, List.of(new SimpleGrantedAuthority("ROLE_USER"))));
    }

    @AfterEach
    void clearSecurityContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("POST /favorites - Returns 201 with the stored favorite")
    void add_Returns201() throws Exception {
        // Given
        Favorite favorite = Favorite.builder()
                .id("FAV-001")
                .announcementId("ANN-001")
                .userId(APPLICANT_ID)
                .createdAt(Instant.parse("2026-01-10T08:00:00Z"))
                .build();
        when(favoriteService.add(CurrentUser.user(APPLICANT_ID), "ANN-001")).thenReturn(favorite);

        // When / Then
        mockMvc.perform(post("/api/v1/favorites")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"announcementId\": \"ANN-001\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("FAV-001"))
                .andExpect(jsonPath("$.announcementId").value("ANN-001"));
    }

    @Test
    @DisplayName("POST /favorites - Missing announcement id returns 400")
    void add_MissingAnnouncementId_Returns400() throws Exception {
        // When / Then
        mockMvc.perform(post("/api/v1/favorites")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.announcementId").value("Announcement ID is required"));

        verifyNoInteractions(favoriteService);
    }

    @Test
    @DisplayName("POST /favorites - Unpublished announcement returns 400")
    void add_Unpublished_Returns400() throws Exception {
        // Given
        when(favoriteService.add(any(), eq("ANN-001")))
                .thenThrow(new ValidationException("announcementId",
                        "Only published announcements can be added to favorites"));

        // When / Then
        mockMvc.perform(post("/api/v1/favorites")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"announcementId\": \"ANN-001\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Only published announcements can be added to favorites"));
    }

    @Test
    @DisplayName("POST /favorites - Duplicate returns 409")
    void add_Duplicate_Returns409() throws Exception {
        // Given
        when(favoriteService.add(any(), eq("ANN-001")))
                .thenThrow(new ConflictException("Announcement is already in your favorites"));

        // When / Then
        mockMvc.perform(post("/api/v1/favorites")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"announcementId\": \"ANN-001\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Announcement is already in your favorites"));
    }

    @Test
    @DisplayName("GET /favorites - Returns favorited announcements with paging")
    void list_ReturnsPage() throws Exception {
        // Given
        when(favoriteService.list(CurrentUser.user(APPLICANT_ID), null, null))
                .thenReturn(new PageImpl<>(List.of(announcement().build()), PageRequest.of(0, 20), 1));

        // When / Then
        mockMvc.perform(get("/api/v1/favorites"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].id").value("ANN-001"))
                .andExpect(jsonPath("$.total").value(1));
    }

    @Test
    @DisplayName("GET /favorites/{announcementId} - Returns favorited flag and count")
    void status_ReturnsFlagAndCount() throws Exception {
        // Given
        when(favoriteService.status(CurrentUser.user(APPLICANT_ID), "ANN-001"))
                .thenReturn(new FavoriteStatus("ANN-001", true, 7));

        // When / Then
        mockMvc.perform(get("/api/v1/favorites/ANN-001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.favorited").value(true))
                .andExpect(jsonPath("$.favoriteCount").value(7));
    }

    @Test
    @DisplayName("DELETE /favorites/{announcementId} - Returns 204")
    void remove_Returns204() throws Exception {
        // When / Then
        mockMvc.perform(delete("/api/v1/favorites/ANN-001"))
                .andExpect(status().isNoContent());

        verify(favoriteService).remove(CurrentUser.user(APPLICANT_ID), "ANN-001");
    }

    @Test
    @DisplayName("DELETE /favorites/{announcementId} - Unknown favorite returns 404")
    void remove_Unknown_Returns404() throws Exception {
        // Given
        doThrow(new ResourceNotFoundException("Favorite", "ANN-404"))
                .when(favoriteService).remove(any(), eq("ANN-404"));

        // When / Then
        mockMvc.perform(delete("/api/v1/favorites/ANN-404"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /favorites - Anonymous caller returns 401")
    void list_Anonymous_Returns401() throws Exception {
        // Given
        SecurityContextHolder.clearContext();

        // When / Then
        mockMvc.perform(get("/api/v1/favorites"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(favoriteService);
    }
}
