package com.agronet.marketplace.service;

import com.agronet.marketplace.config.MarketplaceProperties;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.domain.model.Favorite;
import com.agronet.marketplace.exception.ConflictException;
import com.agronet.marketplace.exception.ResourceNotFoundException;
import com.agronet.marketplace.exception.ValidationException;
import com.agronet.marketplace.repository.AnnouncementRepository;
import com.agronet.marketplace.repository.FavoriteRepository;
import com.agronet.marketplace.security.CurrentUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.Optional;

import static com.agronet.marketplace.testutil.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FavoriteService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("FavoriteService Unit Tests")
class FavoriteServiceTest {

    @Mock
    private FavoriteRepository favoriteRepository;

    @Mock
    private AnnouncementRepository announcementRepository;

    private FavoriteService favoriteService;

    private final CurrentUser user = CurrentUser.user(APPLICANT_ID);

    @BeforeEach
    void setUp() {
        favoriteService = new FavoriteService(
                favoriteRepository, announcementRepository, new PageRequests(new MarketplaceProperties()));
    }

    // ========================================
    // add() Tests
    // ========================================

    @Test
    @DisplayName("add - Success: published announcement is stored for the caller")
    void add_Published_Stored() {
        // Given
        when(announcementRepository.findById("ANN-001")).thenReturn(Optional.of(announcement().build()));
        when(favoriteRepository.existsByAnnouncementIdAndUserId("ANN-001", APPLICANT_ID)).thenReturn(false);
        when(favoriteRepository.saveAndFlush(any(Favorite.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        favoriteService.add(user, "ANN-001");

        // Then
        ArgumentCaptor<Favorite> captor = ArgumentCaptor.forClass(Favorite.class);
        verify(favoriteRepository).saveAndFlush(captor.capture());
        assertThat(captor.getValue().getAnnouncementId()).isEqualTo("ANN-001");
        assertThat(captor.getValue().getUserId()).isEqualTo(APPLICANT_ID);
    }

    @Test
    @DisplayName("add - Failure: unknown announcement")
    void add_Unknown_ThrowsNotFound() {
        // Given
        when(announcementRepository.findById("ANN-404")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> favoriteService.add(user, "ANN-404"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Announcement with ID ANN-404 not found");

        verifyNoInteractions(favoriteRepository);
    }

    @Test
    @DisplayName("add - Failure: only published announcements can be favorited")
    void add_Pending_ThrowsValidation() {
        // Given
        when(announcementRepository.findById("ANN-001"))
                .thenReturn(Optional.of(announcement().status(AnnouncementStatus.PENDING).build()));

        // When / Then
        assertThatThrownBy(() -> favoriteService.add(user, "ANN-001"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Only published announcements can be added to favorites");

        verify(favoriteRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("add - Failure: already favorited")
    void add_Duplicate_ThrowsConflict() {
        // Given
        when(announcementRepository.findById("ANN-001")).thenReturn(Optional.of(announcement().build()));
        when(favoriteRepository.existsByAnnouncementIdAndUserId("ANN-001", APPLICANT_ID)).thenReturn(true);

        // When / Then
        assertThatThrownBy(() -> favoriteService.add(user, "ANN-001"))
                .isInstanceOf(ConflictException.class)
                .hasMessage("Announcement is already in your favorites");

        verify(favoriteRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("add - Failure: unique constraint hit by a concurrent add maps to conflict")
    void add_ConcurrentDuplicate_ThrowsConflict() {
        // Given
        when(announcementRepository.findById("ANN-001")).thenReturn(Optional.of(announcement().build()));
        when(favoriteRepository.existsByAnnouncementIdAndUserId("ANN-001", APPLICANT_ID)).thenReturn(false);
        when(favoriteRepository.saveAndFlush(any(Favorite.class)))
                .thenThrow(new DataIntegrityViolationException("uk_announcement_favorite_user"));

        // When / Then
        assertThatThrownBy(() -> favoriteService.add(user, "ANN-001"))
                .isInstanceOf(ConflictException.class);
    }

    // ========================================
    // remove() / list() / status() Tests
    // ========================================

    @Test
    @DisplayName("remove - Success: deletes the caller's favorite")
    void remove_Existing_Deletes() {
        // Given
        Favorite favorite = Favorite.builder().id("FAV-001").announcementId("ANN-001").userId(APPLICANT_ID).build();
        when(favoriteRepository.findByAnnouncementIdAndUserId("ANN-001", APPLICANT_ID))
                .thenReturn(Optional.of(favorite));

        // When
        favoriteService.remove(user, "ANN-001");

        // Then
        verify(favoriteRepository).delete(favorite);
    }

    @Test
    @DisplayName("remove - Failure: nothing to remove")
    void remove_Missing_ThrowsNotFound() {
        // Given
        when(favoriteRepository.findByAnnouncementIdAndUserId("ANN-001", APPLICANT_ID))
                .thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> favoriteService.remove(user, "ANN-001"))
                .isInstanceOf(ResourceNotFoundException.class);

        verify(favoriteRepository, never()).delete(any());
    }

    @Test
    @DisplayName("list - Success: asks for published favorites with a clamped page")
    void list_PublishedOnly() {
        // Given
        when(favoriteRepository.findFavoritedAnnouncements(eq(APPLICANT_ID), eq(AnnouncementStatus.PUBLISHED),
                any(Pageable.class))).thenReturn(Page.empty());

        // When
        favoriteService.list(user, 0, 500);

        // Then
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(favoriteRepository).findFavoritedAnnouncements(
                eq(APPLICANT_ID), eq(AnnouncementStatus.PUBLISHED), pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isZero();
        assertThat(pageable.getValue().getPageSize()).isEqualTo(100);
        assertThat(pageable.getValue().getSort().isUnsorted()).isTrue();
    }

    @Test
    @DisplayName("status - Success: reports flag and total count")
    void status_FlagAndCount() {
        // Given
        when(favoriteRepository.existsByAnnouncementIdAndUserId("ANN-001", APPLICANT_ID)).thenReturn(true);
        when(favoriteRepository.countByAnnouncementId("ANN-001")).thenReturn(4L);

        // When
        FavoriteStatus status = favoriteService.status(user, "ANN-001");

        // Then
        assertThat(status.isFavorited()).isTrue();
        assertThat(status.getFavoriteCount()).isEqualTo(4L);
        assertThat(status.getAnnouncementId()).isEqualTo("ANN-001");
    }
}
