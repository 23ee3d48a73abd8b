package com.agronet.marketplace.service;

import com.agronet.marketplace.config.MarketplaceProperties;
import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.exception.ForbiddenOperationException;
import com.agronet.marketplace.exception.ResourceNotFoundException;
import com.agronet.marketplace.exception.ValidationException;
import com.agronet.marketplace.repository.AnnouncementRepository;
import com.agronet.marketplace.security.CurrentUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static com.agronet.marketplace.testutil.TestDataBuilder.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AnnouncementQueryService visibility and filter validation.
 * Specification contents are covered by AnnouncementRepositoryTest.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AnnouncementQueryService Unit Tests")
class AnnouncementQueryServiceTest {

    @Mock
    private AnnouncementRepository announcementRepository;

    private AnnouncementQueryService queryService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-10T08:00:00Z"), ZoneId.of("Asia/Yerevan"));
        queryService = new AnnouncementQueryService(
                announcementRepository, new PageRequests(new MarketplaceProperties()), clock);
    }

    // ========================================
    // list() Tests
    // ========================================

    @Test
    @DisplayName("list - Success: Anonymous caller gets newest-first page")
    @SuppressWarnings("unchecked")
    void list_Anonymous_NewestFirst() {
        // Given
        Page<Announcement> page = new PageImpl<>(List.of(announcement().build()));
        when(announcementRepository.findAll(any(Specification.class), any(Pageable.class))).thenReturn(page);

        // When
        Page<Announcement> result = queryService.list(null, AnnouncementFilter.empty(), 2, 500);

        // Then
        assertThat(result.getContent()).hasSize(1);
        ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
        verify(announcementRepository).findAll(any(Specification.class), pageable.capture());
        assertThat(pageable.getValue().getPageNumber()).isEqualTo(1);
        assertThat(pageable.getValue().getPageSize()).isEqualTo(100);
        assertThat(pageable.getValue().getSort().getOrderFor("createdAt").getDirection())
                .isEqualTo(Sort.Direction.DESC);
    }

    @Test
    @DisplayName("list - Failure: Non-admin asking for pending announcements")
    void list_NonAdminPending_ThrowsForbidden() {
        // Given
        AnnouncementFilter filter = AnnouncementFilter.builder().status(AnnouncementStatus.PENDING).build();

        // When / Then
        assertThatThrownBy(() -> queryService.list(CurrentUser.user(OWNER_ID), filter, null, null))
                .isInstanceOf(ForbiddenOperationException.class)
                .hasMessage("Only administrators can list announcements in status PENDING");

        verifyNoInteractions(announcementRepository);
    }

    @Test
    @DisplayName("list - Success: Admin may list blocked announcements")
    @SuppressWarnings("unchecked")
    void list_AdminBlocked_Allowed() {
        // Given
        AnnouncementFilter filter = AnnouncementFilter.builder().status(AnnouncementStatus.BLOCKED).build();
        when(announcementRepository.findAll(any(Specification.class), any(Pageable.class)))
                .thenReturn(Page.empty());

        // When
        Page<Announcement> result = queryService.list(CurrentUser.admin(ADMIN_ID), filter, null, null);

        // Then
        assertThat(result.getContent()).isEmpty();
    }

    @Test
    @DisplayName("list - Failure: createdFrom after createdTo")
    void list_InvertedCreatedRange_ThrowsValidation() {
        // Given
        AnnouncementFilter filter = AnnouncementFilter.builder()
                .createdFrom("2026-01-10")
                .createdTo("2026-01-01")
                .build();

        // When / Then
        assertThatThrownBy(() -> queryService.list(null, filter, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("createdFrom must not be after createdTo");
    }

    @Test
    @DisplayName("list - Failure: priceFrom greater than priceTo")
    void list_InvertedPriceRange_ThrowsValidation() {
        // Given
        AnnouncementFilter filter = AnnouncementFilter.builder()
                .priceFrom(new BigDecimal("500"))
                .priceTo(new BigDecimal("100"))
                .build();

        // When / Then
        assertThatThrownBy(() -> queryService.list(null, filter, null, null))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("priceFrom");
    }

    @Test
    @DisplayName("list - Failure: Malformed created date")
    void list_MalformedDate_ThrowsValidation() {
        // Given
        AnnouncementFilter filter = AnnouncementFilter.builder().createdFrom("10/01/2026").build();

        // When / Then
        assertThatThrownBy(() -> queryService.list(null, filter, null, null))
                .isInstanceOf(ValidationException.class);
    }

    // ========================================
    // search() Tests
    // ========================================

    @Test
    @DisplayName("search - Failure: Blank query")
    void search_BlankQuery_ThrowsValidation() {
        // When / Then
        assertThatThrownBy(() -> queryService.search(null, "  ", AnnouncementFilter.empty(), null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Search query is required");
    }

    // ========================================
    // get() Tests
    // ========================================

    @Test
    @DisplayName("get - Success: Published announcement visible to anonymous caller")
    void get_Published_VisibleToAll() {
        // Given
        when(announcementRepository.findById("ANN-001")).thenReturn(Optional.of(announcement().build()));

        // When / Then
        assertThat(queryService.get(null, "ANN-001").getId()).isEqualTo("ANN-001");
    }

    @Test
    @DisplayName("get - Success: Pending announcement visible to owner and admin")
    void get_Pending_OwnerAndAdmin() {
        // Given
        when(announcementRepository.findById("ANN-001"))
                .thenReturn(Optional.of(announcement().status(AnnouncementStatus.PENDING).build()));

        // When / Then
        assertThat(queryService.get(CurrentUser.user(OWNER_ID), "ANN-001")).isNotNull();
        assertThat(queryService.get(CurrentUser.admin(ADMIN_ID), "ANN-001")).isNotNull();
    }

    @Test
    @DisplayName("get - Failure: Pending announcement hidden from other users")
    void get_Pending_HiddenFromOthers() {
        // Given
        when(announcementRepository.findById("ANN-001"))
                .thenReturn(Optional.of(announcement().status(AnnouncementStatus.PENDING).build()));

        // When / Then
        assertThatThrownBy(() -> queryService.get(CurrentUser.user(APPLICANT_ID), "ANN-001"))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThatThrownBy(() -> queryService.get(null, "ANN-001"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("get - Failure: Unknown announcement")
    void get_Unknown_ThrowsNotFound() {
        // Given
        when(announcementRepository.findById("ANN-404")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> queryService.get(null, "ANN-404"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Announcement with ID ANN-404 not found");
    }
}
