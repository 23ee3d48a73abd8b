package com.agronet.marketplace.api;

import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.domain.model.Application.ApplicationStatus;
import com.agronet.marketplace.domain.model.CatalogCategory;
import com.agronet.marketplace.domain.model.CatalogItem;
import com.agronet.marketplace.domain.model.UserAccount;
import com.agronet.marketplace.domain.model.UserAccount.UserType;
import com.agronet.marketplace.integration.ImageStore;
import com.agronet.marketplace.repository.AnnouncementRepository;
import com.agronet.marketplace.repository.AnnouncementViewRepository;
import com.agronet.marketplace.repository.ApplicationRepository;
import com.agronet.marketplace.repository.CatalogCategoryRepository;
import com.agronet.marketplace.repository.CatalogItemRepository;
import com.agronet.marketplace.repository.FavoriteRepository;
import com.agronet.marketplace.repository.UserAccountRepository;
import com.agronet.marketplace.service.notification.NotificationDispatcher;
import com.agronet.marketplace.service.notification.NotificationEvent.EventType;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full-stack lifecycle tests: HTTP through the security chain and services down to H2.
 * Kafka dispatch and image storage are mocked.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Marketplace Lifecycle Integration Tests")
class MarketplaceLifecycleIntegrationTest {

    private static final String OWNER = "owner-001";
    private static final String APPLICANT = "applicant-001";
    private static final String SECOND_APPLICANT = "applicant-002";
    private static final String ADMIN = "admin-001";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private Clock clock;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private AnnouncementRepository announcementRepository;

    @Autowired
    private AnnouncementViewRepository announcementViewRepository;

    @Autowired
    private ApplicationRepository applicationRepository;

    @Autowired
    private UserAccountRepository userAccountRepository;

    @Autowired
    private FavoriteRepository favoriteRepository;

    @Autowired
    private CatalogCategoryRepository catalogCategoryRepository;

    @Autowired
    private CatalogItemRepository catalogItemRepository;

    @MockBean
    private NotificationDispatcher notificationDispatcher;

    @MockBean
    private ImageStore imageStore;

    private LocalDate today;

    @BeforeEach
    void setUp() {
        // Clean up
        favoriteRepository.deleteAll();
        applicationRepository.deleteAll();
        announcementViewRepository.deleteAll();
        announcementRepository.deleteAll();
        catalogItemRepository.deleteAll();
        catalogCategoryRepository.deleteAll();
        userAccountRepository.deleteAll();

        userAccountRepository.save(user(OWNER, "Armen Petrosyan"));
        userAccountRepository.save(user(APPLICANT, "Lilit Hakobyan"));
        userAccountRepository.save(user(SECOND_APPLICANT, "Gor Sargsyan"));

        catalogCategoryRepository.save(CatalogCategory.builder()
                .id("group-grain").nameEn("Grain").nameAm("Հացահատիկ").build());
        catalogItemRepository.save(CatalogItem.builder()
                .id("item-wheat").categoryId("group-grain").nameEn("Wheat").nameAm("Ցորեն").build());

        today = LocalDate.now(clock);
    }

    private static UserAccount user(String id, String fullName) {
        return UserAccount.builder()
                .id(id)
                .fullName(fullName)
                .userType(UserType.FARMER)
                .verified(true)
                .locked(false)
                .regionId("region-ararat")
                .build();
    }

    private static MockHttpServletRequestBuilder as(MockHttpServletRequestBuilder request, String userId) {
        return request.header("X-User-Id", userId);
    }

    private static MockHttpServletRequestBuilder asAdmin(MockHttpServletRequestBuilder request) {
        return request.header("X-User-Id", ADMIN).header("X-User-Role", "ADMIN");
    }

    private String createGoods(int count) throws Exception {
        String body = String.format("""
                {
                    "type": "SELL",
                    "category": "GOODS",
                    "groupId": "group-grain",
                    "itemId": "item-wheat",
                    "price": 5000.00,
                    "count": %d,
                    "unit": "KG"
                }
                """, count);
        MvcResult result = mockMvc.perform(as(post("/api/v1/announcements"), OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Announcement created and published"))
                .andExpect(jsonPath("$.announcement.status").value("PUBLISHED"))
                .andReturn();
        return JsonPath.read(result.getResponse().getContentAsString(), "$.announcement.id");
    }

    private String applicationBody(int count) {
        return String.format("{\"count\": %d, \"deliveryDates\": [\"%s\"]}", count, today.plusDays(3));
    }

    // ========================================
    // Goods Lifecycle
    // ========================================

    @Test
    @DisplayName("Goods - Apply, approve, over-apply and edit after approval")
    void goodsLifecycle() throws Exception {
        // Given
        String announcementId = createGoods(100);

        // When - apply for 40
        MvcResult applied = mockMvc.perform(as(post("/api/v1/announcements/{id}/applications", announcementId), APPLICANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(applicationBody(40)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andReturn();
        String applicationId = JsonPath.read(applied.getResponse().getContentAsString(), "$.id");

        // Then - the owner is told after commit
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                verify(notificationDispatcher).emit(argThat(event ->
                        event.getEventType() == EventType.APPLICATION_CREATED
                                && OWNER.equals(event.getRecipientId()))));

        // When - owner approves
        mockMvc.perform(as(post("/api/v1/announcements/{aid}/applications/{id}/approve", announcementId, applicationId), OWNER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"));

        // Then - 60 left
        Announcement afterApproval = announcementRepository.findById(announcementId).orElseThrow();
        assertThat(afterApproval.getAvailableQuantity()).isEqualByComparingTo("60");
        assertThat(applicationRepository.findById(applicationId).orElseThrow().getStatus())
                .isEqualTo(ApplicationStatus.APPROVED);

        // When / Then - 70 no longer fits
        mockMvc.perform(as(post("/api/v1/announcements/{id}/applications", announcementId), SECOND_APPLICANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(applicationBody(70)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Quantity Exceeded"));

        // When / Then - approved applications are frozen
        mockMvc.perform(as(put("/api/v1/applications/{id}", applicationId), APPLICANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"count\": 30}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value(containsString("cannot be edited")));

        assertThat(announcementRepository.findById(announcementId).orElseThrow().getAvailableQuantity())
                .isEqualByComparingTo("60");
    }

    @Test
    @DisplayName("Goods - Owner cannot apply to own announcement")
    void ownerCannotApply() throws Exception {
        // Given
        String announcementId = createGoods(100);

        // When / Then
        mockMvc.perform(as(post("/api/v1/announcements/{id}/applications", announcementId), OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(applicationBody(10)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("You cannot apply to your own announcement"));

        assertThat(applicationRepository.count()).isZero();
    }

    // ========================================
    // Rent Lifecycle
    // ========================================

    @Test
    @DisplayName("Rent - Period ending before it starts is rejected")
    void rent_InvertedPeriod_Returns400() throws Exception {
        // Given
        String body = String.format("""
                {
                    "type": "SELL",
                    "category": "RENT",
                    "groupId": "group-grain",
                    "itemId": "item-wheat",
                    "price": 20000.00,
                    "dateFrom": "%s",
                    "dateTo": "%s"
                }
                """, today.plusDays(5), today.plusDays(1));

        // When / Then
        mockMvc.perform(as(post("/api/v1/announcements"), OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("dateFrom must be before dateTo"));

        assertThat(announcementRepository.count()).isZero();
    }

    @Test
    @DisplayName("Rent - Expired announcement is closed once by the sweep")
    void rent_ExpirySweep_ClosesOnce() throws Exception {
        // Given - rent goes to verification, admin publishes
        String body = String.format("""
                {
                    "type": "SELL",
                    "category": "RENT",
                    "groupId": "group-grain",
                    "itemId": "item-wheat",
                    "price": 20000.00,
                    "dateFrom": "%s",
                    "dateTo": "%s"
                }
                """, today.plusDays(1), today.plusDays(5));
        MvcResult created = mockMvc.perform(as(post("/api/v1/announcements"), OWNER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.announcement.status").value("PENDING"))
                .andReturn();
        String announcementId = JsonPath.read(created.getResponse().getContentAsString(), "$.announcement.id");

        mockMvc.perform(asAdmin(post("/api/v1/announcements/{id}/publish", announcementId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PUBLISHED"));

        // The rental period passes
        LocalDate yesterday = today.minusDays(1);
        transactionTemplate.executeWithoutResult(tx -> {
            Announcement announcement = announcementRepository.findById(announcementId).orElseThrow();
            announcement.setDateFrom(yesterday.minusDays(4));
            announcement.setDateTo(yesterday);
            announcement.setExpiryDate(yesterday);
        });

        // When / Then - first sweep closes it
        mockMvc.perform(asAdmin(post("/api/v1/admin/announcements/expiry-sweep")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.executed").value(true))
                .andExpect(jsonPath("$.found").value(1))
                .andExpect(jsonPath("$.closed").value(1));

        assertThat(announcementRepository.findById(announcementId).orElseThrow().getStatus())
                .isEqualTo(AnnouncementStatus.CLOSED);

        // When / Then - second sweep finds nothing
        mockMvc.perform(asAdmin(post("/api/v1/admin/announcements/expiry-sweep")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.found").value(0))
                .andExpect(jsonPath("$.closed").value(0));
    }

    // ========================================
    // Access Control
    // ========================================

    @Test
    @DisplayName("Anonymous create returns 401, anonymous listing is allowed")
    void anonymousAccess() throws Exception {
        // Given
        createGoods(50);

        // When / Then
        mockMvc.perform(post("/api/v1/announcements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/api/v1/announcements").param("category", "goods"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.total").value(1));
    }

    @Test
    @DisplayName("Non-admin cannot trigger the expiry sweep")
    void sweep_NonAdmin_Returns403() throws Exception {
        // When / Then
        mockMvc.perform(as(post("/api/v1/admin/announcements/expiry-sweep"), OWNER))
                .andExpect(status().isForbidden());
    }

    // ========================================
    // Favorites
    // ========================================

    @Test
    @DisplayName("Favorites - Add once, list while published, hidden after close")
    void favorites_ListedWhilePublished() throws Exception {
        // Given
        String announcementId = createGoods(100);
        String body = String.format("{\"announcementId\": \"%s\"}", announcementId);

        // When / Then - add, then add again
        mockMvc.perform(as(post("/api/v1/favorites"), APPLICANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.announcementId").value(announcementId));
        mockMvc.perform(as(post("/api/v1/favorites"), APPLICANT)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isConflict());

        mockMvc.perform(as(get("/api/v1/favorites"), APPLICANT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(1)))
                .andExpect(jsonPath("$.items[0].id").value(announcementId));
        mockMvc.perform(as(get("/api/v1/favorites/{id}", announcementId), APPLICANT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.favorited").value(true))
                .andExpect(jsonPath("$.favoriteCount").value(1));

        // When - owner closes the announcement
        mockMvc.perform(as(post("/api/v1/announcements/{id}/close", announcementId), OWNER))
                .andExpect(status().isOk());

        // Then - the favorite stays but is no longer listed
        mockMvc.perform(as(get("/api/v1/favorites"), APPLICANT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items", hasSize(0)));
        assertThat(favoriteRepository.existsByAnnouncementIdAndUserId(announcementId, APPLICANT)).isTrue();

        mockMvc.perform(as(delete("/api/v1/favorites/{id}", announcementId), APPLICANT))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/v1/favorites"))
                .andExpect(status().isUnauthorized());
    }
}
