package com.agronet.marketplace.service.notification;

import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Application;
import com.agronet.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.agronet.marketplace.integration.CatalogGate;
import com.agronet.marketplace.integration.RegionDirectory;
import com.agronet.marketplace.service.notification.NotificationEvent.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Single emission point for lifecycle notifications.
 *
 * Every method snapshots what it needs from the entities, then dispatches once the surrounding
 * transaction has committed, on the notification executor. Nothing is sent for a rolled-back
 * transition, and no dispatch failure ever reaches the caller: failures are logged and counted.
 *
 * @author Agronet Marketplace Team
 */
@Component
public class LifecycleNotifier {

    private static final Logger logger = LoggerFactory.getLogger(LifecycleNotifier.class);

    private static final int SUMMARY_DESCRIPTION_LENGTH = 50;

    static final String CLOSED_BY_USER = "USER";
    static final String CLOSED_BY_SYSTEM = "SYSTEM";

    private final NotificationDispatcher dispatcher;
    private final RegionDirectory regionDirectory;
    private final CatalogGate catalogGate;
    private final TaskExecutor notificationExecutor;
    private final MarketplaceMetricsService metricsService;

    public LifecycleNotifier(
            NotificationDispatcher dispatcher,
            RegionDirectory regionDirectory,
            CatalogGate catalogGate,
            @Qualifier("notificationExecutor") TaskExecutor notificationExecutor,
            MarketplaceMetricsService metricsService
    ) {
        this.dispatcher = dispatcher;
        this.regionDirectory = regionDirectory;
        this.catalogGate = catalogGate;
        this.notificationExecutor = notificationExecutor;
        this.metricsService = metricsService;
    }

    /**
     * Notify the owner and fan out to eligible users in the announcement's regions.
     */
    public void announcementPublished(Announcement announcement) {
        AnnouncementSnapshot snapshot = AnnouncementSnapshot.of(announcement);
        afterCommit("announcementPublished", () -> {
            String summary = summarize(snapshot);
            send(new NotificationEvent(
                    EventType.ANNOUNCEMENT_PUBLISHED,
                    snapshot.ownerId,
                    "Announcement Published",
                    String.format("Your announcement \"%s\" has been approved and published.", summary),
                    announcementData(snapshot)));
            fanOutToRegions(snapshot, summary);
        });
    }

    public void announcementBlocked(Announcement announcement) {
        AnnouncementSnapshot snapshot = AnnouncementSnapshot.of(announcement);
        afterCommit("announcementBlocked", () -> send(new NotificationEvent(
                EventType.ANNOUNCEMENT_BLOCKED,
                snapshot.ownerId,
                "Announcement Blocked",
                String.format("Your announcement \"%s\" has been blocked by an administrator.", summarize(snapshot)),
                announcementData(snapshot))));
    }

    public void announcementClosed(Announcement announcement) {
        AnnouncementSnapshot snapshot = AnnouncementSnapshot.of(announcement);
        afterCommit("announcementClosed", () -> send(new NotificationEvent(
                EventType.ANNOUNCEMENT_CLOSED,
                snapshot.ownerId,
                "Announcement Closed",
                String.format("Your announcement \"%s\" has been closed.", summarize(snapshot)),
                closedData(snapshot, CLOSED_BY_USER))));
    }

    /**
     * Notify the owner that the expiry sweep closed their announcement.
     * Sent as {@link EventType#ANNOUNCEMENT_CLOSED} with {@code closedBy=SYSTEM} in the payload.
     */
    public void announcementExpired(Announcement announcement) {
        AnnouncementSnapshot snapshot = AnnouncementSnapshot.of(announcement);
        afterCommit("announcementExpired", () -> {
            String title;
            String body;
            if (snapshot.category == Announcement.AnnouncementCategory.RENT) {
                title = "Rental Period Ended";
                body = String.format("Your rent announcement \"%s\" has been automatically closed as the rental period has ended.",
                        summarize(snapshot));
            } else {
                title = "Announcement Expired";
                body = String.format("Your announcement \"%s\" has been automatically closed as it has expired.",
                        summarize(snapshot));
            }
            send(new NotificationEvent(EventType.ANNOUNCEMENT_CLOSED, snapshot.ownerId, title, body,
                    closedData(snapshot, CLOSED_BY_SYSTEM)));
        });
    }

    /**
     * Notify the announcement owner about a new application.
     *
     * @param applicantName Display name of the applicant
     */
    public void applicationCreated(Application application, Announcement announcement, String applicantName) {
        AnnouncementSnapshot snapshot = AnnouncementSnapshot.of(announcement);
        String applicationId = application.getId();
        afterCommit("applicationCreated", () -> send(new NotificationEvent(
                EventType.APPLICATION_CREATED,
                snapshot.ownerId,
                "New Application",
                String.format("%s applied to your announcement \"%s\"", applicantName, itemName(snapshot)),
                applicationData(snapshot, applicationId))));
    }

    public void applicationApproved(Application application, Announcement announcement) {
        notifyApplicant(EventType.APPLICATION_APPROVED, "Application Approved", "approved", application, announcement);
    }

    public void applicationRejected(Application application, Announcement announcement) {
        notifyApplicant(EventType.APPLICATION_REJECTED, "Application Rejected", "rejected", application, announcement);
    }

    public void applicationClosed(Application application, Announcement announcement) {
        notifyApplicant(EventType.APPLICATION_CLOSED, "Application Closed", "closed", application, announcement);
    }

    private void notifyApplicant(
            EventType type,
            String title,
            String verb,
            Application application,
            Announcement announcement
    ) {
        AnnouncementSnapshot snapshot = AnnouncementSnapshot.of(announcement);
        String applicationId = application.getId();
        String applicantId = application.getApplicantId();
        afterCommit(type.name(), () -> send(new NotificationEvent(
                type,
                applicantId,
                title,
                String.format("Your application to \"%s\" has been %s.", itemName(snapshot), verb),
                applicationData(snapshot, applicationId))));
    }

    private void fanOutToRegions(AnnouncementSnapshot snapshot, String summary) {
        if (snapshot.regions.isEmpty()) {
            return;
        }

        List<String> candidates = regionDirectory.usersInRegions(snapshot.regions, true, true);
        Set<String> recipients = new LinkedHashSet<>(candidates);
        recipients.remove(snapshot.ownerId);

        int sent = 0;
        int failed = 0;
        for (String recipientId : recipients) {
            // One bad recipient must not stop the rest
            try {
                dispatcher.emit(new NotificationEvent(
                        EventType.ANNOUNCEMENT_PUBLISHED_IN_REGION,
                        recipientId,
                        "New Announcement in Your Region",
                        summary,
                        announcementData(snapshot)));
                sent++;
            } catch (Exception e) {
                failed++;
                logger.warn("Region notification for announcement {} to user {} failed: {}",
                        snapshot.id, recipientId, e.getMessage());
                metricsService.recordNotificationFailure(EventType.ANNOUNCEMENT_PUBLISHED_IN_REGION.name());
            }
        }

        logger.info("Region fan-out for announcement {}: {} sent, {} failed", snapshot.id, sent, failed);
    }

    private void send(NotificationEvent event) {
        try {
            dispatcher.emit(event);
        } catch (Exception e) {
            logger.warn("Failed to dispatch {} to user {}: {}",
                    event.getEventType(), event.getRecipientId(), e.getMessage());
            metricsService.recordNotificationFailure(event.getEventType().name());
        }
    }

    /**
     * Run the task once the current transaction commits, or right away when there is none.
     */
    private void afterCommit(String label, Runnable task) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    submit(label, task);
                }
            });
        } else {
            submit(label, task);
        }
    }

    private void submit(String label, Runnable task) {
        try {
            notificationExecutor.execute(() -> {
                try {
                    task.run();
                } catch (Exception e) {
                    logger.error("Notification task {} failed", label, e);
                    metricsService.recordError("NOTIFICATION_TASK_ERROR", label);
                }
            });
        } catch (Exception e) {
            logger.error("Could not schedule notification task {}", label, e);
            metricsService.recordError("NOTIFICATION_SCHEDULE_ERROR", label);
        }
    }

    private String itemName(AnnouncementSnapshot snapshot) {
        return catalogGate.itemName(snapshot.itemId).orElse("announcement");
    }

    /**
     * Short human-readable summary, e.g. "sell goods - Wheat - 100 kg - 5000.00 AMD - Fresh harvest...".
     */
    String summarize(AnnouncementSnapshot snapshot) {
        List<String> parts = new ArrayList<>();
        parts.add(snapshot.type.name().toLowerCase(Locale.ROOT) + " " + snapshot.category.name().toLowerCase(Locale.ROOT));
        catalogGate.itemName(snapshot.itemId).ifPresent(parts::add);

        if (snapshot.category == Announcement.AnnouncementCategory.GOODS && snapshot.count != null) {
            String unit = snapshot.unit == null ? "units" : snapshot.unit.name().toLowerCase(Locale.ROOT);
            parts.add(snapshot.count.stripTrailingZeros().toPlainString() + " " + unit);
        }

        parts.add(snapshot.price.toPlainString() + " AMD");

        if (snapshot.description != null && !snapshot.description.isBlank()) {
            String description = snapshot.description;
            parts.add(description.length() > SUMMARY_DESCRIPTION_LENGTH
                    ? description.substring(0, SUMMARY_DESCRIPTION_LENGTH) + "..."
                    : description);
        }
        return String.join(" - ", parts);
    }

    private static Map<String, String> announcementData(AnnouncementSnapshot snapshot) {
        return Map.of("announcementId", snapshot.id);
    }

    private static Map<String, String> closedData(AnnouncementSnapshot snapshot, String closedBy) {
        return Map.of("announcementId", snapshot.id, "closedBy", closedBy);
    }

    private static Map<String, String> applicationData(AnnouncementSnapshot snapshot, String applicationId) {
        return Map.of("announcementId", snapshot.id, "applicationId", applicationId);
    }

    /**
     * Immutable copy of the announcement fields notifications need, taken inside the transaction.
     */
    static final class AnnouncementSnapshot {
        final String id;
        final String ownerId;
        final String itemId;
        final Announcement.AnnouncementType type;
        final Announcement.AnnouncementCategory category;
        final BigDecimal count;
        final Announcement.Unit unit;
        final BigDecimal price;
        final String description;
        final Set<String> regions;

        private AnnouncementSnapshot(Announcement announcement) {
            this.id = announcement.getId();
            this.ownerId = announcement.getOwnerId();
            this.itemId = announcement.getItemId();
            this.type = announcement.getType();
            this.category = announcement.getCategory();
            this.count = announcement.getCount();
            this.unit = announcement.getUnit();
            this.price = announcement.getPrice() == null ? BigDecimal.ZERO : announcement.getPrice();
            this.description = announcement.getDescription();
            Collection<String> regions = announcement.getRegions();
            this.regions = regions == null ? Set.of() : Set.copyOf(regions);
        }

        static AnnouncementSnapshot of(Announcement announcement) {
            return new AnnouncementSnapshot(announcement);
        }
    }
}
