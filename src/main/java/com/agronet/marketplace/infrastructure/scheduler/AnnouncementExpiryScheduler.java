package com.agronet.marketplace.infrastructure.scheduler;

import com.agronet.marketplace.config.MarketplaceProperties;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementCategory;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.infrastructure.lock.RedisDistributedLock;
import com.agronet.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.agronet.marketplace.repository.AnnouncementRepository;
import com.agronet.marketplace.service.AnnouncementService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Daily job that closes announcements past their end date.
 *
 * Selects PUBLISHED announcements where the rental period has ended (RENT, dateTo before today)
 * or the expiry date has passed, and closes each one through
 * {@link AnnouncementService#closeBySystem} in its own transaction. A failure on one announcement
 * is logged and counted and the sweep moves on.
 *
 * Overlap protection:
 * - In-process: an AtomicBoolean guard, so a manual trigger never overlaps the cron run
 * - Across instances: a Redis lock (can be switched off with marketplace.expiry.distributed-lock)
 *
 * Idempotent: closeBySystem re-checks eligibility under the row lock, so running twice on the
 * same day closes nothing the second time.
 *
 * @author Agronet Marketplace Team
 */
@Service
public class AnnouncementExpiryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AnnouncementExpiryScheduler.class);

    static final String LOCK_KEY = "lock:announcement-expiry-sweep";

    private final AnnouncementRepository announcementRepository;
    private final AnnouncementService announcementService;
    private final ObjectProvider<RedisDistributedLock> distributedLock;
    private final MarketplaceMetricsService metricsService;
    private final MarketplaceProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public AnnouncementExpiryScheduler(
            AnnouncementRepository announcementRepository,
            AnnouncementService announcementService,
            ObjectProvider<RedisDistributedLock> distributedLock,
            MarketplaceMetricsService metricsService,
            MarketplaceProperties properties,
            Clock clock
    ) {
        this.announcementRepository = announcementRepository;
        this.announcementService = announcementService;
        this.distributedLock = distributedLock;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Scheduled entry point. Runs at midnight in the marketplace time zone by default.
     */
    @Scheduled(cron = "${marketplace.expiry.cron:0 0 0 * * *}", zone = "${marketplace.time-zone:Asia/Yerevan}")
    public void scheduledSweep() {
        if (!properties.getExpiry().isEnabled()) {
            logger.debug("Announcement expiry sweep is disabled");
            return;
        }
        try {
            runExpirySweep();
        } catch (Exception e) {
            logger.error("Error in announcement expiry scheduler", e);
            metricsService.recordError("EXPIRY_SWEEP_ERROR", "scheduledSweep");
        }
    }

    /**
     * Run a sweep now. Used by the scheduled job and the admin trigger.
     *
     * @return Sweep outcome, {@link SweepResult#skipped()} if another sweep is in progress
     */
    public SweepResult runExpirySweep() {
        if (!running.compareAndSet(false, true)) {
            logger.info("Expiry sweep already running in this instance, skipping");
            return SweepResult.skipped();
        }

        RedisDistributedLock lock = properties.getExpiry().isDistributedLock() ? distributedLock.getIfAvailable() : null;
        String lockToken = null;
        try {
            if (lock != null) {
                lockToken = lock.acquireLock(LOCK_KEY, properties.getExpiry().getLockTtl());
                if (lockToken == null) {
                    logger.info("Expiry sweep lock held by another instance, skipping");
                    return SweepResult.skipped();
                }
            } else if (properties.getExpiry().isDistributedLock()) {
                logger.warn("Distributed lock requested but Redis is not configured, sweeping without it");
            }
            return sweep();
        } finally {
            if (lock != null && lockToken != null) {
                lock.releaseLock(LOCK_KEY, lockToken);
            }
            running.set(false);
        }
    }

    private SweepResult sweep() {
        long startTime = System.currentTimeMillis();
        LocalDate today = LocalDate.now(clock);

        List<String> expiredIds = announcementRepository.findExpiredIds(
                AnnouncementStatus.PUBLISHED, AnnouncementCategory.RENT, today);
        if (expiredIds.isEmpty()) {
            logger.debug("No expired announcements found for {}", today);
            return new SweepResult(true, 0, 0, 0, System.currentTimeMillis() - startTime);
        }

        logger.info("Found {} expired announcements to close for {}", expiredIds.size(), today);

        int closed = 0;
        int failed = 0;
        for (String id : expiredIds) {
            try {
                if (announcementService.closeBySystem(id, today)) {
                    closed++;
                }
            } catch (Exception e) {
                failed++;
                logger.error("Error closing expired announcement: {}", id, e);
                metricsService.recordError("EXPIRY_CLOSE_ERROR", "runExpirySweep");
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordSweep(closed, failed, duration);
        logger.info("Expiry sweep completed: {} found, {} closed, {} failed, duration: {}ms",
                expiredIds.size(), closed, failed, duration);
        return new SweepResult(true, expiredIds.size(), closed, failed, duration);
    }
}
