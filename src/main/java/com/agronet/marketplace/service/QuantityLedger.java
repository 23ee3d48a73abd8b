package com.agronet.marketplace.service;

import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Application.ApplicationStatus;
import com.agronet.marketplace.exception.QuantityExceededException;
import com.agronet.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.agronet.marketplace.repository.ApplicationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Quantity ledger for goods announcements.
 *
 * Available quantity is always derived from stored state: count minus the sum of APPROVED
 * application counts, clamped to [0, count]. Callers hold the announcement row lock
 * ({@code findByIdForUpdate}) so approvals against the same announcement are serialized.
 *
 * @author Agronet Marketplace Team
 */
@Component
public class QuantityLedger {

    private static final Logger logger = LoggerFactory.getLogger(QuantityLedger.class);

    private final ApplicationRepository applicationRepository;
    private final MarketplaceMetricsService metricsService;

    public QuantityLedger(ApplicationRepository applicationRepository, MarketplaceMetricsService metricsService) {
        this.applicationRepository = applicationRepository;
        this.metricsService = metricsService;
    }

    /**
     * Sum of counts of the announcement's APPROVED applications.
     */
    public BigDecimal approvedTotal(Announcement announcement) {
        if (announcement.getId() == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal total = applicationRepository.sumCountByAnnouncementIdAndStatus(
                announcement.getId(), ApplicationStatus.APPROVED);
        return total == null ? BigDecimal.ZERO : total;
    }

    /**
     * Recompute and store the available quantity. Non-goods announcements carry none.
     *
     * @param announcement Locked announcement
     * @return Available quantity, null for non-goods
     */
    public BigDecimal recompute(Announcement announcement) {
        if (!announcement.isGoods() || announcement.getCount() == null) {
            announcement.setAvailableQuantity(null);
            return null;
        }

        BigDecimal count = announcement.getCount();
        BigDecimal available = count.subtract(approvedTotal(announcement));
        if (available.signum() < 0) {
            logger.warn("Approved total exceeds count on announcement {}, clamping available to zero",
                    announcement.getId());
            available = BigDecimal.ZERO;
        } else if (available.compareTo(count) > 0) {
            available = count;
        }

        announcement.setAvailableQuantity(available);
        return available;
    }

    /**
     * Check a requested quantity against what is still available.
     *
     * @param announcement Locked goods announcement
     * @param requested Requested quantity
     * @param operation "apply", "edit" or "approve", used for metrics
     * @throws QuantityExceededException if requested exceeds available
     */
    public void assertAvailable(Announcement announcement, BigDecimal requested, String operation) {
        BigDecimal available = recompute(announcement);
        if (available == null) {
            return;
        }
        if (requested.compareTo(available) > 0) {
            metricsService.recordLedgerRejection(operation);
            logger.info("Ledger rejected {} of {} on announcement {}: only {} available",
                    operation, requested.toPlainString(), announcement.getId(), available.toPlainString());
            throw new QuantityExceededException(announcement.getId(), requested, available);
        }
    }
}
