package com.agronet.marketplace.exception;

import java.math.BigDecimal;

/**
 * Exception thrown when a requested quantity exceeds what is still available on a goods announcement.
 *
 * @author Agronet Marketplace Team
 */
public class QuantityExceededException extends ConflictException {

    private final String announcementId;
    private final BigDecimal requestedQuantity;
    private final BigDecimal availableQuantity;

    public QuantityExceededException(String announcementId, BigDecimal requestedQuantity, BigDecimal availableQuantity) {
        super(String.format("Requested quantity %s exceeds available quantity %s for announcement %s",
                requestedQuantity.toPlainString(), availableQuantity.toPlainString(), announcementId));
        this.announcementId = announcementId;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }

    public String getAnnouncementId() {
        return announcementId;
    }

    public BigDecimal getRequestedQuantity() {
        return requestedQuantity;
    }

    public BigDecimal getAvailableQuantity() {
        return availableQuantity;
    }
}
