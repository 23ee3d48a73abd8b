package com.agronet.marketplace.api.controller;

import com.agronet.marketplace.infrastructure.scheduler.AnnouncementExpiryScheduler;
import com.agronet.marketplace.infrastructure.scheduler.SweepResult;
import com.agronet.marketplace.security.SecurityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative operations.
 *
 * @author Agronet Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/admin")
@PreAuthorize("hasRole('ADMIN')")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final AnnouncementExpiryScheduler expiryScheduler;

    public AdminController(AnnouncementExpiryScheduler expiryScheduler) {
        this.expiryScheduler = expiryScheduler;
    }

    /**
     * Run the expiry sweep now instead of waiting for the nightly run.
     *
     * @return Sweep outcome; executed=false if a sweep was already in progress
     */
    @PostMapping("/announcements/expiry-sweep")
    public ResponseEntity<SweepResult> runExpirySweep() {
        logger.info("Manual expiry sweep triggered by admin {}", SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(expiryScheduler.runExpirySweep());
    }
}
