package com.agronet.marketplace.api.controller;

import com.agronet.marketplace.api.dto.ApplicationResponse;
import com.agronet.marketplace.api.dto.CreateApplicationRequest;
import com.agronet.marketplace.api.dto.PageResponse;
import com.agronet.marketplace.api.dto.UpdateApplicationRequest;
import com.agronet.marketplace.domain.model.Application;
import com.agronet.marketplace.security.CurrentUser;
import com.agronet.marketplace.security.SecurityUtils;
import com.agronet.marketplace.service.ApplicationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for applications.
 * Owner decisions are addressed through the announcement, applicant self-service directly.
 *
 * @author Agronet Marketplace Team
 */
@RestController
@RequestMapping("/api/v1")
@PreAuthorize("isAuthenticated()")
public class ApplicationController {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationController.class);

    private final ApplicationService applicationService;

    public ApplicationController(ApplicationService applicationService) {
        this.applicationService = applicationService;
    }

    /**
     * Apply to a published announcement.
     *
     * @param announcementId Announcement ID
     * @param request Count (goods only), delivery dates, notes
     * @return Created application
     */
    @PostMapping("/announcements/{announcementId}/applications")
    public ResponseEntity<ApplicationResponse> createApplication(
            @PathVariable String announcementId,
            @Valid @RequestBody CreateApplicationRequest request
    ) {
        CurrentUser actor = SecurityUtils.requireCurrentUser();
        logger.info("Creating application - user: {}, announcement: {}, count: {}",
                actor.getId(), announcementId, request.getCount());

        Application created = applicationService.create(actor, announcementId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApplicationResponse.fromEntity(created));
    }

    @GetMapping("/announcements/{announcementId}/applications")
    public ResponseEntity<PageResponse<ApplicationResponse>> listForAnnouncement(
            @PathVariable String announcementId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(PageResponse.of(
                applicationService.listForAnnouncement(SecurityUtils.requireCurrentUser(), announcementId, page, limit),
                ApplicationResponse::fromEntity));
    }

    @PostMapping("/announcements/{announcementId}/applications/{applicationId}/approve")
    public ResponseEntity<ApplicationResponse> approve(
            @PathVariable String announcementId,
            @PathVariable String applicationId
    ) {
        Application approved = applicationService.approve(
                SecurityUtils.requireCurrentUser(), announcementId, applicationId);
        return ResponseEntity.ok(ApplicationResponse.fromEntity(approved));
    }

    @PostMapping("/announcements/{announcementId}/applications/{applicationId}/reject")
    public ResponseEntity<ApplicationResponse> reject(
            @PathVariable String announcementId,
            @PathVariable String applicationId
    ) {
        Application rejected = applicationService.reject(
                SecurityUtils.requireCurrentUser(), announcementId, applicationId);
        return ResponseEntity.ok(ApplicationResponse.fromEntity(rejected));
    }

    @PostMapping("/announcements/{announcementId}/applications/{applicationId}/close")
    public ResponseEntity<ApplicationResponse> closeByOwner(
            @PathVariable String announcementId,
            @PathVariable String applicationId
    ) {
        Application closed = applicationService.close(
                SecurityUtils.requireCurrentUser(), announcementId, applicationId);
        return ResponseEntity.ok(ApplicationResponse.fromEntity(closed));
    }

    /**
     * Applicant withdraws their own pending application.
     */
    @PostMapping("/applications/{applicationId}/close")
    public ResponseEntity<ApplicationResponse> close(@PathVariable String applicationId) {
        Application closed = applicationService.close(SecurityUtils.requireCurrentUser(), null, applicationId);
        return ResponseEntity.ok(ApplicationResponse.fromEntity(closed));
    }

    @PostMapping("/applications/{applicationId}/reopen")
    public ResponseEntity<ApplicationResponse> reopen(@PathVariable String applicationId) {
        Application reopened = applicationService.reopen(SecurityUtils.requireCurrentUser(), applicationId);
        return ResponseEntity.ok(ApplicationResponse.fromEntity(reopened));
    }

    @PutMapping("/applications/{applicationId}")
    public ResponseEntity<ApplicationResponse> edit(
            @PathVariable String applicationId,
            @Valid @RequestBody UpdateApplicationRequest request
    ) {
        Application edited = applicationService.edit(SecurityUtils.requireCurrentUser(), applicationId, request);
        return ResponseEntity.ok(ApplicationResponse.fromEntity(edited));
    }

    @GetMapping("/applications/mine")
    public ResponseEntity<PageResponse<ApplicationResponse>> listMine(
            @RequestParam(required = false) String announcementId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(PageResponse.of(
                applicationService.listMine(SecurityUtils.requireCurrentUser(), announcementId, page, limit),
                ApplicationResponse::fromEntity));
    }

    @GetMapping("/applications/{applicationId}")
    public ResponseEntity<ApplicationResponse> get(@PathVariable String applicationId) {
        return ResponseEntity.ok(ApplicationResponse.fromEntity(
                applicationService.get(SecurityUtils.requireCurrentUser(), applicationId)));
    }
}
