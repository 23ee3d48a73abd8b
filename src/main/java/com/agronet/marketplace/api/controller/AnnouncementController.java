package com.agronet.marketplace.api.controller;

import com.agronet.marketplace.api.dto.AnnouncementResponse;
import com.agronet.marketplace.api.dto.CreateAnnouncementRequest;
import com.agronet.marketplace.api.dto.CreateAnnouncementResponse;
import com.agronet.marketplace.api.dto.PageResponse;
import com.agronet.marketplace.api.dto.UpdateAnnouncementRequest;
import com.agronet.marketplace.domain.model.Announcement;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementCategory;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementStatus;
import com.agronet.marketplace.domain.model.Announcement.AnnouncementType;
import com.agronet.marketplace.exception.ValidationException;
import com.agronet.marketplace.integration.ImageStore;
import com.agronet.marketplace.security.CurrentUser;
import com.agronet.marketplace.security.SecurityUtils;
import com.agronet.marketplace.service.AnnouncementFilter;
import com.agronet.marketplace.service.AnnouncementQueryService;
import com.agronet.marketplace.service.AnnouncementService;
import com.agronet.marketplace.service.ImageUpload;
import com.agronet.marketplace.service.ViewResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * REST controller for announcements: creation, editing, status transitions and listings.
 *
 * @author Agronet Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/announcements")
public class AnnouncementController {

    private static final Logger logger = LoggerFactory.getLogger(AnnouncementController.class);

    private final AnnouncementService announcementService;
    private final AnnouncementQueryService queryService;
    private final ImageStore imageStore;

    public AnnouncementController(
            AnnouncementService announcementService,
            AnnouncementQueryService queryService,
            ImageStore imageStore
    ) {
        this.announcementService = announcementService;
        this.queryService = queryService;
        this.imageStore = imageStore;
    }

    /**
     * Create an announcement from a JSON body.
     *
     * @param request Announcement fields
     * @return Created announcement and whether it was published right away
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CreateAnnouncementResponse> createAnnouncement(
            @Valid @RequestBody CreateAnnouncementRequest request
    ) {
        return create(request, Collections.emptyList());
    }

    /**
     * Create an announcement with image files. The JSON fields travel in the "announcement" part.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CreateAnnouncementResponse> createAnnouncementWithImages(
            @Valid @RequestPart("announcement") CreateAnnouncementRequest request,
            @RequestPart(value = "files", required = false) List<MultipartFile> files
    ) throws IOException {
        return create(request, toUploads(files));
    }

    @PutMapping(value = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AnnouncementResponse> updateAnnouncement(
            @PathVariable String id,
            @Valid @RequestBody UpdateAnnouncementRequest request
    ) {
        Announcement updated = announcementService.update(
                SecurityUtils.requireCurrentUser(), id, request, Collections.emptyList());
        return ResponseEntity.ok(toResponse(updated));
    }

    /**
     * Update with image files. Uploaded files are appended to the "images" list of the
     * "announcement" part, or replace the stored images when that list is absent.
     */
    @PutMapping(value = "/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AnnouncementResponse> updateAnnouncementWithImages(
            @PathVariable String id,
            @Valid @RequestPart("announcement") UpdateAnnouncementRequest request,
            @RequestPart(value = "files", required = false) List<MultipartFile> files
    ) throws IOException {
        Announcement updated = announcementService.update(
                SecurityUtils.requireCurrentUser(), id, request, toUploads(files));
        return ResponseEntity.ok(toResponse(updated));
    }

    @PostMapping("/{id}/publish")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<AnnouncementResponse> publish(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(announcementService.publish(SecurityUtils.requireCurrentUser(), id)));
    }

    @PostMapping("/{id}/block")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<AnnouncementResponse> block(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(announcementService.block(SecurityUtils.requireCurrentUser(), id)));
    }

    @PostMapping("/{id}/close")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AnnouncementResponse> close(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(announcementService.close(SecurityUtils.requireCurrentUser(), id)));
    }

    @PostMapping("/{id}/cancel")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AnnouncementResponse> cancel(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(announcementService.cancel(SecurityUtils.requireCurrentUser(), id)));
    }

    /**
     * Soft delete. Published announcements have to be canceled first.
     */
    @DeleteMapping("/{id}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        announcementService.delete(SecurityUtils.requireCurrentUser(), id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/views")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ViewResult> recordView(@PathVariable String id) {
        return ResponseEntity.ok(announcementService.recordView(SecurityUtils.requireCurrentUser(), id));
    }

    /**
     * Public listing, PUBLISHED by default. The caller's own announcements are left out.
     */
    @GetMapping
    public ResponseEntity<PageResponse<AnnouncementResponse>> list(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) List<String> category,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) List<String> groupId,
            @RequestParam(required = false) List<String> itemId,
            @RequestParam(required = false) List<String> regions,
            @RequestParam(required = false) List<String> villages,
            @RequestParam(required = false) BigDecimal priceFrom,
            @RequestParam(required = false) BigDecimal priceTo,
            @RequestParam(required = false) String createdFrom,
            @RequestParam(required = false) String createdTo,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        AnnouncementFilter filter = filter(status, category, type, groupId, itemId, regions, villages,
                priceFrom, priceTo, createdFrom, createdTo);
        Page<Announcement> result = queryService.list(SecurityUtils.currentUserOrNull(), filter, page, limit);
        return ResponseEntity.ok(PageResponse.of(result, this::toResponse));
    }

    @GetMapping("/search")
    public ResponseEntity<PageResponse<AnnouncementResponse>> search(
            @RequestParam("q") String query,
            @RequestParam(required = false) List<String> category,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) List<String> regions,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        AnnouncementFilter filter = filter(null, category, type, null, null, regions, null,
                null, null, null, null);
        Page<Announcement> result = queryService.search(SecurityUtils.currentUserOrNull(), query, filter, page, limit);
        return ResponseEntity.ok(PageResponse.of(result, this::toResponse));
    }

    @GetMapping("/mine")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PageResponse<AnnouncementResponse>> listMine(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) List<String> category,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String createdFrom,
            @RequestParam(required = false) String createdTo,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        AnnouncementFilter filter = filter(status, category, type, null, null, null, null,
                null, null, createdFrom, createdTo);
        Page<Announcement> result = queryService.listMine(SecurityUtils.requireCurrentUser(), filter, page, limit);
        return ResponseEntity.ok(PageResponse.of(result, this::toResponse));
    }

    @GetMapping("/applied")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PageResponse<AnnouncementResponse>> listApplied(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) List<String> category,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        AnnouncementFilter filter = filter(status, category, null, null, null, null, null,
                null, null, null, null);
        Page<Announcement> result = queryService.listApplied(SecurityUtils.requireCurrentUser(), filter, page, limit);
        return ResponseEntity.ok(PageResponse.of(result, this::toResponse));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AnnouncementResponse> get(@PathVariable String id) {
        return ResponseEntity.ok(toResponse(queryService.get(SecurityUtils.currentUserOrNull(), id)));
    }

    private ResponseEntity<CreateAnnouncementResponse> create(CreateAnnouncementRequest request, List<ImageUpload> uploads) {
        CurrentUser actor = SecurityUtils.requireCurrentUser();
        logger.info("Creating announcement - user: {}, category: {}, item: {}, files: {}",
                actor.getId(), request.getCategory(), request.getItemId(), uploads.size());

        Announcement created = announcementService.create(actor, request, uploads);
        String message = created.getStatus() == AnnouncementStatus.PUBLISHED
                ? "Announcement created and published"
                : "Announcement created and sent for verification";
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreateAnnouncementResponse(message, toResponse(created)));
    }

    private AnnouncementResponse toResponse(Announcement announcement) {
        return AnnouncementResponse.fromEntity(announcement, imageStore::resolve);
    }

    private static List<ImageUpload> toUploads(List<MultipartFile> files) throws IOException {
        if (files == null || files.isEmpty()) {
            return Collections.emptyList();
        }
        List<ImageUpload> uploads = new ArrayList<>();
        for (MultipartFile file : files) {
            if (file.isEmpty()) {
                continue;
            }
            uploads.add(new ImageUpload(file.getOriginalFilename(), file.getContentType(), file.getBytes()));
        }
        return uploads;
    }

    private static AnnouncementFilter filter(
            String status,
            List<String> categories,
            String type,
            List<String> groupIds,
            List<String> itemIds,
            List<String> regions,
            List<String> villages,
            BigDecimal priceFrom,
            BigDecimal priceTo,
            String createdFrom,
            String createdTo
    ) {
        return AnnouncementFilter.builder()
                .status(status == null ? null : parseEnum(AnnouncementStatus.class, "status", status))
                .categories(categories == null ? null : categories.stream()
                        .map(value -> parseEnum(AnnouncementCategory.class, "category", value))
                        .collect(Collectors.toList()))
                .type(type == null ? null : parseEnum(AnnouncementType.class, "type", type))
                .groupIds(groupIds)
                .itemIds(itemIds)
                .regions(regions)
                .villages(villages)
                .priceFrom(priceFrom)
                .priceTo(priceTo)
                .createdFrom(createdFrom)
                .createdTo(createdTo)
                .build();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String field, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field, String.format("Invalid %s '%s'", field, value));
        }
    }
}
