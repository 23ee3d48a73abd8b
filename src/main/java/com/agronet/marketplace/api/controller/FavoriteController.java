package com.agronet.marketplace.api.controller;

import com.agronet.marketplace.api.dto.AddFavoriteRequest;
import com.agronet.marketplace.api.dto.AnnouncementResponse;
import com.agronet.marketplace.api.dto.FavoriteResponse;
import com.agronet.marketplace.api.dto.PageResponse;
import com.agronet.marketplace.integration.ImageStore;
import com.agronet.marketplace.security.SecurityUtils;
import com.agronet.marketplace.service.FavoriteService;
import com.agronet.marketplace.service.FavoriteStatus;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * The caller's favorite announcements.
 *
 * @author Agronet Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/favorites")
@PreAuthorize("isAuthenticated()")
public class FavoriteController {

    private final FavoriteService favoriteService;
    private final ImageStore imageStore;

    public FavoriteController(FavoriteService favoriteService, ImageStore imageStore) {
        this.favoriteService = favoriteService;
        this.imageStore = imageStore;
    }

    @PostMapping
    public ResponseEntity<FavoriteResponse> add(@Valid @RequestBody AddFavoriteRequest request) {
        FavoriteResponse response = FavoriteResponse.fromEntity(
                favoriteService.add(SecurityUtils.requireCurrentUser(), request.getAnnouncementId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * Published favorites only, most recently favorited first.
     */
    @GetMapping
    public ResponseEntity<PageResponse<AnnouncementResponse>> list(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit
    ) {
        return ResponseEntity.ok(PageResponse.of(
                favoriteService.list(SecurityUtils.requireCurrentUser(), page, limit),
                announcement -> AnnouncementResponse.fromEntity(announcement, imageStore::resolve)));
    }

    @GetMapping("/{announcementId}")
    public ResponseEntity<FavoriteStatus> status(@PathVariable String announcementId) {
        return ResponseEntity.ok(favoriteService.status(SecurityUtils.requireCurrentUser(), announcementId));
    }

    @DeleteMapping("/{announcementId}")
    public ResponseEntity<Void> remove(@PathVariable String announcementId) {
        favoriteService.remove(SecurityUtils.requireCurrentUser(), announcementId);
        return ResponseEntity.noContent().build();
    }
}
