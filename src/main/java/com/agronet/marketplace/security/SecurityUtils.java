package com.agronet.marketplace.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Static helpers for reading the caller's identity from the security context.
 *
 * @author Agronet Marketplace Team
 */
public class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID from authentication context, or null if not authenticated
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            return null;
        }
        return authentication.getName();
    }

    /**
     * Check if the current user has a specific role.
     *
     * @param role Role to check (with or without ROLE_ prefix)
     * @return true if user has the role
     */
    public static boolean hasRole(String role) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return false;
        }

        String roleWithPrefix = role.startsWith("ROLE_") ? role : "ROLE_" + role;

        return authentication.getAuthorities().stream()
            .anyMatch(authority -> authority.getAuthority().equals(roleWithPrefix));
    }

    public static boolean isAdmin() {
        return hasRole("ADMIN");
    }

    /**
     * Resolve the caller for a lifecycle operation.
     *
     * @return Current user
     * @throws AccessDeniedException if the request is not authenticated
     */
    public static CurrentUser requireCurrentUser() {
        String userId = getCurrentUserId();
        if (userId == null) {
            throw new AccessDeniedException("User not authenticated");
        }
        return CurrentUser.of(userId, isAdmin());
    }

    /**
     * @return the caller, or null for anonymous requests
     */
    public static CurrentUser currentUserOrNull() {
        String userId = getCurrentUserId();
        return userId == null ? null : CurrentUser.of(userId, isAdmin());
    }
}
