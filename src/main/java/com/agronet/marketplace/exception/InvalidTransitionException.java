package com.agronet.marketplace.exception;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when a status change is not in the lifecycle transition table.
 * Carries the current status and the statuses that would have been legal.
 *
 * @author Agronet Marketplace Team
 */
public class InvalidTransitionException extends RuntimeException {

    private final String resourceType;
    private final String currentStatus;
    private final String targetStatus;
    private final List<String> allowedStatuses;

    public InvalidTransitionException(
            String resourceType,
            Enum<?> currentStatus,
            Enum<?> targetStatus,
            Collection<? extends Enum<?>> allowedStatuses
    ) {
        this(resourceType, currentStatus, targetStatus, allowedStatuses, null);
    }

    public InvalidTransitionException(
            String resourceType,
            Enum<?> currentStatus,
            Enum<?> targetStatus,
            Collection<? extends Enum<?>> allowedStatuses,
            String reason
    ) {
        super(buildMessage(resourceType, currentStatus, targetStatus, allowedStatuses, reason));
        this.resourceType = resourceType;
        this.currentStatus = currentStatus.name();
        this.targetStatus = targetStatus.name();
        this.allowedStatuses = allowedStatuses.stream().map(Enum::name).collect(Collectors.toList());
    }

    /**
     * An operation other than a status change that is only allowed in certain statuses,
     * for example editing an application.
     *
     * @param operation Past participle of the operation, e.g. "edited"
     * @param allowedStatuses Statuses in which the operation is allowed
     */
    public InvalidTransitionException(
            String resourceType,
            Enum<?> currentStatus,
            String operation,
            Collection<? extends Enum<?>> allowedStatuses
    ) {
        super(String.format("%s in status %s cannot be %s. Allowed only in: %s",
                resourceType, currentStatus.name(), operation,
                allowedStatuses.stream().map(Enum::name).collect(Collectors.joining(", "))));
        this.resourceType = resourceType;
        this.currentStatus = currentStatus.name();
        this.targetStatus = null;
        this.allowedStatuses = allowedStatuses.stream().map(Enum::name).collect(Collectors.toList());
    }

    private static String buildMessage(
            String resourceType,
            Enum<?> current,
            Enum<?> target,
            Collection<? extends Enum<?>> allowed,
            String reason
    ) {
        String allowedText = allowed.isEmpty()
                ? "none (" + current.name() + " is terminal)"
                : allowed.stream().map(Enum::name).collect(Collectors.joining(", "));
        String message = String.format("%s cannot transition from %s to %s. Allowed transitions: %s",
                resourceType, current.name(), target.name(), allowedText);
        return reason == null ? message : message + ". " + reason;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }

    /**
     * @return target status, or null when the exception is about an operation rather than a transition
     */
    public String getTargetStatus() {
        return targetStatus;
    }

    public List<String> getAllowedStatuses() {
        return allowedStatuses;
    }
}
