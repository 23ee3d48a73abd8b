package com.agronet.marketplace.service.notification;

/**
 * Delivers lifecycle notifications. Implementations may fail; callers never let a failure
 * affect the transition that produced the event.
 *
 * @author Agronet Marketplace Team
 */
public interface NotificationDispatcher {

    void emit(NotificationEvent event);
}
