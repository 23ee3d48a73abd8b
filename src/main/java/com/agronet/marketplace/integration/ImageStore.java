package com.agronet.marketplace.integration;

/**
 * Object storage for announcement images. Only storage keys are persisted on announcements.
 *
 * @author Agronet Marketplace Team
 */
public interface ImageStore {

    /**
     * Store an image.
     *
     * @param ownerId Uploading user, used to namespace the key
     * @param fileName Original file name
     * @param content Image bytes
     * @param contentType MIME type
     * @return Storage key
     */
    String upload(String ownerId, String fileName, byte[] content, String contentType);

    /**
     * Delete an image. Best-effort, never throws.
     */
    void delete(String key);

    /**
     * @return URL clients can fetch the image from
     */
    String resolve(String key);
}
