package com.agronet.marketplace.service;

import lombok.Value;

/**
 * An uploaded image file, detached from the web layer.
 *
 * @author Agronet Marketplace Team
 */
@Value
public class ImageUpload {

    String fileName;
    String contentType;
    byte[] content;

    public long size() {
        return content == null ? 0 : content.length;
    }
}
