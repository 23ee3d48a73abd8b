package com.agronet.marketplace.integration;

import com.agronet.marketplace.config.MarketplaceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.Locale;
import java.util.UUID;

/**
 * S3 implementation of {@link ImageStore}. Keys are namespaced per owner:
 * {@code announcements/{ownerId}/{uuid}.{ext}}.
 *
 * @author Agronet Marketplace Team
 */
@Component
@ConditionalOnProperty(name = "marketplace.images.provider", havingValue = "s3", matchIfMissing = true)
public class S3ImageStore implements ImageStore {

    private static final Logger logger = LoggerFactory.getLogger(S3ImageStore.class);

    private final S3Client s3Client;
    private final String bucketName;
    private final String publicBaseUrl;

    public S3ImageStore(S3Client s3Client, MarketplaceProperties properties) {
        this.s3Client = s3Client;
        this.bucketName = properties.getImages().getBucketName();
        this.publicBaseUrl = stripTrailingSlash(properties.getImages().getPublicBaseUrl());
    }

    @Override
    public String upload(String ownerId, String fileName, byte[] content, String contentType) {
        String key = String.format("announcements/%s/%s%s", ownerId, UUID.randomUUID(), extensionOf(fileName));
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType(contentType)
                .build();
        s3Client.putObject(request, RequestBody.fromBytes(content));
        logger.debug("Uploaded image {} ({} bytes) for owner {}", key, content.length, ownerId);
        return key;
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucketName).key(key).build());
            logger.debug("Deleted image {}", key);
        } catch (Exception e) {
            logger.warn("Best-effort image deletion failed for key={}: {}", key, e.getMessage());
        }
    }

    @Override
    public String resolve(String key) {
        if (key == null || key.startsWith("http://") || key.startsWith("https://")) {
            return key;
        }
        return publicBaseUrl + "/" + key;
    }

    private static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
