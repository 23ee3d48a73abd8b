package com.agronet.marketplace.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Marketplace settings bound from the {@code marketplace.*} namespace.
 * Injected into the lifecycle services, the expiry scheduler and the notification pipeline.
 *
 * @author Agronet Marketplace Team
 */
@ConfigurationProperties(prefix = "marketplace")
public class MarketplaceProperties {

    /**
     * Zone that defines "today" for date rules and the expiry sweep.
     */
    private String timeZone = "Asia/Yerevan";

    private final Announcements announcements = new Announcements();
    private final Expiry expiry = new Expiry();
    private final Notifications notifications = new Notifications();
    private final Pagination pagination = new Pagination();
    private final Images images = new Images();

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public Announcements getAnnouncements() {
        return announcements;
    }

    public Expiry getExpiry() {
        return expiry;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public Images getImages() {
        return images;
    }

    public static class Announcements {

        /**
         * Days until an announcement without an end date expires.
         */
        private int defaultExpiryDays = 30;

        private int maxImages = 3;

        public int getDefaultExpiryDays() {
            return defaultExpiryDays;
        }

        public void setDefaultExpiryDays(int defaultExpiryDays) {
            this.defaultExpiryDays = defaultExpiryDays;
        }

        public int getMaxImages() {
            return maxImages;
        }

        public void setMaxImages(int maxImages) {
            this.maxImages = maxImages;
        }
    }

    public static class Expiry {

        private boolean enabled = true;

        private String cron = "0 0 0 * * *";

        /**
         * Guard sweeps with a Redis lock so only one instance sweeps at a time.
         */
        private boolean distributedLock = true;

        private Duration lockTtl = Duration.ofMinutes(10);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public boolean isDistributedLock() {
            return distributedLock;
        }

        public void setDistributedLock(boolean distributedLock) {
            this.distributedLock = distributedLock;
        }

        public Duration getLockTtl() {
            return lockTtl;
        }

        public void setLockTtl(Duration lockTtl) {
            this.lockTtl = lockTtl;
        }
    }

    public static class Notifications {

        private String topic = "marketplace-notifications";

        private int corePoolSize = 2;

        private int maxPoolSize = 8;

        private int queueCapacity = 1000;

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    public static class Pagination {

        private int defaultLimit = 20;

        private int maxLimit = 100;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }

    public static class Images {

        /**
         * Storage backend; only "s3" ships with the service.
         */
        private String provider = "s3";

        private String bucketName = "agronet-announcements";

        private String region = "eu-central-1";

        /**
         * Endpoint override for S3-compatible storage. Empty for AWS.
         */
        private String endpoint = "";

        private String publicBaseUrl = "";

        private long maxSizeBytes = 5L * 1024 * 1024;

        private List<String> allowedContentTypes = new ArrayList<>(List.of("image/jpeg", "image/png", "image/webp"));

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getBucketName() {
            return bucketName;
        }

        public void setBucketName(String bucketName) {
            this.bucketName = bucketName;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getPublicBaseUrl() {
            return publicBaseUrl;
        }

        public void setPublicBaseUrl(String publicBaseUrl) {
            this.publicBaseUrl = publicBaseUrl;
        }

        public long getMaxSizeBytes() {
            return maxSizeBytes;
        }

        public void setMaxSizeBytes(long maxSizeBytes) {
            this.maxSizeBytes = maxSizeBytes;
        }

        public List<String> getAllowedContentTypes() {
            return allowedContentTypes;
        }

        public void setAllowedContentTypes(List<String> allowedContentTypes) {
            this.allowedContentTypes = allowedContentTypes;
        }
    }
}
