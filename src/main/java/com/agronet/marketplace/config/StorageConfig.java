package com.agronet.marketplace.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * S3 client for announcement images.
 *
 * @author Agronet Marketplace Team
 */
@Configuration
@ConditionalOnProperty(name = "marketplace.images.provider", havingValue = "s3", matchIfMissing = true)
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(MarketplaceProperties properties) {
        MarketplaceProperties.Images images = properties.getImages();

        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(images.getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create());

        // S3-compatible storage (MinIO, LocalStack) needs path-style access
        if (images.getEndpoint() != null && !images.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(images.getEndpoint()))
                    .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
        }

        return builder.build();
    }
}
