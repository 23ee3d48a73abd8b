package com.agronet.marketplace;

import com.agronet.marketplace.config.MarketplaceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the Agronet marketplace core.
 *
 * System Overview:
 * - Announcements: supply (sell) and demand (buy) listings for goods, rent and services
 * - Applications: offers to fulfil an announcement, decided by its owner
 * - Quantity ledger: goods announcements are never promised beyond their count
 * - Nightly expiry sweep closes announcements past their end date
 * - Lifecycle notifications published to Kafka and stored in each user's inbox
 *
 * Architecture:
 * - API Layer: REST controllers with validation, gateway header authentication
 * - Service Layer: announcement and application lifecycles, queries, notifier
 * - Data Access Layer: JPA repositories with pessimistic row locks and version columns
 * - Infrastructure Layer: Kafka messaging, Redis lock, S3 images, CloudWatch metrics
 *
 * @author Agronet Marketplace Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableKafka
@EnableScheduling
@EnableConfigurationProperties(MarketplaceProperties.class)
public class AgronetMarketplaceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgronetMarketplaceApplication.class, args);
    }
}
