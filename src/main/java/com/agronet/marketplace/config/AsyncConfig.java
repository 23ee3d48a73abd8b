package com.agronet.marketplace.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Executor and clock beans shared by the lifecycle services.
 *
 * @author Agronet Marketplace Team
 */
@Configuration
public class AsyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    /**
     * Bounded pool that runs notification dispatch after the triggering transaction commits.
     * Overflowing tasks are dropped and logged; notifications never back-pressure requests.
     *
     * @param properties Marketplace settings
     * @return ThreadPoolTaskExecutor
     */
    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor(MarketplaceProperties properties) {
        MarketplaceProperties.Notifications settings = properties.getNotifications();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("notify-");
        executor.setRejectedExecutionHandler((task, pool) ->
                logger.error("Notification executor saturated, dropping dispatch task (queue size: {})",
                        pool.getQueue().size()));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    /**
     * Clock in the marketplace time zone. Date rules and the expiry sweep read "today" from it.
     */
    @Bean
    public Clock clock(MarketplaceProperties properties) {
        return Clock.system(ZoneId.of(properties.getTimeZone()));
    }
}
