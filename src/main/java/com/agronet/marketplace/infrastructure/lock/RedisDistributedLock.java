package com.agronet.marketplace.infrastructure.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

/**
 * Redis-based distributed lock using the SET NX EX pattern.
 * Keeps the expiry sweep to one instance at a time.
 *
 * Lock Pattern:
 * - SET with NX (only if absent) and EX (expiry), so a crashed holder cannot block forever
 * - Each acquisition gets a unique token; only the holder of that token can release the lock
 *
 * Usage:
 * String token = redisLock.acquireLock("lock:expiry-sweep", Duration.ofMinutes(10));
 * if (token != null) {
 *     try {
 *         // sweep
 *     } finally {
 *         redisLock.releaseLock("lock:expiry-sweep", token);
 *     }
 * }
 *
 * @author Agronet Marketplace Team
 */
@Service
@ConditionalOnProperty(name = "spring.data.redis.enabled", havingValue = "true", matchIfMissing = true)
public class RedisDistributedLock {

    private static final Logger logger = LoggerFactory.getLogger(RedisDistributedLock.class);

    // Compare-and-delete in one round trip
    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate stringRedisTemplate;

    public RedisDistributedLock(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    /**
     * Attempt to acquire the lock.
     *
     * @param lockKey Lock key, e.g. "lock:expiry-sweep"
     * @param expiry Auto-release after this duration
     * @return Lock token if acquired, null if held elsewhere or Redis is unreachable
     */
    public String acquireLock(String lockKey, Duration expiry) {
        try {
            String lockToken = UUID.randomUUID().toString();
            Boolean acquired = stringRedisTemplate.opsForValue().setIfAbsent(lockKey, lockToken, expiry);

            if (Boolean.TRUE.equals(acquired)) {
                logger.debug("Acquired lock: {} with token: {}", lockKey, lockToken);
                return lockToken;
            }
            logger.debug("Lock already held: {}", lockKey);
            return null;
        } catch (Exception e) {
            logger.error("Error acquiring lock for key: {}", lockKey, e);
            return null;
        }
    }

    /**
     * Release the lock if the token still matches.
     *
     * @return true if released
     */
    public boolean releaseLock(String lockKey, String lockToken) {
        if (lockToken == null) {
            return false;
        }
        try {
            Long deleted = stringRedisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(lockKey), lockToken);
            if (deleted != null && deleted > 0) {
                logger.debug("Released lock: {}", lockKey);
                return true;
            }
            logger.warn("Lock {} was not released: expired or held by another token", lockKey);
            return false;
        } catch (Exception e) {
            logger.error("Error releasing lock for key: {}", lockKey, e);
            return false;
        }
    }
}
