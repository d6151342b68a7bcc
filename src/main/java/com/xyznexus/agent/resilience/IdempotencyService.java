package com.xyznexus.agent.resilience;

import com.xyznexus.agent.config.NexusProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed response cache for POST /query retries.
 *
 * A client that retries after a network timeout sends the same Idempotency-Key;
 * the cached response is returned instead of running every specialist again.
 *
 * Key pattern: nexus:idempotency:{idempotencyKey}
 *
 * Opt-in: requests without a key always run fresh.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String KEY_PREFIX = "nexus:idempotency:";
    // stored while the first request is still running
    static final String IN_FLIGHT_SENTINEL = "__IN_FLIGHT__";

    private final StringRedisTemplate redisTemplate;
    private final Duration ttl;

    public IdempotencyService(StringRedisTemplate redisTemplate, NexusProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getIdempotency().getTtl();
    }

    /**
     * Returns the cached response JSON for a completed request with this key,
     * or empty when the key is new or its request is still in flight.
     */
    public Optional<String> getCachedResponse(String idempotencyKey) {
        String existing = redisTemplate.opsForValue().get(buildKey(idempotencyKey));

        if (existing == null) {
            return Optional.empty();
        }

        if (IN_FLIGHT_SENTINEL.equals(existing)) {
            log.warn("Idempotency key {} is in-flight", idempotencyKey);
            return Optional.empty();
        }

        log.info("Idempotency hit for key={}", idempotencyKey);
        return Optional.of(existing);
    }

    /**
     * Marks the key as in flight with SET NX.
     * Returns false when another request already claimed it.
     */
    public boolean claimKey(String idempotencyKey) {
        Boolean claimed = redisTemplate.opsForValue()
                .setIfAbsent(buildKey(idempotencyKey), IN_FLIGHT_SENTINEL, ttl);
        return Boolean.TRUE.equals(claimed);
    }

    public void storeResponse(String idempotencyKey, String responseJson) {
        redisTemplate.opsForValue().set(buildKey(idempotencyKey), responseJson, ttl);
        log.debug("Stored idempotency response for key={}", idempotencyKey);
    }

    /** Frees the key after a failed request so the client can retry. */
    public void releaseKey(String idempotencyKey) {
        redisTemplate.delete(buildKey(idempotencyKey));
        log.debug("Released idempotency key={}", idempotencyKey);
    }

    private String buildKey(String idempotencyKey) {
        return KEY_PREFIX + idempotencyKey;
    }
}
