package com.example.engage.service;

import com.example.engage.config.EngageProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.stereotype.Service;

/**
 * Last-seen marker per user, kept in Redis with a TTL so it survives restarts of this process
 * and lapses on its own for clients that vanish without a disconnect.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceService {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;
    private final EngageProperties engageProperties;

    public void markPresent(String userId) {
        try {
            Duration ttl = engageProperties.getRedis().getPresenceTtl();
            RBucket<String> bucket = bucket(userId);
            if (ttl != null && !ttl.isNegative() && !ttl.isZero()) {
                bucket.set(Instant.now().toString(), ttl.toMillis(), TimeUnit.MILLISECONDS);
            } else {
                bucket.set(Instant.now().toString());
            }
        } catch (RuntimeException ex) {
            log.warn("Unable to record presence for {}", userId, ex);
        }
    }

    public Optional<Instant> lastSeen(String userId) {
        String result = bucket(userId).get();
        if (result == null) {
            return Optional.empty();
        }
        return Optional.of(Instant.parse(result));
    }

    public void markAbsent(String userId) {
        try {
            bucket(userId).delete();
        } catch (RuntimeException ex) {
            log.warn("Unable to clear presence for {}", userId, ex);
        }
    }

    private RBucket<String> bucket(String userId) {
        return redissonClient.getBucket(keyFactory.presenceKey(userId), StringCodec.INSTANCE);
    }
}
