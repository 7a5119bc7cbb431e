package com.nova.domain.cache.model.entity;

import lombok.Data;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 缓存条目实体。
 */
@Data
public class CacheEntryEntity {

    private String key;
    private Object payload;
    private LocalDateTime fetchedAt;
    private LocalDateTime expiresAt;

    public void validate() {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalStateException("Cache key cannot be empty");
        }
        if (fetchedAt == null || expiresAt == null) {
            throw new IllegalStateException("Cache entry timestamps cannot be null");
        }
        if (!expiresAt.isAfter(fetchedAt)) {
            throw new IllegalStateException("Cache entry must expire after it was fetched: " + key);
        }
    }

    public boolean isExpired(LocalDateTime now) {
        return !now.isBefore(expiresAt);
    }

    public long remainingSeconds(LocalDateTime now) {
        return Math.max(0L, Duration.between(now, expiresAt).getSeconds());
    }

    public static CacheEntryEntity create(String key, Object payload, LocalDateTime fetchedAt, Duration ttl) {
        CacheEntryEntity entity = new CacheEntryEntity();
        entity.setKey(key);
        entity.setPayload(payload);
        entity.setFetchedAt(fetchedAt);
        entity.setExpiresAt(fetchedAt.plus(ttl));
        entity.validate();
        return entity;
    }
}
