package com.nova.domain.cache.model.valobj;

import com.nova.domain.cache.model.entity.CacheEntryEntity;
import com.nova.types.enums.CacheReadStatusEnum;

import java.time.LocalDateTime;

/**
 * 缓存读取结果：数据本体及其新鲜度。
 */
public record CachedPayload(String key,
                            Object payload,
                            CacheReadStatusEnum status,
                            LocalDateTime fetchedAt,
                            LocalDateTime expiresAt) {

    public boolean isStale() {
        return status == CacheReadStatusEnum.STALE;
    }

    public static CachedPayload hit(CacheEntryEntity entry) {
        return from(entry, CacheReadStatusEnum.HIT);
    }

    public static CachedPayload fresh(CacheEntryEntity entry) {
        return from(entry, CacheReadStatusEnum.FRESH);
    }

    public static CachedPayload stale(CacheEntryEntity entry) {
        return from(entry, CacheReadStatusEnum.STALE);
    }

    private static CachedPayload from(CacheEntryEntity entry, CacheReadStatusEnum status) {
        return new CachedPayload(entry.getKey(), entry.getPayload(), status, entry.getFetchedAt(), entry.getExpiresAt());
    }
}
