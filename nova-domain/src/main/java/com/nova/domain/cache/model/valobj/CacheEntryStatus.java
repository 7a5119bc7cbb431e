package com.nova.domain.cache.model.valobj;

import java.time.LocalDateTime;

/**
 * 缓存条目诊断快照。
 */
public record CacheEntryStatus(String key,
                               LocalDateTime fetchedAt,
                               LocalDateTime expiresAt,
                               boolean expired,
                               long ttlRemainingSeconds) {
}
