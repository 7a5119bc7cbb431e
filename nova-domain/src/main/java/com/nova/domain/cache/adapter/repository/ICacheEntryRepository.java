package com.nova.domain.cache.adapter.repository;

import com.nova.domain.cache.model.entity.CacheEntryEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 缓存条目仓储接口。
 * <p>
 * 存储不可用时抛出 AppException(STORE_ERROR)。
 * </p>
 */
public interface ICacheEntryRepository {

    CacheEntryEntity findByKey(String key);

    /**
     * 原子写入：键存在则整行覆盖，不存在则插入。
     *
     * @return 写入后的条目，payload 与之后 findByKey 读回的形态一致
     */
    CacheEntryEntity upsert(CacheEntryEntity entity);

    List<CacheEntryEntity> findAll();

    boolean deleteByKey(String key);

    int deleteExpiredBefore(LocalDateTime cutoff);
}
