package com.nova.test.support;

import com.nova.infrastructure.dao.CacheEntryDao;
import com.nova.infrastructure.dao.po.CacheEntryPO;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 以 Map 模拟 cache_entries 表的 DAO，行数据只保存 JSON 文本。
 */
public class InMemoryCacheEntryDao implements CacheEntryDao {

    private final Map<String, CacheEntryPO> rows = new LinkedHashMap<>();

    @Override
    public int upsert(CacheEntryPO po) {
        rows.put(po.getKey(), copy(po));
        return 1;
    }

    @Override
    public CacheEntryPO selectByKey(String key) {
        CacheEntryPO po = rows.get(key);
        return po == null ? null : copy(po);
    }

    @Override
    public List<CacheEntryPO> selectAll() {
        List<CacheEntryPO> result = new ArrayList<>();
        rows.values().forEach(po -> result.add(copy(po)));
        return result;
    }

    @Override
    public int deleteByKey(String key) {
        return rows.remove(key) == null ? 0 : 1;
    }

    @Override
    public int deleteExpiredBefore(LocalDateTime cutoff) {
        int before = rows.size();
        rows.values().removeIf(po -> po.getExpiresAt().isBefore(cutoff));
        return before - rows.size();
    }

    public String storedData(String key) {
        CacheEntryPO po = rows.get(key);
        return po == null ? null : po.getData();
    }

    private CacheEntryPO copy(CacheEntryPO po) {
        return CacheEntryPO.builder()
                .key(po.getKey())
                .data(po.getData())
                .fetchedAt(po.getFetchedAt())
                .expiresAt(po.getExpiresAt())
                .build();
    }
}
