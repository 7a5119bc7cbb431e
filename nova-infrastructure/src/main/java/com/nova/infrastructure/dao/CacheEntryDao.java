package com.nova.infrastructure.dao;

import com.nova.infrastructure.dao.po.CacheEntryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 缓存条目 DAO
 */
@Mapper
public interface CacheEntryDao {

    /**
     * 插入或按主键整行覆盖
     */
    int upsert(CacheEntryPO po);

    CacheEntryPO selectByKey(@Param("key") String key);

    List<CacheEntryPO> selectAll();

    int deleteByKey(@Param("key") String key);

    /**
     * 删除过期时间早于 cutoff 的条目
     */
    int deleteExpiredBefore(@Param("cutoff") LocalDateTime cutoff);
}
