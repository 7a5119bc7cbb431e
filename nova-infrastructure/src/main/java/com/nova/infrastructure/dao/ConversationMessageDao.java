package com.nova.infrastructure.dao;

import com.nova.infrastructure.dao.po.ConversationMessagePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 对话消息 DAO。
 */
@Mapper
public interface ConversationMessageDao {

    int insert(ConversationMessagePO po);

    /**
     * 按 created_at、id 升序返回 cutoff 之后（含）的消息
     */
    List<ConversationMessagePO> selectCreatedSince(@Param("cutoff") LocalDateTime cutoff);

    long countAll();
}
