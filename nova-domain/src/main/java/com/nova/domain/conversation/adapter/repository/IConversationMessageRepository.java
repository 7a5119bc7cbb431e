package com.nova.domain.conversation.adapter.repository;

import com.nova.domain.conversation.model.entity.ConversationMessageEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 对话消息仓储接口。
 */
public interface IConversationMessageRepository {

    /**
     * 追加一条消息，返回带主键的实体。
     */
    ConversationMessageEntity save(ConversationMessageEntity entity);

    /**
     * 查询 createdAt 不早于 cutoff 的消息，按 createdAt、id 升序。
     */
    List<ConversationMessageEntity> findCreatedSince(LocalDateTime cutoff);

    long count();
}
