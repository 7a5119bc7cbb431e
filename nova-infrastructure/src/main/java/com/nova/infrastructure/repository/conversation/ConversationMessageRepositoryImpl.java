package com.nova.infrastructure.repository.conversation;

import com.nova.domain.conversation.adapter.repository.IConversationMessageRepository;
import com.nova.domain.conversation.model.entity.ConversationMessageEntity;
import com.nova.infrastructure.dao.ConversationMessageDao;
import com.nova.infrastructure.dao.po.ConversationMessagePO;
import com.nova.types.enums.MessageRoleEnum;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 对话消息仓储实现。
 */
@Repository
@Slf4j
public class ConversationMessageRepositoryImpl implements IConversationMessageRepository {

    private final ConversationMessageDao conversationMessageDao;

    public ConversationMessageRepositoryImpl(ConversationMessageDao conversationMessageDao) {
        this.conversationMessageDao = conversationMessageDao;
    }

    @Override
    public ConversationMessageEntity save(ConversationMessageEntity entity) {
        entity.validate();
        ConversationMessagePO po = toPO(entity);
        try {
            conversationMessageDao.insert(po);
        } catch (DataAccessException ex) {
            log.error("Conversation store unavailable. action=insert, error={}", ex.getMessage());
            throw new AppException(ResponseCode.STORE_ERROR, "Failed to store conversation message", ex);
        }
        return toEntity(po);
    }

    @Override
    public List<ConversationMessageEntity> findCreatedSince(LocalDateTime cutoff) {
        List<ConversationMessagePO> list;
        try {
            list = conversationMessageDao.selectCreatedSince(cutoff);
        } catch (DataAccessException ex) {
            log.error("Conversation store unavailable. action=select, error={}", ex.getMessage());
            throw new AppException(ResponseCode.STORE_ERROR, "Failed to read conversation history", ex);
        }
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return list.stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public long count() {
        try {
            return conversationMessageDao.countAll();
        } catch (DataAccessException ex) {
            throw new AppException(ResponseCode.STORE_ERROR, "Failed to count conversation messages", ex);
        }
    }

    private ConversationMessageEntity toEntity(ConversationMessagePO po) {
        if (po == null) {
            return null;
        }
        ConversationMessageEntity entity = new ConversationMessageEntity();
        entity.setId(po.getId());
        entity.setRole(MessageRoleEnum.fromCode(po.getRole()));
        entity.setContent(po.getContent());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private ConversationMessagePO toPO(ConversationMessageEntity entity) {
        return ConversationMessagePO.builder()
                .id(entity.getId())
                .role(entity.getRole().getCode())
                .content(entity.getContent())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
