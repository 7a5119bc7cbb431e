package com.nova.domain.conversation.service;

import com.nova.domain.conversation.adapter.repository.IConversationMessageRepository;
import com.nova.domain.conversation.model.entity.ConversationMessageEntity;
import com.nova.domain.conversation.model.valobj.ChatTurn;
import com.nova.types.enums.MessageRoleEnum;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 对话账本领域服务：只追加写入，按尾部时间窗口读取。
 */
@Slf4j
@Service
public class ConversationLedgerDomainService {

    private final IConversationMessageRepository conversationMessageRepository;
    private final Clock clock;

    public ConversationLedgerDomainService(IConversationMessageRepository conversationMessageRepository, Clock clock) {
        this.conversationMessageRepository = conversationMessageRepository;
        this.clock = clock;
    }

    public ConversationMessageEntity append(MessageRoleEnum role, String content) {
        if (role == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "role 不能为空");
        }
        if (content == null || content.trim().isEmpty()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "content 不能为空");
        }
        ConversationMessageEntity entity = ConversationMessageEntity.create(role, content, LocalDateTime.now(clock));
        ConversationMessageEntity saved = conversationMessageRepository.save(entity);
        log.debug("Stored conversation message. role={}, messageId={}", role.getCode(), saved.getId());
        return saved;
    }

    /**
     * 边界入口：只接受 user / assistant。
     */
    public ConversationMessageEntity append(String role, String content) {
        MessageRoleEnum resolved = MessageRoleEnum.fromCode(role);
        if (resolved == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER,
                    "Invalid role: " + role + ". Must be 'user' or 'assistant'.");
        }
        return append(resolved, content);
    }

    public List<ConversationMessageEntity> recent(Duration window) {
        LocalDateTime cutoff = resolveCutoff(window);
        List<ConversationMessageEntity> messages = conversationMessageRepository.findCreatedSince(cutoff);
        if (messages == null || messages.isEmpty()) {
            return Collections.emptyList();
        }
        log.debug("Retrieved conversation window. window={}, size={}", window, messages.size());
        return messages;
    }

    /**
     * 模型上下文用的历史：窗口内最新的 maxMessages 条，仍按时间升序。
     */
    public List<ChatTurn> forContext(Duration window, int maxMessages) {
        List<ConversationMessageEntity> messages = recent(window);
        if (maxMessages <= 0 || messages.isEmpty()) {
            return Collections.emptyList();
        }
        List<ConversationMessageEntity> tail = messages.size() > maxMessages
                ? messages.subList(messages.size() - maxMessages, messages.size())
                : messages;
        return tail.stream().map(ConversationMessageEntity::toChatTurn).collect(Collectors.toList());
    }

    public long count() {
        return conversationMessageRepository.count();
    }

    private LocalDateTime resolveCutoff(Duration window) {
        if (window == null || window.isNegative()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "window 必须为非负时长");
        }
        return LocalDateTime.now(clock).minus(window);
    }
}
