package com.nova.domain.conversation.model.entity;

import com.nova.domain.conversation.model.valobj.ChatTurn;
import com.nova.types.enums.MessageRoleEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 对话消息实体。
 */
@Data
public class ConversationMessageEntity {

    private Long id;
    private MessageRoleEnum role;
    private String content;
    private LocalDateTime createdAt;

    public void validate() {
        if (role == null) {
            throw new IllegalStateException("Message role cannot be null");
        }
        if (content == null || content.trim().isEmpty()) {
            throw new IllegalStateException("Message content cannot be empty");
        }
        if (createdAt == null) {
            throw new IllegalStateException("Message created time cannot be null");
        }
    }

    public boolean isAssistantMessage() {
        return role == MessageRoleEnum.ASSISTANT;
    }

    public boolean isUserMessage() {
        return role == MessageRoleEnum.USER;
    }

    public ChatTurn toChatTurn() {
        return new ChatTurn(role, content);
    }

    public static ConversationMessageEntity create(MessageRoleEnum role, String content, LocalDateTime createdAt) {
        if (content == null || content.trim().isEmpty()) {
            throw new IllegalStateException("Message content cannot be empty");
        }
        ConversationMessageEntity entity = new ConversationMessageEntity();
        entity.setRole(role);
        entity.setContent(content.trim());
        entity.setCreatedAt(createdAt);
        return entity;
    }
}
