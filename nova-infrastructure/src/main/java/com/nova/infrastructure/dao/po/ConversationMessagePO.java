package com.nova.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 对话消息 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessagePO {

    private Long id;

    /**
     * 角色：user / assistant
     */
    private String role;

    private String content;

    private LocalDateTime createdAt;
}
