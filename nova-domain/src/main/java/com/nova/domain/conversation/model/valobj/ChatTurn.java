package com.nova.domain.conversation.model.valobj;

import com.nova.types.enums.MessageRoleEnum;

/**
 * 传给补全服务的一条历史消息。
 */
public record ChatTurn(MessageRoleEnum role, String content) {

    public static ChatTurn user(String content) {
        return new ChatTurn(MessageRoleEnum.USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(MessageRoleEnum.ASSISTANT, content);
    }
}
