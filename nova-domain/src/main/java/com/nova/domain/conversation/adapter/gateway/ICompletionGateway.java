package com.nova.domain.conversation.adapter.gateway;

import com.nova.domain.conversation.model.valobj.ChatTurn;

import java.util.List;

/**
 * 文本补全服务端口：意图识别兜底与回复生成共用。
 * <p>
 * 配额耗尽、超时、返回格式异常均以 AppException(COMPLETION_ERROR) 抛出。
 * </p>
 */
public interface ICompletionGateway {

    /**
     * 发起一次补全调用。
     *
     * @param prompt 本次输入
     * @param history 有序历史消息，可为空
     * @return 模型返回文本
     */
    String complete(String prompt, List<ChatTurn> history);

    default String complete(String prompt) {
        return complete(prompt, List.of());
    }
}
