package com.nova.infrastructure.ai;

import com.nova.domain.conversation.adapter.gateway.ICompletionGateway;
import com.nova.domain.conversation.model.valobj.ChatTurn;
import com.nova.types.enums.MessageRoleEnum;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 基于 Spring AI ChatClient 的补全网关。
 * <p>
 * 调用在公共线程池上执行并受超时约束；超时、模型异常、空回复均转换为 COMPLETION_ERROR。
 * </p>
 */
@Slf4j
@Component
public class SpringAiCompletionGateway implements ICompletionGateway {

    private final ChatClient chatClient;
    private final ExecutorService executor;
    private final long timeoutMs;

    public SpringAiCompletionGateway(ChatModel chatModel,
                                     @Qualifier("commonThreadPoolExecutor") ExecutorService executor,
                                     @Value("${nova.completion.timeout-ms:20000}") long timeoutMs) {
        this.chatClient = ChatClient.builder(chatModel).build();
        this.executor = executor;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String complete(String prompt, List<ChatTurn> history) {
        if (StringUtils.isBlank(prompt)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "prompt 不能为空");
        }
        List<Message> messages = toMessages(history);
        String reply = timeoutMs <= 0L ? callDirect(prompt, messages) : callWithTimeout(prompt, messages);
        if (StringUtils.isBlank(reply)) {
            throw new AppException(ResponseCode.COMPLETION_ERROR, "Completion returned an empty reply");
        }
        return reply.trim();
    }

    private String callWithTimeout(String prompt, List<Message> messages) {
        Future<String> future;
        try {
            future = executor.submit(() -> call(prompt, messages));
        } catch (RejectedExecutionException ex) {
            throw new AppException(ResponseCode.COMPLETION_ERROR, "Completion executor is saturated", ex);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Completion timed out. timeoutMs={}", timeoutMs);
            throw new AppException(ResponseCode.COMPLETION_ERROR, "Completion timed out after " + timeoutMs + "ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.COMPLETION_ERROR, "Completion interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof AppException appException) {
                throw appException;
            }
            log.warn("Completion failed. error={}", cause.getMessage());
            throw new AppException(ResponseCode.COMPLETION_ERROR, "Completion failed: " + cause.getMessage(), cause);
        }
    }

    private String callDirect(String prompt, List<Message> messages) {
        try {
            return call(prompt, messages);
        } catch (RuntimeException ex) {
            log.warn("Completion failed. error={}", ex.getMessage());
            throw new AppException(ResponseCode.COMPLETION_ERROR, "Completion failed: " + ex.getMessage(), ex);
        }
    }

    private String call(String prompt, List<Message> messages) {
        return chatClient.prompt()
                .messages(messages)
                .user(prompt)
                .call()
                .content();
    }

    private List<Message> toMessages(List<ChatTurn> history) {
        List<Message> messages = new ArrayList<>();
        if (history == null) {
            return messages;
        }
        for (ChatTurn turn : history) {
            if (turn == null || StringUtils.isBlank(turn.content())) {
                continue;
            }
            if (turn.role() == MessageRoleEnum.ASSISTANT) {
                messages.add(new AssistantMessage(turn.content()));
            } else {
                messages.add(new UserMessage(turn.content()));
            }
        }
        return messages;
    }
}
