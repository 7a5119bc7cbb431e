package com.nova.trigger.service;

import com.nova.domain.context.model.valobj.AssembledContext;
import com.nova.domain.context.service.ContextAssembleDomainService;
import com.nova.domain.conversation.adapter.gateway.ICompletionGateway;
import com.nova.domain.conversation.model.valobj.ChatTurn;
import com.nova.domain.conversation.service.ConversationLedgerDomainService;
import com.nova.domain.intent.model.valobj.ClassificationResult;
import com.nova.domain.intent.service.IntentResolveDomainService;
import com.nova.types.enums.MessageRoleEnum;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 单轮对话编排：识别 → 组装上下文 → 补全 → 写入账本。
 * <p>
 * 系统提示以一对 user/assistant 历史消息的形式放在最前面；补全失败时不写账本。
 * </p>
 */
@Slf4j
@Service
public class AssistantChatService {

    private final IntentResolveDomainService intentResolveDomainService;
    private final ContextAssembleDomainService contextAssembleDomainService;
    private final ConversationLedgerDomainService conversationLedgerDomainService;
    private final ICompletionGateway completionGateway;

    public AssistantChatService(IntentResolveDomainService intentResolveDomainService,
                                ContextAssembleDomainService contextAssembleDomainService,
                                ConversationLedgerDomainService conversationLedgerDomainService,
                                ICompletionGateway completionGateway) {
        this.intentResolveDomainService = intentResolveDomainService;
        this.contextAssembleDomainService = contextAssembleDomainService;
        this.conversationLedgerDomainService = conversationLedgerDomainService;
        this.completionGateway = completionGateway;
    }

    public ChatReply chat(String utterance, boolean forceRefresh) {
        if (StringUtils.isBlank(utterance)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "message 不能为空");
        }
        String message = utterance.trim();
        ClassificationResult classification = intentResolveDomainService.resolve(message);
        AssembledContext context = contextAssembleDomainService.assemble(classification, forceRefresh);

        List<ChatTurn> history = new ArrayList<>();
        history.add(ChatTurn.user("[System: " + context.renderSystemPrompt() + "]"));
        history.add(ChatTurn.assistant("Understood. I'm " + context.getPersona().name() + ", ready to help!"));
        history.addAll(context.getHistory());

        String reply = completionGateway.complete(message, history);

        conversationLedgerDomainService.append(MessageRoleEnum.USER, message);
        conversationLedgerDomainService.append(MessageRoleEnum.ASSISTANT, reply);
        log.info("Chat turn completed. topIntent={}, strategy={}, forceRefresh={}, sections={}",
                classification.topIntent(), classification.getStrategy(),
                context.isForceRefresh(), context.getSections().size());
        return new ChatReply(reply, classification, context.isForceRefresh(), context.getSections());
    }
}
