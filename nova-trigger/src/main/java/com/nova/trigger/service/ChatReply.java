package com.nova.trigger.service;

import com.nova.domain.context.model.valobj.DomainSection;
import com.nova.domain.intent.model.valobj.ClassificationResult;

import java.util.List;

/**
 * 一轮对话的结果。
 */
public record ChatReply(String reply,
                        ClassificationResult classification,
                        boolean forceRefresh,
                        List<DomainSection> sections) {
}
