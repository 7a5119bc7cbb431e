package com.nova.domain.context.model.valobj;

import com.nova.domain.conversation.model.valobj.ChatTurn;
import com.nova.domain.intent.model.valobj.ClassificationResult;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 一次请求的组装结果，交给 Completion Gateway 使用。
 */
@Getter
@Builder
public class AssembledContext {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("EEEE, MMMM dd, yyyy 'at' hh:mm a", Locale.ENGLISH);

    private final PersonaProfile persona;
    private final LocalDateTime currentTime;
    private final List<ChatTurn> history;
    private final List<DomainSection> sections;
    private final boolean forceRefresh;
    private final ClassificationResult classification;

    public String currentTimeLine() {
        return "CURRENT TIME: " + currentTime.format(TIME_FORMAT);
    }

    public List<DomainSection> includedSections() {
        return sections.stream().filter(DomainSection::included).collect(Collectors.toList());
    }

    public List<DomainSection> omittedSections() {
        return sections.stream().filter(section -> !section.included()).collect(Collectors.toList());
    }

    public String renderSystemPrompt() {
        StringBuilder prompt = new StringBuilder(persona.preamble().strip());
        prompt.append("\n\nCONTEXT:\n").append(currentTimeLine());
        for (DomainSection section : sections) {
            prompt.append('\n').append(section.render());
        }
        return prompt.toString();
    }
}
