package com.nova.domain.intent.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nova.types.common.Constants;
import com.nova.types.enums.IntentTypeEnum;
import com.nova.types.enums.ResponseCode;
import com.nova.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 意图识别提示词领域服务：few-shot 提示构建与模型输出解析。
 */
@Service
public class IntentPromptDomainService {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*(.*?)\\s*```", Pattern.DOTALL);
    private static final Pattern LABEL_SPLIT = Pattern.compile("[^a-zA-Z]+");

    private static final String FEW_SHOT_EXAMPLES = "EXAMPLES:\n"
            + "User: \"What's the weather like?\"\n"
            + "→ {\"weather\": 0.95, \"events\": 0.0, \"todos\": 0.0, \"refresh\": 0.0}\n\n"
            + "User: \"Do I have any meetings tomorrow?\"\n"
            + "→ {\"weather\": 0.0, \"events\": 0.95, \"todos\": 0.0, \"refresh\": 0.0}\n\n"
            + "User: \"Do I need an umbrella for my meeting?\"\n"
            + "→ {\"weather\": 0.8, \"events\": 0.6, \"todos\": 0.0, \"refresh\": 0.0}\n\n"
            + "User: \"What tasks do I need to finish today?\"\n"
            + "→ {\"weather\": 0.0, \"events\": 0.25, \"todos\": 0.95, \"refresh\": 0.0}\n\n"
            + "User: \"Get me the latest weather\"\n"
            + "→ {\"weather\": 0.9, \"events\": 0.0, \"todos\": 0.0, \"refresh\": 0.7}\n\n"
            + "User: \"Am I free at 3pm?\"\n"
            + "→ {\"weather\": 0.0, \"events\": 0.9, \"todos\": 0.0, \"refresh\": 0.0}\n\n"
            + "User: \"Should I bring a jacket to my appointment?\"\n"
            + "→ {\"weather\": 0.85, \"events\": 0.7, \"todos\": 0.0, \"refresh\": 0.0}\n\n"
            + "User: \"Refresh my calendar\"\n"
            + "→ {\"weather\": 0.0, \"events\": 0.5, \"todos\": 0.0, \"refresh\": 0.95}\n\n"
            + "User: \"Thanks, that's all\"\n"
            + "→ {\"weather\": 0.0, \"events\": 0.0, \"todos\": 0.0, \"refresh\": 0.0}\n";

    public String buildPrompt(String utterance) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Classify the user's intent. Return a JSON object with probabilities (0.0-1.0) for each intent.\n\n");
        prompt.append("Intents:\n");
        prompt.append("- weather: Questions about weather, temperature, rain, if they need umbrella/jacket\n");
        prompt.append("- events: Questions about calendar, meetings, schedule, availability\n");
        prompt.append("- todos: Questions about tasks, to-do items, reminders\n");
        prompt.append("- refresh: Requests to update/refresh data\n\n");
        prompt.append(FEW_SHOT_EXAMPLES);
        prompt.append("\nNOW CLASSIFY:\n");
        prompt.append("User: \"").append(utterance == null ? "" : utterance.replace('"', '\'')).append("\"\n");
        prompt.append("→ ");
        return prompt.toString();
    }

    /**
     * 解析模型输出。
     * <p>
     * 支持 JSON 概率对象与纯标签列表两种格式；标签列表中的每个已知标签赋予 labelConfidence。
     * 空 Map 表示模型判定为无具体领域。
     * </p>
     *
     * @throws AppException CLASSIFICATION_ERROR 输出为空或无法识别
     */
    public Map<IntentTypeEnum, Double> parseModelOutput(String raw, double labelConfidence) {
        if (raw == null || raw.isBlank()) {
            throw new AppException(ResponseCode.CLASSIFICATION_ERROR, "模型意图识别返回为空");
        }
        String text = stripCodeFence(raw.trim());
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return parseProbabilities(text.substring(start, end + 1));
        }
        return parseLabels(text, labelConfidence);
    }

    private String stripCodeFence(String text) {
        if (!text.contains("```")) {
            return text;
        }
        Matcher matcher = CODE_FENCE.matcher(text);
        return matcher.find() ? matcher.group(1).trim() : text;
    }

    private Map<IntentTypeEnum, Double> parseProbabilities(String json) {
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.CLASSIFICATION_ERROR, "模型意图识别结果不是有效 JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw new AppException(ResponseCode.CLASSIFICATION_ERROR, "模型意图识别结果不是 JSON 对象");
        }
        Map<IntentTypeEnum, Double> result = new EnumMap<>(IntentTypeEnum.class);
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            IntentTypeEnum intent = IntentTypeEnum.fromLabel(field.getKey());
            if (intent == null || intent == IntentTypeEnum.UNKNOWN || !field.getValue().isNumber()) {
                continue;
            }
            double probability = field.getValue().asDouble();
            if (probability >= 0.0 && probability <= 1.0) {
                result.put(intent, probability);
            }
        }
        return result;
    }

    private Map<IntentTypeEnum, Double> parseLabels(String text, double labelConfidence) {
        Map<IntentTypeEnum, Double> result = new EnumMap<>(IntentTypeEnum.class);
        boolean recognized = false;
        for (String token : LABEL_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) {
                continue;
            }
            if (Constants.GENERAL_LABEL.equals(token) || "none".equals(token)) {
                recognized = true;
                continue;
            }
            IntentTypeEnum intent = IntentTypeEnum.fromLabel(token);
            if (intent == null) {
                continue;
            }
            recognized = true;
            if (intent != IntentTypeEnum.UNKNOWN) {
                result.put(intent, labelConfidence);
            }
        }
        if (!recognized) {
            throw new AppException(ResponseCode.CLASSIFICATION_ERROR, "模型意图识别结果无法解析: " + StringUtils.abbreviate(text, 80));
        }
        return result;
    }
}
