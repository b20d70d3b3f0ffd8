package com.adlanda.knowledgesync.insights;

import com.adlanda.knowledgesync.config.InsightsProperties;
import com.adlanda.knowledgesync.exception.InsightGenerationException;
import com.adlanda.knowledgesync.model.InsightDraft;
import com.adlanda.knowledgesync.model.InsightPriority;
import com.adlanda.knowledgesync.model.InsightType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Insight generator backed by a chat model.
 *
 * The model is asked for a JSON array of insight objects. Code fences and prose around
 * the array are tolerated, a single object is treated as a one-element array. Entries with
 * an unknown type or no title are skipped.
 */
@Component
public class LlmInsightGenerator implements InsightGenerator {

    private static final Logger log = LoggerFactory.getLogger(LlmInsightGenerator.class);

    static final String SYSTEM_PROMPT = """
            You are a project management analyst that extracts actionable insights from documents \
            such as meeting notes, transcripts and status reports.

            Identify:
            1. Action items with owners and due dates
            2. Decisions made and their implications
            3. Risks, blockers and dependencies
            4. Budget updates and timeline changes
            5. Technical issues and opportunities
            6. Stakeholder feedback and concerns

            For each insight, provide:
            - type: one of [action_item, decision, risk, milestone, blocker, dependency, budget_update, \
            timeline_change, stakeholder_feedback, technical_issue, opportunity, concern]
            - title: concise summary (max 100 chars)
            - description: explanation with context
            - confidence: number between 0.0 and 1.0
            - priority: one of [critical, high, medium, low]
            - project_name: if identifiable
            - assigned_to: person responsible, if mentioned
            - due_date: ISO date (yyyy-MM-dd), if mentioned
            - keywords: list of relevant terms

            Return ONLY a JSON array of insight objects. Return [] if the document has no insights.""";

    private static final double TEMPERATURE = 0.3;
    private static final int MAX_RESPONSE_TOKENS = 2000;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final InsightsProperties properties;

    public LlmInsightGenerator(ChatModel chatModel, ObjectMapper objectMapper, InsightsProperties properties) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public List<InsightDraft> generateInsights(String title, String content) {
        String text = content == null ? "" : content;
        if (text.length() > properties.getMaxContentChars()) {
            text = text.substring(0, properties.getMaxContentChars());
        }

        Prompt prompt = new Prompt(
                List.of(new SystemMessage(SYSTEM_PROMPT), new UserMessage(buildUserPrompt(title, text))),
                ChatOptions.builder().temperature(TEMPERATURE).maxTokens(MAX_RESPONSE_TOKENS).build());

        String responseText;
        try {
            ChatResponse response = chatModel.call(prompt);
            responseText = response.getResult().getOutput().getText();
        } catch (RuntimeException e) {
            throw new InsightGenerationException("Model call failed: " + e.getMessage(), e);
        }

        List<InsightDraft> drafts = parseResponse(responseText);
        log.debug("Model returned {} insights for '{}'", drafts.size(), title);
        return drafts;
    }

    static String buildUserPrompt(String title, String content) {
        return "Document title: " + (title == null ? "Unknown" : title) + "\n\n"
                + "Document content:\n" + content + "\n\n"
                + "Extract actionable project insights from this document.";
    }

    List<InsightDraft> parseResponse(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            throw new InsightGenerationException("Model returned an empty response");
        }

        JsonNode root = readJson(responseText.strip());
        List<InsightDraft> drafts = new ArrayList<>();

        if (root.isObject()) {
            toDraft(root).ifPresent(drafts::add);
            return drafts;
        }
        for (JsonNode node : root) {
            if (node.isObject()) {
                toDraft(node).ifPresent(drafts::add);
            }
        }
        return drafts;
    }

    private JsonNode readJson(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node != null && (node.isArray() || node.isObject())) {
                return node;
            }
        } catch (JsonProcessingException e) {
            log.debug("Response is not plain JSON, looking for an embedded array");
        }

        int start = text.indexOf('[');
        int end = text.lastIndexOf(']');
        if (start >= 0 && end > start) {
            try {
                return objectMapper.readTree(text.substring(start, end + 1));
            } catch (JsonProcessingException e) {
                throw new InsightGenerationException("Could not parse insights from model response", e);
            }
        }
        throw new InsightGenerationException("Model response contains no JSON array");
    }

    private Optional<InsightDraft> toDraft(JsonNode node) {
        String typeLabel = text(node, "type");
        Optional<InsightType> type = typeLabel == null ? Optional.of(InsightType.ACTION_ITEM) : InsightType.fromLabel(typeLabel);
        if (type.isEmpty()) {
            log.warn("Skipping insight with unknown type '{}'", typeLabel);
            return Optional.empty();
        }

        String title = text(node, "title");
        if (title == null) {
            log.warn("Skipping insight without title");
            return Optional.empty();
        }

        double confidence = node.path("confidence").asDouble(InsightDraft.DEFAULT_CONFIDENCE);
        confidence = Math.max(0.0, Math.min(1.0, confidence));

        List<String> keywords = new ArrayList<>();
        for (JsonNode keyword : node.path("keywords")) {
            if (keyword.isTextual() && !keyword.asText().isBlank()) {
                keywords.add(keyword.asText().strip());
            }
        }

        String description = text(node, "description");
        return Optional.of(new InsightDraft(
                type.get(),
                title.length() > 255 ? title.substring(0, 255) : title,
                description == null ? "" : description,
                InsightPriority.fromLabel(text(node, "priority")),
                confidence,
                text(node, "project_name"),
                text(node, "assigned_to"),
                parseDate(text(node, "due_date")),
                keywords));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().strip();
        return text.isEmpty() ? null : text;
    }

    private static LocalDate parseDate(String value) {
        if (value == null) {
            return null;
        }
        try {
            // Accept full timestamps by keeping the date part
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable due date '{}'", value);
            return null;
        }
    }
}
