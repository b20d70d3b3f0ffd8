package com.adlanda.knowledgesync.insights;

import com.adlanda.knowledgesync.config.InsightsProperties;
import com.adlanda.knowledgesync.exception.InsightGenerationException;
import com.adlanda.knowledgesync.model.InsightDraft;
import com.adlanda.knowledgesync.model.InsightPriority;
import com.adlanda.knowledgesync.model.InsightType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmInsightGeneratorTest {

    @Mock
    private ChatModel chatModel;

    private InsightsProperties properties;
    private LlmInsightGenerator generator;

    @BeforeEach
    void setUp() {
        properties = new InsightsProperties();
        generator = new LlmInsightGenerator(chatModel, new ObjectMapper(), properties);
    }

    @Test
    void generateInsights_fencedJson_parsesAllFields() {
        // Setup
        String response = """
                ```json
                [
                  {
                    "type": "action_item",
                    "title": "Send revised budget",
                    "description": "Dana sends the revised budget to finance",
                    "confidence": 0.9,
                    "priority": "high",
                    "project_name": "Apollo",
                    "assigned_to": "Dana",
                    "due_date": "2026-07-01T00:00:00Z",
                    "keywords": ["budget", "finance"]
                  }
                ]
                ```""";
        when(chatModel.call(any(Prompt.class))).thenReturn(reply(response));

        // Execute
        List<InsightDraft> drafts = generator.generateInsights("standup.md", "notes");

        // Verify
        assertThat(drafts).hasSize(1);
        InsightDraft draft = drafts.get(0);
        assertThat(draft.type()).isEqualTo(InsightType.ACTION_ITEM);
        assertThat(draft.title()).isEqualTo("Send revised budget");
        assertThat(draft.priority()).isEqualTo(InsightPriority.HIGH);
        assertThat(draft.confidence()).isEqualTo(0.9);
        assertThat(draft.projectName()).isEqualTo("Apollo");
        assertThat(draft.assignedTo()).isEqualTo("Dana");
        assertThat(draft.dueDate()).isEqualTo(LocalDate.of(2026, 7, 1));
        assertThat(draft.keywords()).containsExactly("budget", "finance");
    }

    @Test
    void generateInsights_longContent_truncatesPromptAndSetsOptions() {
        // Setup
        properties.setMaxContentChars(10);
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("[]"));

        // Execute
        List<InsightDraft> drafts = generator.generateInsights("plan.txt", "abcdefghijKLMNOP");

        // Verify
        assertThat(drafts).isEmpty();
        ArgumentCaptor<Prompt> prompt = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(prompt.capture());

        List<Message> messages = prompt.getValue().getInstructions();
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0).getText()).isEqualTo(LlmInsightGenerator.SYSTEM_PROMPT);
        assertThat(messages.get(1).getText())
                .contains("Document title: plan.txt")
                .contains("abcdefghij")
                .doesNotContain("KLMNOP");
        assertThat(prompt.getValue().getOptions().getTemperature()).isEqualTo(0.3);
    }

    @Test
    void generateInsights_modelFailure_throwsGenerationException() {
        // Setup
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("rate limited"));

        // Execute & Verify
        assertThatThrownBy(() -> generator.generateInsights("a.txt", "content"))
                .isInstanceOf(InsightGenerationException.class)
                .hasMessageContaining("rate limited");
    }

    @Test
    void parseResponse_arrayWrappedInProse_isExtracted() {
        // Execute
        List<InsightDraft> drafts = generator.parseResponse(
                "Here are the insights: [{\"type\": \"risk\", \"title\": \"Vendor may slip\"}] Let me know.");

        // Verify
        assertThat(drafts).hasSize(1);
        assertThat(drafts.get(0).type()).isEqualTo(InsightType.RISK);
    }

    @Test
    void parseResponse_singleObject_isTreatedAsOneInsight() {
        // Execute
        List<InsightDraft> drafts = generator.parseResponse("{\"type\": \"decision\", \"title\": \"Ship on Friday\"}");

        // Verify
        assertThat(drafts).extracting(InsightDraft::title).containsExactly("Ship on Friday");
    }

    @Test
    void parseResponse_missingFields_fallBackToDefaults() {
        // Execute
        List<InsightDraft> drafts = generator.parseResponse(
                "[{\"title\": \"Follow up\", \"confidence\": 4.2, \"priority\": \"urgent\", \"due_date\": \"next week\"}]");

        // Verify
        InsightDraft draft = drafts.get(0);
        assertThat(draft.type()).isEqualTo(InsightType.ACTION_ITEM);
        assertThat(draft.priority()).isEqualTo(InsightPriority.MEDIUM);
        assertThat(draft.confidence()).isEqualTo(1.0);
        assertThat(draft.description()).isEmpty();
        assertThat(draft.dueDate()).isNull();
        assertThat(draft.keywords()).isEmpty();
    }

    @Test
    void parseResponse_unknownTypeOrMissingTitle_isSkipped() {
        // Execute
        List<InsightDraft> drafts = generator.parseResponse("""
                [
                  {"type": "gossip", "title": "Who said what"},
                  {"type": "blocker"},
                  {"type": "blocker", "title": "Waiting on legal"}
                ]""");

        // Verify
        assertThat(drafts).extracting(InsightDraft::title).containsExactly("Waiting on legal");
    }

    @Test
    void parseResponse_noJson_throws() {
        // Execute & Verify
        assertThatThrownBy(() -> generator.parseResponse("I could not find any insights."))
                .isInstanceOf(InsightGenerationException.class);
        assertThatThrownBy(() -> generator.parseResponse("   "))
                .isInstanceOf(InsightGenerationException.class);
        assertThatThrownBy(() -> generator.parseResponse("[{\"title\": broken]"))
                .isInstanceOf(InsightGenerationException.class);
    }

    private static ChatResponse reply(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }
}
