package com.example.interview.agent;

import com.example.interview.config.InterviewProperties;
import com.example.interview.model.InterviewContext;
import com.example.interview.model.InterviewPlan;
import com.example.interview.model.PlanItem;
import com.example.interview.model.PlanPhase;
import com.example.interview.model.QuestionType;
import com.example.interview.service.LlmClient;
import com.example.interview.service.LlmUnavailableException;
import com.example.interview.service.PromptChainExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanDesignerAgentTest {

    private static final InterviewContext CONTEXT =
            new InterviewContext("Acme", "Data Engineer", "Build pipelines", "Spark, Airflow", null, null, null, null);

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> prompts = new ArrayList<>();

    private PlanDesignerAgent agent(String reply) {
        return agent((prompt, temperature, maxTokens) -> {
            prompts.add(prompt);
            return reply;
        }, InterviewProperties.defaults());
    }

    private static PlanDesignerAgent agent(LlmClient llm, InterviewProperties properties) {
        return new PlanDesignerAgent(new PromptChainExecutor(), llm, properties);
    }

    private static List<String> ids(InterviewPlan plan) {
        return plan.phases().stream().flatMap(p -> p.items().stream()).map(PlanItem::id).toList();
    }

    @Nested
    @DisplayName("generated plans")
    class Generated {

        @Test
        void phasesAreReorderedAndIdsAssigned() throws Exception {
            String json = """
                    {"phases": [
                      {"phase": "wrapup", "items": [{"type": "wrapup", "question": "Any questions for us?"}]},
                      {"phase": "core", "items": [
                        {"type": "star", "question": "Tell me about a failed pipeline.",
                         "expected_points": ["root cause", "fix"], "rubric": [{"score": 5, "descriptor": "clear ownership"}]},
                        {"type": "system", "question": "Design a batch ingestion service."}]},
                      {"phase": "intro", "items": [{"type": "icebreaking", "question": "How was your trip?"}]}
                    ]}""";

            InterviewPlan plan = agent("").normalize(mapper.readTree(json));

            assertThat(plan.phases()).extracting(PlanPhase::name).containsExactly("intro", "core", "wrapup");
            assertThat(ids(plan)).containsExactly("intro-1", "core-1", "core-2", "wrapup-1");
            PlanItem star = plan.item(1, 0);
            assertThat(star.type()).isEqualTo(QuestionType.STAR);
            assertThat(star.expectedPoints()).containsExactly("root cause", "fix");
            assertThat(star.rubric()).singleElement().satisfies(b -> {
                assertThat(b.score()).isEqualTo(5);
                assertThat(b.descriptor()).isEqualTo("clear ownership");
            });
        }

        @Test
        void duplicatesAndBlankQuestionsAreDropped() throws Exception {
            String json = """
                    {"phases": [{"phase": "core", "items": [
                      {"type": "star", "question": "Tell me about a conflict."},
                      {"type": "star", "question": "  tell me about   a CONFLICT. "},
                      {"type": "case", "question": ""}]}]}""";

            InterviewPlan plan = agent("").normalize(mapper.readTree(json));

            assertThat(plan.totalItems()).isEqualTo(1);
        }

        @Test
        void unknownPhaseNamesGoToCore() throws Exception {
            InterviewPlan plan = agent("").normalize(mapper.readTree(
                    "{\"phases\": [{\"phase\": \"deep dive\", \"items\": [{\"type\": \"hard\", \"question\": \"Why Spark?\"}]}]}"));

            assertThat(plan.phases()).singleElement().extracting(PlanPhase::name).isEqualTo("core");
        }

        @Test
        void itemCountIsCapped() throws Exception {
            PlanDesignerAgent capped = agent((p, t, m) -> "{}",
                    new InterviewProperties(null, null, null, new InterviewProperties.Plan(2, 0, 0)));

            InterviewPlan plan = capped.normalize(mapper.readTree("""
                    {"phases": [{"phase": "core", "items": [
                      {"type": "star", "question": "Q1?"}, {"type": "star", "question": "Q2?"},
                      {"type": "star", "question": "Q3?"}]}]}"""));

            assertThat(ids(plan)).containsExactly("core-1", "core-2");
        }

        @Test
        void designUsesGeneratedPlanWhenItHasCoreQuestions() {
            InterviewPlan plan = agent("{\"phases\": [{\"phase\": \"core\", \"items\": [{\"type\": \"case\", \"question\": \"Size the market?\"}]}]}")
                    .design(CONTEXT, List.of("SQL tuning"));

            assertThat(ids(plan)).containsExactly("core-1");
            assertThat(prompts.get(0)).contains("SQL tuning").contains("4 questions");
        }
    }

    @Nested
    @DisplayName("built-in plan")
    class Fallback {

        @Test
        void usedWhenOutputHasNoCoreQuestions() {
            InterviewPlan plan = agent("{\"phases\": [{\"phase\": \"intro\", \"items\": [{\"type\": \"icebreaking\", \"question\": \"Hi?\"}]}]}")
                    .design(CONTEXT, List.of());

            assertThat(ids(plan)).containsExactly("intro-1", "intro-2", "intro-3",
                    "core-1", "core-2", "core-3", "core-4", "wrapup-1");
        }

        @Test
        void usedWhenOutputNeverParses() {
            InterviewPlan plan = agent("I cannot help with that.").design(CONTEXT, List.of());

            assertThat(plan.totalItems()).isEqualTo(8);
            assertThat(prompts).hasSize(2);
        }

        @Test
        void easyDifficultyHasThreeCoreQuestions() {
            InterviewContext easy = new InterviewContext("Acme", "Data Engineer", null, null, null, null, "easy", null);

            InterviewPlan plan = agent("").fallbackPlan(easy);

            assertThat(plan.itemCount(1)).isEqualTo(3);
            assertThat(plan.item(0, 2).question()).isEqualTo("Why do you want to join Acme as Data Engineer?");
        }
    }

    @Test
    void unavailableModelIsAHardFailure() {
        PlanDesignerAgent failing = agent((p, t, m) -> {
            throw new LlmUnavailableException("quota exhausted", null);
        }, InterviewProperties.defaults());

        assertThatThrownBy(() -> failing.design(CONTEXT, List.of()))
                .isInstanceOf(LlmUnavailableException.class)
                .hasMessageContaining("quota exhausted");
    }
}
