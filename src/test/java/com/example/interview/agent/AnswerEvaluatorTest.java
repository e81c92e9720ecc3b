package com.example.interview.agent;

import com.example.interview.model.BiasIssue;
import com.example.interview.model.Coaching;
import com.example.interview.model.Dossier;
import com.example.interview.model.EvaluationContext;
import com.example.interview.model.EvaluationStage;
import com.example.interview.model.Framework;
import com.example.interview.model.FrameworkSelection;
import com.example.interview.model.Intent;
import com.example.interview.model.InterviewContext;
import com.example.interview.model.QuestionType;
import com.example.interview.model.ScoreElement;
import com.example.interview.service.LlmClient;
import com.example.interview.service.LlmUnavailableException;
import com.example.interview.service.PromptChainExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerEvaluatorTest {

    private static final String QUESTION = "Tell me about a time you improved a slow system.";
    private static final String ANSWER = "At my last company the billing service was slow. "
            + "I led the rewrite of the cache layer and we cut latency by 40% in two months.";

    private StageRoutedLlm llm;
    private AnswerEvaluator evaluator;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        llm = new StageRoutedLlm();
        evaluator = new AnswerEvaluator(new PromptChainExecutor(), llm, new ObjectMapper());
        context = new EvaluationContext("3", QuestionType.STAR, List.of("own actions", "measurable result"), List.of(),
                new InterviewContext("Acme", "Backend Engineer", null, "Billing team, 2019-2023", null, null, null, null),
                List.of("Ownership: takes responsibility for outcomes"));

        llm.reply("intent", "{\"intent\": \"ANSWER\", \"reason\": \"answers the question\"}");
        llm.reply("framework", "{\"frameworks\": [\"STAR+M\"], \"evidence\": \"cut latency by 40%\"}");
        llm.reply("extraction", """
                {"framework": "STAR", "extracted": {"s": "slow billing service", "action": "led the cache rewrite",
                 "result": "latency -40% in two months", "mood": "proud"}}""");
        llm.reply("scoring", """
                {"framework": "STAR",
                 "scores_main": {"situation": 14, "t": "12", "action": 25, "result": 16, "charisma": 9},
                 "scores_ext": {"m": 7},
                 "scoring_reason": "Clear action and result, task is implicit."}""");
        llm.reply("explanation", """
                {"calibration": [{"element": "task", "given": 99, "max": 20, "why_not_max": "goal never stated",
                  "how_to_improve": ["state the goal", "name the deadline", "say who asked", "fourth action"]}],
                 "overall_tip": "State the task explicitly."}""");
        llm.reply("coaching", """
                {"strengths": ["\\"I led the rewrite\\" shows ownership", "\\"we doubled revenue\\" is impressive"],
                 "improvements": ["\\"cut latency by 40%\\" needs a baseline", "Talk more about the team"],
                 "feedback": "Strong episode, make the task explicit."}""");
        llm.reply("model_answer", """
                {"model_answer": "At Acme I would describe the billing latency problem first.",
                 "model_answer_framework": "STAR", "selection_reason": "episode question"}""");
        llm.reply("bias_filter", "{\"flagged\": false, \"issues\": [], \"sanitized_text\": \"\"}");
    }

    @Nested
    @DisplayName("full chain")
    class FullChain {

        @Test
        void producesACompleteDossier() {
            Dossier d = evaluator.evaluate(QUESTION, ANSWER, context);

            assertThat(d.questionLabel()).isEqualTo("3");
            assertThat(d.intent()).isEqualTo(Intent.ANSWER);
            assertThat(d.framework().label()).isEqualTo("STAR+M");
            assertThat(d.stageErrors()).isEmpty();
            assertThat(d.explanation().overallTip()).isEqualTo("State the task explicitly.");
            assertThat(d.modelAnswer().text()).startsWith("At Acme");
            assertThat(llm.calls).containsExactly("intent", "framework", "extraction", "scoring", "explanation",
                    "coaching", "model_answer", "bias_filter", "bias_filter");
        }

        @Test
        void extractionKeepsExactlyTheDeclaredKeys() {
            Dossier d = evaluator.evaluate(QUESTION, ANSWER, context);

            assertThat(d.extracted()).containsOnlyKeys("situation", "task", "action", "result");
            assertThat(d.extracted()).containsEntry("situation", "slow billing service").containsEntry("task", "");
        }

        @Test
        void scoresAreResolvedClampedAndRestricted() {
            Dossier d = evaluator.evaluate(QUESTION, ANSWER, context);

            assertThat(d.scoresMain()).containsOnlyKeys(ScoreElement.SITUATION, ScoreElement.TASK,
                    ScoreElement.ACTION, ScoreElement.RESULT);
            assertThat(d.scoresMain()).containsEntry(ScoreElement.TASK, 12).containsEntry(ScoreElement.ACTION, 20);
            assertThat(d.scoresExt()).containsEntry(ScoreElement.METRICS, 7);
            assertThat(d.totalMain()).isEqualTo(62);
        }

        @Test
        void explanationUsesTheGivenScoreAndCapsActions() {
            Dossier d = evaluator.evaluate(QUESTION, ANSWER, context);

            assertThat(d.explanation().calibration()).singleElement().satisfies(c -> {
                assertThat(c.given()).isEqualTo(12);
                assertThat(c.max()).isEqualTo(20);
                assertThat(c.howToImprove()).hasSize(3);
            });
        }

        @Test
        void coachingItemsMustQuoteTheAnswer() {
            Coaching coaching = evaluator.evaluate(QUESTION, ANSWER, context).coaching();

            assertThat(coaching.strengths()).containsExactly("\"I led the rewrite\" shows ownership");
            assertThat(coaching.improvements()).containsExactly("\"cut latency by 40%\" needs a baseline");
            assertThat(coaching.feedback()).startsWith("Strong episode");
        }

        @Test
        void scoringPromptCarriesCompetencyContextAndExpectedPoints() {
            evaluator.evaluate(QUESTION, ANSWER, context);

            assertThat(llm.prompt("scoring"))
                    .contains("Ownership: takes responsibility for outcomes")
                    .contains("Expected points: own actions; measurable result")
                    .contains("situation, task, action, result");
        }
    }

    @Nested
    @DisplayName("short circuits and failures")
    class Failures {

        @Test
        @DisplayName("a non-answer intent stops the chain after classification")
        void nonAnswerShortCircuits() {
            llm.reply("intent", "{\"intent\": \"clarification_request\"}");

            Dossier d = evaluator.evaluate(QUESTION, "Sorry, could you repeat that?", context);

            assertThat(d.intent()).isEqualTo(Intent.CLARIFICATION_REQUEST);
            assertThat(d.hasScores()).isFalse();
            assertThat(llm.calls).containsExactly("intent");
        }

        @Test
        void unrecognizedIntentIsStillEvaluated() {
            llm.reply("intent", "{\"intent\": \"PARTIAL_ANSWER\"}");

            Dossier d = evaluator.evaluate(QUESTION, ANSWER, context);

            assertThat(d.intent()).isEqualTo(Intent.UNKNOWN);
            assertThat(d.hasScores()).isTrue();
        }

        @Test
        @DisplayName("a failed scoring stage is recorded, its explanation skipped, later stages still run")
        void scoringFailureIsRecorded() {
            llm.reply("scoring", "I would give this answer a solid 7 out of 10.");

            Dossier d = evaluator.evaluate(QUESTION, ANSWER, context);

            assertThat(d.failed(EvaluationStage.SCORING)).isTrue();
            assertThat(d.stageErrors().get(EvaluationStage.SCORE_EXPLANATION)).startsWith("skipped");
            assertThat(d.hasScores()).isFalse();
            assertThat(d.coaching().strengths()).isNotEmpty();
            assertThat(d.modelAnswer()).isNotNull();
            assertThat(llm.calls).doesNotContain("explanation");
        }

        @Test
        void unidentifiedFrameworkFallsBackToTheQuestionType() {
            llm.reply("framework", "{\"frameworks\": []}");

            Dossier d = evaluator.evaluate(QUESTION, ANSWER, context);

            assertThat(d.framework().framework()).isEqualTo(Framework.STAR);
            assertThat(d.framework().extensions()).isEmpty();
        }

        @Test
        @DisplayName("an unavailable provider returns the partial dossier without further calls")
        void providerExhaustionStopsTheChain() {
            llm.failOn = "extraction";

            Dossier d = evaluator.evaluate(QUESTION, ANSWER, context);

            assertThat(d.intent()).isEqualTo(Intent.ANSWER);
            assertThat(d.framework().label()).isEqualTo("STAR+M");
            assertThat(d.failed(EvaluationStage.EXTRACTION)).isTrue();
            assertThat(llm.calls).containsExactly("intent", "framework", "extraction");
        }
    }

    @Nested
    @DisplayName("bias filter")
    class BiasFilter {

        @Test
        void flaggedModelAnswerIsSanitized() {
            llm.route("bias_filter", prompt -> prompt.contains("At Acme I would")
                    ? """
                      {"flagged": true,
                       "issues": [{"span": "young team", "category": "age", "reason": "age reference",
                                   "suggested_fix": "team", "severity": "medium"}],
                       "sanitized_text": "At Acme I would describe the problem first."}"""
                    : "{\"flagged\": false}");

            Dossier d = evaluator.evaluate(QUESTION, ANSWER, context);

            assertThat(d.modelAnswer().text()).isEqualTo("At Acme I would describe the problem first.");
            assertThat(d.biasIssues()).singleElement().satisfies(issue -> {
                assertThat(issue.source()).isEqualTo("model_answer");
                assertThat(issue.category()).isEqualTo("age");
            });
        }

        @Test
        @DisplayName("prose rewrite of flagged coaching drops the items that carry the flagged span")
        void flaggedCoachingItemsAreDropped() {
            llm.reply("coaching", """
                    {"strengths": ["\\"I led the rewrite\\" is impressive for a young woman",
                                   "\\"cut latency by 40%\\" shows impact"],
                     "improvements": ["\\"the billing service was slow\\" needs a baseline"],
                     "feedback": "Good for a young woman."}""");
            llm.route("bias_filter", prompt -> prompt.contains("young woman")
                    ? """
                      {"flagged": true,
                       "issues": [{"span": "Young woman", "category": "gender", "reason": "demographic reference",
                                   "suggested_fix": "", "severity": "high"}],
                       "sanitized_text": "'I led the rewrite' shows ownership."}"""
                    : "{\"flagged\": false}");

            Dossier d = evaluator.evaluate(QUESTION, ANSWER, context);

            assertThat(d.coaching().strengths()).containsExactly("\"cut latency by 40%\" shows impact");
            assertThat(d.coaching().improvements()).containsExactly("\"the billing service was slow\" needs a baseline");
            assertThat(d.coaching().feedback()).isEqualTo("'I led the rewrite' shows ownership.");
            assertThat(d.biasIssues()).extracting(BiasIssue::source).containsExactly("coaching");
        }
    }

    @Test
    void classifyOnlyMakesOneCall() {
        EvaluationContext icebreak = new EvaluationContext("1", QuestionType.ICEBREAKING, null, null, null, null);

        Dossier d = evaluator.classifyOnly("How are you?", "Fine, thanks.", icebreak);

        assertThat(d.intent()).isEqualTo(Intent.ANSWER);
        assertThat(d.questionType()).isEqualTo(QuestionType.ICEBREAKING);
        assertThat(llm.calls).containsExactly("intent");
    }

    @Test
    void mainScoresDefaultToZeroForMissingElements() {
        Map<ScoreElement, Integer> scores = AnswerEvaluator.parseMainScores(
                FrameworkSelection.parse("COMPETENCY", Framework.STAR), null);

        assertThat(scores).containsOnlyKeys(ScoreElement.COMPETENCY, ScoreElement.BEHAVIOR, ScoreElement.IMPACT);
        assertThat(scores.values()).containsOnly(0);
    }

    /** Answers each prompt stage from a routing table keyed by the stage's opening line. */
    static final class StageRoutedLlm implements LlmClient {

        private static final Map<String, String> MARKERS = new LinkedHashMap<>();

        static {
            // bias prompts embed other stage outputs, so they are matched first
            MARKERS.put("Review the interview feedback text", "bias_filter");
            MARKERS.put("You classify a candidate's reply", "intent");
            MARKERS.put("You identify which answer framework", "framework");
            MARKERS.put("Summarize the candidate's reply by the components", "extraction");
            MARKERS.put("Score the candidate's reply with the", "scoring");
            MARKERS.put("Explain each score", "explanation");
            MARKERS.put("You coach a candidate", "coaching");
            MARKERS.put("Write an improved model answer", "model_answer");
        }

        final Map<String, Function<String, String>> routes = new HashMap<>();
        final Map<String, String> lastPrompts = new HashMap<>();
        final List<String> calls = new ArrayList<>();
        String failOn;

        void reply(String stage, String json) {
            routes.put(stage, prompt -> json);
        }

        void route(String stage, Function<String, String> responder) {
            routes.put(stage, responder);
        }

        String prompt(String stage) {
            return lastPrompts.get(stage);
        }

        @Override
        public String call(String prompt, double temperature, int maxTokens) {
            for (Map.Entry<String, String> marker : MARKERS.entrySet()) {
                if (!prompt.contains(marker.getKey())) continue;
                String stage = marker.getValue();
                calls.add(stage);
                lastPrompts.put(stage, prompt);
                if (stage.equals(failOn)) {
                    throw new LlmUnavailableException("evaluation: model unavailable after 3 attempts", null);
                }
                return routes.getOrDefault(stage, p -> "{}").apply(prompt);
            }
            throw new IllegalStateException("No route for prompt: " + prompt);
        }
    }
}
