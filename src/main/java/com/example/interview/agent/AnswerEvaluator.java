package com.example.interview.agent;

import com.example.interview.model.BiasIssue;
import com.example.interview.model.Coaching;
import com.example.interview.model.Dossier;
import com.example.interview.model.ElementCalibration;
import com.example.interview.model.EvaluationContext;
import com.example.interview.model.EvaluationStage;
import com.example.interview.model.FrameworkSelection;
import com.example.interview.model.Intent;
import com.example.interview.model.ModelAnswer;
import com.example.interview.model.RubricBand;
import com.example.interview.model.ScoreElement;
import com.example.interview.model.ScoreExplanation;
import com.example.interview.model.StageResult;
import com.example.interview.service.JsonNodes;
import com.example.interview.service.JsonRepair;
import com.example.interview.service.LlmClient;
import com.example.interview.service.PromptChainExecutor;
import com.example.interview.service.PromptStage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates one candidate answer through the fixed chain:
 * <pre>
 * [1/8] intent → [2/8] framework → [3/8] extraction → [4/8] scoring →
 * [5/8] score explanation → [6/8] coaching → [7/8] model answer → [8/8] bias filter
 * </pre>
 * A failing stage is recorded in {@link Dossier#stageErrors()} and the independent stages
 * after it still run. When the provider is exhausted the chain stops and the partial
 * dossier is returned.
 */
@Service
public class AnswerEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AnswerEvaluator.class);

    private static final int MODEL_ANSWER_MAX_CHARS = 800;
    private static final int MODEL_ANSWER_MIN_CHARS = 400;
    private static final int MAX_COACHING_ITEMS = 5;
    private static final int MAX_IMPROVEMENT_ACTIONS = 3;
    private static final int RESUME_EXCERPT_CHARS = 1500;

    private static final Pattern QUOTED = Pattern.compile("[\"“”](.+?)[\"“”]|'([^']{4,}?)'");
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private final PromptChainExecutor executor;
    private final LlmClient llm;
    private final ObjectMapper objectMapper;

    public AnswerEvaluator(PromptChainExecutor executor,
                           @Qualifier("evaluationLlmClient") LlmClient llm,
                           ObjectMapper objectMapper) {
        this.executor = executor;
        this.llm = llm;
        this.objectMapper = objectMapper;
    }

    /**
     * Runs the evaluation chain.
     *
     * @param question interviewer question
     * @param answer   candidate reply
     * @param context  question metadata and session context
     * @return dossier with whatever stages succeeded
     */
    public Dossier evaluate(String question, String answer, EvaluationContext context) {
        Draft draft = new Draft(context);
        String safeAnswer = answer != null ? answer : "";
        String safeQuestion = question != null ? question : "";
        log.info("AnswerEvaluator: evaluating answer to '{}' ({} chars)", context.questionLabel(), safeAnswer.length());

        // ── [1/8] Intent ─────────────────────────────────────────────────────
        StageResult intent = run(draft, EvaluationStage.INTENT, EvaluationPrompts.INTENT,
                Map.of("question", safeQuestion, "answer", safeAnswer));
        if (intent.fatal()) return draft.toDossier();
        if (!intent.isError()) {
            draft.intent = Intent.fromLabel(JsonNodes.text(intent.payload(), "intent"));
        }
        if (!draft.intent.isEvaluated()) {
            log.info("AnswerEvaluator: intent {} for '{}', chain short-circuited", draft.intent, context.questionLabel());
            return Dossier.intentOnly(context.questionLabel(), context.questionType(), draft.intent, draft.errors);
        }

        // ── [2/8] Framework identification ───────────────────────────────────
        StageResult fw = run(draft, EvaluationStage.FRAMEWORK, EvaluationPrompts.FRAMEWORK,
                Map.of("question", safeQuestion, "answer", safeAnswer));
        draft.framework = new FrameworkSelection(context.defaultFramework(), null);
        if (fw.fatal()) return draft.toDossier();
        if (!fw.isError()) {
            List<String> labels = JsonNodes.strings(fw.payload(), "frameworks");
            String label = !labels.isEmpty() ? labels.get(0) : JsonNodes.text(fw.payload(), "framework");
            draft.framework = FrameworkSelection.parse(label, context.defaultFramework());
        }
        log.info("AnswerEvaluator: [2/8] framework {}", draft.framework.label());
        String componentKeys = String.join(", ", draft.framework.framework().elementKeys());

        // ── [3/8] Extraction ─────────────────────────────────────────────────
        StageResult extraction = run(draft, EvaluationStage.EXTRACTION, EvaluationPrompts.EXTRACTION, Map.of(
                "framework", draft.framework.framework().name(),
                "component_keys", componentKeys,
                "question", safeQuestion,
                "answer", safeAnswer));
        if (extraction.fatal()) return draft.toDossier();
        if (!extraction.isError()) {
            JsonNode node = extraction.payload().has("extracted")
                    ? extraction.payload().get("extracted") : extraction.payload();
            draft.extracted = restrictToDeclaredKeys(draft.framework, node);
        } else {
            draft.extracted = restrictToDeclaredKeys(draft.framework, null);
        }

        // ── [4/8] Scoring ────────────────────────────────────────────────────
        Map<String, Object> scoringVars = new HashMap<>();
        scoringVars.put("persona", context.interview().persona().description());
        scoringVars.put("evaluation_focus", context.interview().persona().evaluationFocus());
        scoringVars.put("framework", draft.framework.framework().name());
        scoringVars.put("component_keys", componentKeys);
        scoringVars.put("extension_keys", String.join(", ", ScoreElement.extensions().stream().map(ScoreElement::key).toList()));
        scoringVars.put("competency_context", context.competencyHints().isEmpty()
                ? "(none)" : String.join("\n", context.competencyHints()));
        scoringVars.put("rubric", renderRubric(context));
        scoringVars.put("extracted", toJson(draft.extracted));
        scoringVars.put("question", safeQuestion);
        scoringVars.put("answer", safeAnswer);
        StageResult scoring = run(draft, EvaluationStage.SCORING, EvaluationPrompts.SCORING, scoringVars);
        if (scoring.fatal()) return draft.toDossier();
        if (!scoring.isError()) {
            draft.scoresMain = parseMainScores(draft.framework, scoring.payload().get("scores_main"));
            draft.scoresExt = parseExtScores(draft.framework, scoring.payload().get("scores_ext"));
            draft.scoringReason = JsonNodes.text(scoring.payload(), "scoring_reason");
            log.info("AnswerEvaluator: [4/8] main {}/{}", sum(draft.scoresMain), draft.framework.framework().maxMainScore());
        }

        // ── [5/8] Score explanation (needs scores) ───────────────────────────
        if (scoring.isError()) {
            draft.errors.put(EvaluationStage.SCORE_EXPLANATION, "skipped: scoring failed");
        } else {
            StageResult explanation = run(draft, EvaluationStage.SCORE_EXPLANATION, EvaluationPrompts.SCORE_EXPLANATION, Map.of(
                    "framework", draft.framework.label(),
                    "scores", renderScores(draft),
                    "scoring_reason", draft.scoringReason,
                    "answer", safeAnswer));
            if (explanation.fatal()) return draft.toDossier();
            if (!explanation.isError()) {
                draft.explanation = parseExplanation(draft, explanation.payload());
            }
        }

        // ── [6/8] Coaching ───────────────────────────────────────────────────
        StageResult coaching = run(draft, EvaluationStage.COACHING, EvaluationPrompts.COACHING, Map.of(
                "persona", context.interview().persona().description(),
                "question", safeQuestion,
                "answer", safeAnswer,
                "scoring_reason", draft.scoringReason.isEmpty() ? "(not available)" : draft.scoringReason));
        if (coaching.fatal()) return draft.toDossier();
        if (!coaching.isError()) {
            draft.coaching = groundCoaching(coaching.payload(), safeAnswer);
        }

        // ── [7/8] Model answer ───────────────────────────────────────────────
        StageResult model = run(draft, EvaluationStage.MODEL_ANSWER, EvaluationPrompts.MODEL_ANSWER, Map.of(
                "role", context.interview().jobTitle(),
                "company", context.interview().companyName(),
                "question", safeQuestion,
                "answer", safeAnswer,
                "resume", clip(context.interview().resume(), RESUME_EXCERPT_CHARS)));
        if (model.fatal()) return draft.toDossier();
        if (!model.isError()) {
            draft.modelAnswer = new ModelAnswer(
                    clipModelAnswer(JsonNodes.text(model.payload(), "model_answer")),
                    JsonNodes.text(model.payload(), "model_answer_framework"),
                    JsonNodes.text(model.payload(), "selection_reason"));
        }

        // ── [8/8] Bias filter ────────────────────────────────────────────────
        applyBiasFilter(draft);

        Dossier dossier = draft.toDossier();
        if (!dossier.stageErrors().isEmpty()) {
            log.warn("AnswerEvaluator: '{}' finished with failed stages {}", context.questionLabel(),
                    dossier.stageErrors().keySet());
        }
        return dossier;
    }

    /**
     * Classifies the intent only. Used for turns that are never scored (icebreaking, wrap-up).
     */
    public Dossier classifyOnly(String question, String answer, EvaluationContext context) {
        Draft draft = new Draft(context);
        StageResult intent = run(draft, EvaluationStage.INTENT, EvaluationPrompts.INTENT, Map.of(
                "question", question != null ? question : "",
                "answer", answer != null ? answer : ""));
        if (!intent.isError()) {
            draft.intent = Intent.fromLabel(JsonNodes.text(intent.payload(), "intent"));
        }
        return Dossier.intentOnly(context.questionLabel(), context.questionType(), draft.intent, draft.errors);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // Bias filter
    // ═══════════════════════════════════════════════════════════════════════════

    private void applyBiasFilter(Draft draft) {
        if (!draft.coaching.strengths().isEmpty() || !draft.coaching.improvements().isEmpty()
                || !draft.coaching.feedback().isEmpty()) {
            StageResult r = run(draft, EvaluationStage.BIAS_FILTER, EvaluationPrompts.BIAS_FILTER,
                    Map.of("text", toJson(draft.coaching)));
            if (r.fatal()) return;
            if (!r.isError() && JsonNodes.bool(r.payload(), "flagged")) {
                List<BiasIssue> issues = parseIssues("coaching", r.payload());
                draft.biasIssues.addAll(issues);
                draft.coaching = sanitizedCoaching(draft.coaching, JsonNodes.text(r.payload(), "sanitized_text"), issues);
                log.warn("AnswerEvaluator: [8/8] coaching sanitized ({} issues)", draft.biasIssues.size());
            }
        }
        if (draft.modelAnswer != null && !draft.modelAnswer.text().isEmpty()) {
            StageResult r = run(draft, EvaluationStage.BIAS_FILTER, EvaluationPrompts.BIAS_FILTER,
                    Map.of("text", draft.modelAnswer.text()));
            if (!r.isError() && JsonNodes.bool(r.payload(), "flagged")) {
                List<BiasIssue> issues = parseIssues("model_answer", r.payload());
                draft.biasIssues.addAll(issues);
                String sanitized = JsonNodes.text(r.payload(), "sanitized_text");
                if (!sanitized.isEmpty()) draft.modelAnswer = draft.modelAnswer.withText(sanitized);
                log.warn("AnswerEvaluator: [8/8] model answer sanitized ({} issues)", issues.size());
            }
        }
    }

    /**
     * Applies the filter's rewrite. Structured output replaces the coaching; prose output
     * replaces the feedback only, so every strength or improvement containing a flagged
     * span is dropped.
     */
    static Coaching sanitizedCoaching(Coaching original, String sanitized, List<BiasIssue> issues) {
        ObjectNode parsed = sanitized.isEmpty() ? null : JsonRepair.repair(sanitized);
        Coaching rewritten;
        if (parsed != null && (parsed.has("strengths") || parsed.has("improvements"))) {
            rewritten = new Coaching(JsonNodes.strings(parsed, "strengths"),
                    JsonNodes.strings(parsed, "improvements"),
                    JsonNodes.text(parsed, "feedback"));
        } else {
            rewritten = sanitized.isEmpty() ? original : original.withFeedback(sanitized);
        }
        List<String> spans = issues.stream()
                .map(i -> i.span().toLowerCase(Locale.ROOT))
                .filter(span -> !span.isBlank())
                .toList();
        if (spans.isEmpty()) return rewritten;
        return new Coaching(withoutSpans(rewritten.strengths(), spans),
                withoutSpans(rewritten.improvements(), spans),
                rewritten.feedback());
    }

    private static List<String> withoutSpans(List<String> items, List<String> spans) {
        return items.stream()
                .filter(item -> spans.stream().noneMatch(item.toLowerCase(Locale.ROOT)::contains))
                .toList();
    }

    private static List<BiasIssue> parseIssues(String source, JsonNode payload) {
        List<BiasIssue> issues = new ArrayList<>();
        JsonNode arr = payload.get("issues");
        if (arr == null || !arr.isArray()) return issues;
        for (JsonNode n : arr) {
            issues.add(new BiasIssue(source,
                    JsonNodes.text(n, "span"),
                    JsonNodes.text(n, "category"),
                    JsonNodes.text(n, "reason"),
                    JsonNodes.text(n, "suggested_fix"),
                    JsonNodes.text(n, "severity")));
        }
        return issues;
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // Parsing helpers
    // ═══════════════════════════════════════════════════════════════════════════

    private StageResult run(Draft draft, EvaluationStage stage, PromptStage prompt, Map<String, ?> vars) {
        StageResult r = executor.runStage(prompt, vars, llm);
        if (r.isError()) {
            // the bias filter runs twice; keep the first failure
            draft.errors.putIfAbsent(stage, r.error());
            log.warn("AnswerEvaluator: stage {} failed for '{}' ({})", stage, draft.context.questionLabel(), r.error());
        }
        return r;
    }

    /** Keeps exactly the framework's declared keys; missing content becomes "". */
    static Map<String, String> restrictToDeclaredKeys(FrameworkSelection selection, JsonNode extracted) {
        Map<String, String> out = new LinkedHashMap<>();
        for (ScoreElement e : selection.framework().elements()) {
            out.put(e.key(), "");
        }
        if (extracted != null && extracted.isObject()) {
            extracted.fields().forEachRemaining(entry -> ScoreElement.lookup(entry.getKey())
                    .filter(out::containsKey)
                    .ifPresent(e -> out.put(e.key(), entry.getValue().isValueNode()
                            ? entry.getValue().asText("").trim() : entry.getValue().toString())));
        }
        return out;
    }

    static Map<ScoreElement, Integer> parseMainScores(FrameworkSelection selection, JsonNode node) {
        Map<ScoreElement, Integer> scores = new EnumMap<>(ScoreElement.class);
        for (ScoreElement e : selection.framework().elements()) {
            scores.put(e, 0);
        }
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(entry -> ScoreElement.lookup(entry.getKey())
                    .filter(scores::containsKey)
                    .ifPresent(e -> scores.put(e, clamp(JsonNodes.intValue(entry.getValue(), 0), e.maxScore()))));
        }
        return scores;
    }

    static Map<ScoreElement, Integer> parseExtScores(FrameworkSelection selection, JsonNode node) {
        Map<ScoreElement, Integer> scores = new EnumMap<>(ScoreElement.class);
        for (ScoreElement e : selection.extensions()) {
            scores.put(e, 0);
        }
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(entry -> ScoreElement.lookup(entry.getKey())
                    .filter(ScoreElement::isExtension)
                    .ifPresent(e -> scores.put(e, clamp(JsonNodes.intValue(entry.getValue(), 0), e.maxScore()))));
        }
        return scores;
    }

    private static ScoreExplanation parseExplanation(Draft draft, JsonNode payload) {
        List<ElementCalibration> calibration = new ArrayList<>();
        JsonNode arr = payload.get("calibration");
        if (arr != null && arr.isArray()) {
            for (JsonNode n : arr) {
                ScoreElement element = ScoreElement.lookup(JsonNodes.text(n, "element")).orElse(null);
                if (element == null) continue;
                Integer given = element.isExtension() ? draft.scoresExt.get(element) : draft.scoresMain.get(element);
                if (given == null) continue;
                List<String> actions = JsonNodes.strings(n, "how_to_improve");
                calibration.add(new ElementCalibration(element.key(), given, element.maxScore(),
                        JsonNodes.text(n, "why_not_max"),
                        actions.size() > MAX_IMPROVEMENT_ACTIONS ? actions.subList(0, MAX_IMPROVEMENT_ACTIONS) : actions));
            }
        }
        return new ScoreExplanation(calibration, JsonNodes.text(payload, "overall_tip"));
    }

    /** Drops coaching items whose quotation cannot be found in the answer. */
    static Coaching groundCoaching(JsonNode payload, String answer) {
        String normalizedAnswer = normalizeForMatch(answer);
        List<String> strengths = grounded(JsonNodes.strings(payload, "strengths"), normalizedAnswer);
        List<String> improvements = grounded(JsonNodes.strings(payload, "improvements"), normalizedAnswer);
        return new Coaching(strengths, improvements, JsonNodes.text(payload, "feedback"));
    }

    private static List<String> grounded(List<String> items, String normalizedAnswer) {
        List<String> kept = new ArrayList<>();
        for (String item : items) {
            if (kept.size() >= MAX_COACHING_ITEMS) break;
            if (quotesAnswer(item, normalizedAnswer)) {
                kept.add(item);
            } else {
                log.debug("AnswerEvaluator: dropped ungrounded coaching item \"{}\"", item);
            }
        }
        return kept;
    }

    private static boolean quotesAnswer(String item, String normalizedAnswer) {
        Matcher m = QUOTED.matcher(item);
        while (m.find()) {
            String quote = normalizeForMatch(m.group(1) != null ? m.group(1) : m.group(2));
            if (!quote.isEmpty() && normalizedAnswer.contains(quote)) return true;
        }
        return false;
    }

    private static String normalizeForMatch(String s) {
        if (s == null) return "";
        return NON_WORD.matcher(s.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    private static String renderRubric(EvaluationContext context) {
        StringBuilder sb = new StringBuilder();
        if (!context.expectedPoints().isEmpty()) {
            sb.append("Expected points: ").append(String.join("; ", context.expectedPoints())).append('\n');
        }
        for (RubricBand band : context.rubric()) {
            sb.append(band.score()).append(": ").append(band.descriptor()).append('\n');
        }
        return sb.length() > 0 ? sb.toString().trim() : "(none)";
    }

    private static String renderScores(Draft draft) {
        List<String> parts = new ArrayList<>();
        draft.scoresMain.forEach((k, v) -> parts.add(k.key() + ": " + v + "/" + k.maxScore()));
        draft.scoresExt.forEach((k, v) -> parts.add(k.key() + ": " + v + "/" + k.maxScore()));
        return String.join(", ", parts);
    }

    private static String clipModelAnswer(String text) {
        if (text.length() <= MODEL_ANSWER_MAX_CHARS) return text;
        String head = text.substring(0, MODEL_ANSWER_MAX_CHARS);
        int cut = Math.max(head.lastIndexOf(". "), head.lastIndexOf(".\n"));
        return cut >= MODEL_ANSWER_MIN_CHARS ? head.substring(0, cut + 1) : head;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize prompt variable: " + e.getMessage(), e);
        }
    }

    private static int clamp(int v, int max) {
        return Math.max(0, Math.min(max, v));
    }

    private static int sum(Map<ScoreElement, Integer> scores) {
        return scores.values().stream().mapToInt(Integer::intValue).sum();
    }

    private static String clip(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }

    /** Mutable accumulator of one evaluation; becomes the immutable dossier. */
    private static final class Draft {
        final EvaluationContext context;
        final Map<EvaluationStage, String> errors = new EnumMap<>(EvaluationStage.class);
        final List<BiasIssue> biasIssues = new ArrayList<>();
        Intent intent = Intent.ANSWER;
        FrameworkSelection framework;
        Map<String, String> extracted = Map.of();
        Map<ScoreElement, Integer> scoresMain = Map.of();
        Map<ScoreElement, Integer> scoresExt = Map.of();
        String scoringReason = "";
        ScoreExplanation explanation;
        Coaching coaching = Coaching.empty();
        ModelAnswer modelAnswer;

        Draft(EvaluationContext context) {
            this.context = context;
        }

        Dossier toDossier() {
            return new Dossier(context.questionLabel(), context.questionType(), intent, framework, extracted,
                    scoresMain, scoresExt, scoringReason, explanation, coaching, modelAnswer, biasIssues, errors);
        }
    }
}
