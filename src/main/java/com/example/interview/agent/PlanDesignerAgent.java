package com.example.interview.agent;

import com.example.interview.config.InterviewProperties;
import com.example.interview.model.InterviewContext;
import com.example.interview.model.InterviewPhase;
import com.example.interview.model.InterviewPlan;
import com.example.interview.model.PlanItem;
import com.example.interview.model.PlanPhase;
import com.example.interview.model.QuestionType;
import com.example.interview.model.RubricBand;
import com.example.interview.model.StageResult;
import com.example.interview.service.JsonNodes;
import com.example.interview.service.LlmClient;
import com.example.interview.service.LlmUnavailableException;
import com.example.interview.service.PromptChainExecutor;
import com.example.interview.service.PromptStage;
import com.example.interview.service.PromptTemplateRenderer;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Designs the question plan of a new session from the job posting and the resume.
 * <p>
 * Generated plans are normalized: phases ordered intro, core, wrapup; unknown phase names
 * go to core; duplicate questions dropped; at most {@code maxMains} items. A plan without
 * core questions is replaced by the built-in plan. An unavailable model is a hard failure.
 */
@Service
public class PlanDesignerAgent {

    private static final Logger log = LoggerFactory.getLogger(PlanDesignerAgent.class);

    static final PromptStage DESIGN = new PromptStage("plan_design", """
            You design a structured job interview as an interviewer ({persona}) at {company}.
            Role: {role}. Difficulty: {difficulty}. Language of the questions: {language}.
            Question style: {question_style}

            [Job description]
            {job_description}

            [Resume]
            {resume}

            [Competencies to cover]
            {competencies}

            Phases, in order:
            - intro: one icebreaking, one self_intro and one motivation question
            - core: {core_count} questions of type star, competency, case, system or hard,
              each tied to a concrete resume item or a requirement of the job description
            - wrapup: one closing question

            For every question give 2-4 expected points and a rubric of bands 1-5.

            Output schema:
            {"phases": [{"phase": "intro", "items": [{"type": "icebreaking", "question": "", "expected_points": [""], "rubric": [{"score": 5, "descriptor": ""}]}]}]}
            """, 0.5, 2500);

    private final PromptChainExecutor executor;
    private final LlmClient llm;
    private final InterviewProperties.Plan guards;

    public PlanDesignerAgent(PromptChainExecutor executor,
                             @Qualifier("evaluationLlmClient") LlmClient llm,
                             InterviewProperties properties) {
        this.executor = executor;
        this.llm = llm;
        this.guards = properties.plan();
    }

    /**
     * Designs a plan for the session.
     *
     * @throws LlmUnavailableException when the model provider is exhausted
     */
    public InterviewPlan design(InterviewContext context, List<String> competencyHints) {
        StageResult r = executor.runStage(DESIGN, Map.of(
                "persona", context.persona().description(),
                "question_style", context.persona().questionStyle(),
                "company", context.companyName(),
                "role", context.jobTitle(),
                "difficulty", context.difficulty(),
                "language", context.language(),
                "job_description", context.jobDescription().isEmpty() ? "(not provided)" : context.jobDescription(),
                "resume", context.resume().isEmpty() ? "(not provided)" : context.resume(),
                "competencies", competencyHints.isEmpty() ? "(none)" : String.join("\n", competencyHints),
                "core_count", coreCount(context.difficulty())), llm);

        if (r.fatal()) {
            throw new LlmUnavailableException("Plan design failed: " + r.error(), null);
        }
        if (!r.isError()) {
            InterviewPlan plan = normalize(r.payload());
            int core = plan.phases().stream()
                    .filter(p -> p.state() == InterviewPhase.CORE)
                    .mapToInt(p -> p.items().size())
                    .sum();
            if (core > 0) {
                log.info("PlanDesignerAgent: plan with {} questions ({} core)", plan.totalItems(), core);
                return plan;
            }
            log.warn("PlanDesignerAgent: generated plan has no core questions, using built-in plan");
        } else {
            log.warn("PlanDesignerAgent: plan generation failed ({}), using built-in plan", r.error());
        }
        return fallbackPlan(context);
    }

    /** Orders phases, maps tags, drops duplicates and applies the item cap. */
    InterviewPlan normalize(JsonNode payload) {
        Map<InterviewPhase, List<PlanItem>> byPhase = new EnumMap<>(InterviewPhase.class);
        Set<String> seen = new HashSet<>();
        int total = 0;
        JsonNode phases = payload.get("phases");
        if (phases != null && phases.isArray()) {
            for (JsonNode phase : phases) {
                InterviewPhase state = InterviewPhase.fromPhaseName(JsonNodes.text(phase, "phase"));
                JsonNode items = phase.get("items");
                if (items == null || !items.isArray()) continue;
                for (JsonNode item : items) {
                    String question = JsonNodes.text(item, "question");
                    String key = question.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
                    if (question.isEmpty() || !seen.add(key)) continue;
                    if (total >= guards.maxMains()) break;
                    List<PlanItem> list = byPhase.computeIfAbsent(state, k -> new ArrayList<>());
                    list.add(new PlanItem(
                            phaseName(state) + "-" + (list.size() + 1),
                            QuestionType.fromTag(JsonNodes.text(item, "type")),
                            question,
                            JsonNodes.strings(item, "expected_points"),
                            rubric(item.get("rubric"))));
                    total++;
                }
            }
        }
        List<PlanPhase> ordered = new ArrayList<>();
        for (InterviewPhase state : List.of(InterviewPhase.INTRO, InterviewPhase.CORE, InterviewPhase.WRAPUP)) {
            List<PlanItem> items = byPhase.get(state);
            if (items != null && !items.isEmpty()) ordered.add(new PlanPhase(phaseName(state), items));
        }
        return new InterviewPlan(ordered);
    }

    /** Built-in plan used when generation fails. */
    InterviewPlan fallbackPlan(InterviewContext context) {
        Map<String, String> vars = Map.of("company", context.companyName(), "role", context.jobTitle());
        List<PlanItem> intro = List.of(
                item("intro-1", QuestionType.ICEBREAKING, "Thank you for coming today. How are you feeling right now?",
                        List.of("natural tone"), vars),
                item("intro-2", QuestionType.SELF_INTRO, "Please introduce yourself briefly, focusing on what matters for {role}.",
                        List.of("relevant experience", "key strength"), vars),
                item("intro-3", QuestionType.MOTIVATION, "Why do you want to join {company} as {role}?",
                        List.of("knowledge of {company}", "fit with the role"), vars));
        List<PlanItem> core = new ArrayList<>(List.of(
                item("core-1", QuestionType.STAR, "Tell me about a project where you solved a difficult problem. What was your role and the result?",
                        List.of("situation and task", "own actions", "measurable result"), vars),
                item("core-2", QuestionType.COMPETENCY, "Describe a time you had to work with a colleague who disagreed with you. How did you handle it?",
                        List.of("behavior", "impact on the team"), vars),
                item("core-3", QuestionType.CASE, "If {company} wanted to double the usage of one of its services within a year, how would you approach it?",
                        List.of("problem definition", "structured options", "recommendation"), vars)));
        if (coreCount(context.difficulty()) > 3) {
            core.add(item("core-4", QuestionType.HARD, "Which decision from your past work would you make differently today, and why?",
                    List.of("honest reflection", "lesson applied"), vars));
        }
        List<PlanItem> wrapup = List.of(
                item("wrapup-1", QuestionType.WRAPUP, "Is there anything you would like to add or ask us?", List.of(), vars));
        return new InterviewPlan(List.of(
                new PlanPhase("intro", intro),
                new PlanPhase("core", core),
                new PlanPhase("wrapup", wrapup)));
    }

    private static PlanItem item(String id, QuestionType type, String question, List<String> points,
                                 Map<String, String> vars) {
        return new PlanItem(id, type,
                PromptTemplateRenderer.render("fallback_plan", question, vars),
                points.stream().map(p -> PromptTemplateRenderer.render("fallback_plan", p, vars)).toList(),
                List.of());
    }

    private static List<RubricBand> rubric(JsonNode node) {
        List<RubricBand> bands = new ArrayList<>();
        if (node == null || !node.isArray()) return bands;
        for (JsonNode band : node) {
            bands.add(new RubricBand(JsonNodes.intValue(band.get("score"), 0), JsonNodes.text(band, "descriptor")));
        }
        return bands;
    }

    private static String phaseName(InterviewPhase state) {
        return state.name().toLowerCase(Locale.ROOT);
    }

    private static int coreCount(String difficulty) {
        return switch (difficulty.toLowerCase(Locale.ROOT)) {
            case "easy" -> 3;
            case "hard" -> 5;
            default -> 4;
        };
    }
}
