package com.example.interview.agent;

import com.example.interview.config.InterviewProperties;
import com.example.interview.model.Dossier;
import com.example.interview.model.EvaluationContext;
import com.example.interview.model.FollowupDecision;
import com.example.interview.model.InterviewContext;
import com.example.interview.model.QuestionType;
import com.example.interview.model.ScoreElement;
import com.example.interview.model.StageResult;
import com.example.interview.service.JsonNodes;
import com.example.interview.service.LlmClient;
import com.example.interview.service.PromptChainExecutor;
import com.example.interview.service.PromptTemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether an answer needs follow-up questions and writes them.
 * <p>
 * Light opening questions get at most one soft follow-up when the reply is too short.
 * Substantive questions are pressed further when the answer asserts confidence without an example
 * (an evidence request goes first) or when the dossier shows a rubric gap. Model output is
 * preferred; the fixed template pool is the fallback and its use is flagged and counted.
 */
@Service
public class FollowupAgent {

    private static final Logger log = LoggerFactory.getLogger(FollowupAgent.class);

    private static final int SOFT_MAX_PER_TURN = 1;
    private static final int SOFT_MAX_CHARS = 80;
    private static final int RESUME_EXCERPT_CHARS = 1500;

    private static final Pattern EXCLAMATION_RUN = Pattern.compile("[!?]{3,}");
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:[.,]\\d+)?%?");

    private static final Pattern CONFIDENCE = Pattern.compile(
            "\\bi(?:'m| am) (?:very |really |absolutely )?(?:confident|sure|certain|the best|perfect for)"
                    + "|\\bi can do (?:anything|it all|everything)"
                    + "|\\bi(?:'ll| will) (?:definitely|surely|certainly)"
                    + "|\\b(?:best|perfect) fit\\b|\\bpassion(?:ate)?\\b|\\bnever fail"
                    + "|자신(?:있|감)|잘할 수 있|누구보다|최고의|열정",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern CONCRETE = Pattern.compile(
            "\\d|\\bfor (?:example|instance)\\b|\\bwhen i\\b|\\bat my (?:last|previous)\\b|\\bproject\\b"
                    + "|\\bi (?:led|built|shipped|reduced|increased|designed|launched)\\b"
                    + "|예를 들어|프로젝트|당시|경험",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private final PromptChainExecutor executor;
    private final LlmClient llm;
    private final InterviewProperties.Followup settings;
    private final Random random;
    private final AtomicLong templateFallbacks = new AtomicLong();

    @Autowired
    public FollowupAgent(PromptChainExecutor executor,
                         @Qualifier("evaluationLlmClient") LlmClient llm,
                         InterviewProperties properties) {
        this(executor, llm, properties, new Random());
    }

    FollowupAgent(PromptChainExecutor executor, LlmClient llm, InterviewProperties properties, Random random) {
        this.executor = executor;
        this.llm = llm;
        this.settings = properties.followup();
        this.random = random;
    }

    /**
     * Decides the follow-ups for one answer.
     *
     * @param turnType type of the answered question
     * @param question the question that was answered
     * @param answer   candidate reply
     * @param dossier  evaluation of the reply, may be {@code null} for light questions
     * @param context  expected points and session context
     * @return 0-2 follow-ups, in asking order
     */
    public FollowupDecision decide(QuestionType turnType, String question, String answer,
                                   Dossier dossier, EvaluationContext context) {
        String reply = answer != null ? answer.strip() : "";
        if (dossier != null && !dossier.intent().isEvaluated()) {
            return FollowupDecision.none("not an answer");
        }
        if (turnType.isLightweight()) {
            return decideSoft(turnType, question, reply, context.interview());
        }
        if (turnType == QuestionType.WRAPUP || turnType == QuestionType.UNKNOWN) {
            return FollowupDecision.none("no follow-ups for " + turnType.tag());
        }
        return decideSubstantive(question, reply, dossier, context);
    }

    /** Bridge sentence before main question {@code ordinal}. */
    public String transitionPhrase(int ordinal) {
        List<String> pool = FollowupTemplates.TRANSITIONS;
        return pool.get(Math.floorMod(ordinal, pool.size()));
    }

    /** Number of decisions that used the template pool since startup. */
    public long templateFallbackCount() {
        return templateFallbacks.get();
    }

    // ── Light questions ──────────────────────────────────────────────────────

    private FollowupDecision decideSoft(QuestionType type, String question, String reply, InterviewContext interview) {
        int min = switch (type) {
            case ICEBREAKING -> settings.icebreakingMinChars();
            case SELF_INTRO -> settings.selfIntroMinChars();
            default -> settings.motivationMinChars();
        };
        if (reply.length() >= min) {
            return FollowupDecision.none("reply long enough (" + reply.length() + " >= " + min + ")");
        }

        StageResult r = executor.runStage(FollowupPrompts.SOFT, Map.of(
                "persona", interview.persona().description(),
                "company", interview.companyName(),
                "role", interview.jobTitle(),
                "question", question != null ? question : "",
                "answer", reply), llm);
        if (!r.isError()) {
            String candidate = JsonNodes.text(r.payload(), "followup");
            if (isAcceptable(candidate, SOFT_MAX_CHARS)) {
                return new FollowupDecision(List.of(FollowupTemplates.ensureQuestionMark(candidate)), false,
                        "short " + type.tag() + " reply");
            }
        }
        return fallback(FollowupTemplates.softPool(type), SOFT_MAX_PER_TURN, interview, List.of(),
                "short " + type.tag() + " reply");
    }

    // ── Substantive questions ────────────────────────────────────────────────

    private FollowupDecision decideSubstantive(String question, String reply, Dossier dossier, EvaluationContext context) {
        InterviewContext interview = context.interview();
        List<String> chosen = new ArrayList<>();

        boolean assertion = isUnsupportedAssertion(reply);
        if (assertion) {
            chosen.add(pickTemplates(FollowupTemplates.EVIDENCE, 1, interview).get(0));
        }
        List<String> weak = weakElements(dossier);
        List<String> unmet = unmetPoints(context.expectedPoints(), reply);
        boolean gap = dossier == null || !dossier.hasScores() || !weak.isEmpty() || !unmet.isEmpty();
        if (!assertion && !gap) {
            return FollowupDecision.none("no rubric gap");
        }
        String reason = assertion ? "unsupported assertion" : "rubric gap " + weak + (unmet.isEmpty() ? "" : " unmet " + unmet);

        if (reply.length() < settings.sparseAnswerChars()) {
            log.warn("FollowupAgent: reply too sparse ({} chars), using template pool", reply.length());
            return fallback(FollowupTemplates.SUBSTANTIVE, settings.maxPerTurn(), interview, chosen, reason);
        }

        StageResult r = executor.runStage(FollowupPrompts.DEEPEN, Map.of(
                "persona", interview.persona().description(),
                "question_style", interview.persona().questionStyle(),
                "company", interview.companyName(),
                "role", interview.jobTitle(),
                "question", question != null ? question : "",
                "answer", reply,
                "expected_points", context.expectedPoints().isEmpty() ? "(none)" : String.join("; ", context.expectedPoints()),
                "unmet_points", unmet.isEmpty() ? "(none)" : String.join("; ", unmet),
                "weak_elements", weak.isEmpty() ? "(scores unavailable)" : String.join(", ", weak),
                "resume", clip(interview.resume())), llm);

        List<String> generated = new ArrayList<>();
        if (!r.isError()) {
            String sourceText = interview.resume() + "\n" + reply;
            for (String f : JsonNodes.strings(r.payload(), "followups")) {
                if (isAcceptable(f, settings.maxLlmFollowupChars())) {
                    generated.add(FollowupTemplates.ensureQuestionMark(sanitizeAgainstSource(f, sourceText)));
                }
            }
        }
        if (generated.isEmpty()) {
            return fallback(FollowupTemplates.SUBSTANTIVE, settings.maxPerTurn(), interview, chosen, reason);
        }
        return new FollowupDecision(merge(chosen, generated, settings.maxPerTurn()), false, reason);
    }

    private FollowupDecision fallback(List<String> pool, int limit, InterviewContext interview,
                                      List<String> leading, String reason) {
        long total = templateFallbacks.incrementAndGet();
        log.warn("FollowupAgent: template fallback used ({}; {} since startup)", reason, total);
        List<String> templates = pickTemplates(pool, limit, interview);
        return new FollowupDecision(merge(leading, templates, limit), true, reason);
    }

    private List<String> pickTemplates(List<String> pool, int n, InterviewContext interview) {
        List<String> shuffled = new ArrayList<>(pool);
        Collections.shuffle(shuffled, random);
        Map<String, String> vars = Map.of("company", interview.companyName(), "role", interview.jobTitle());
        return shuffled.stream()
                .limit(n)
                .map(t -> FollowupTemplates.ensureQuestionMark(PromptTemplateRenderer.render("followup_template", t, vars)))
                .toList();
    }

    private static List<String> merge(List<String> leading, List<String> rest, int limit) {
        Set<String> out = new LinkedHashSet<>();
        for (String s : leading) {
            if (out.size() < limit && !s.isBlank()) out.add(s.strip());
        }
        for (String s : rest) {
            if (out.size() < limit && !s.isBlank()) out.add(s.strip());
        }
        return List.copyOf(out);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // Signals
    // ═══════════════════════════════════════════════════════════════════════════

    /** Confidence or ambition claimed without any concrete example. */
    static boolean isUnsupportedAssertion(String reply) {
        return CONFIDENCE.matcher(reply).find() && !CONCRETE.matcher(reply).find();
    }

    /** Base elements below the gap ratio of their maximum, plus metrics when absent or low. */
    List<String> weakElements(Dossier dossier) {
        List<String> weak = new ArrayList<>();
        if (dossier == null || !dossier.hasScores()) return weak;
        double ratio = settings.gapRatio();
        dossier.scoresMain().forEach((element, score) -> {
            if (score < ratio * element.maxScore()) weak.add(element.key());
        });
        Integer metrics = dossier.scoresExt().get(ScoreElement.METRICS);
        if (metrics == null || metrics < ratio * ScoreElement.MAX_EXT) {
            weak.add(ScoreElement.METRICS.key());
        }
        return weak;
    }

    /** Expected points none of whose words (4+ letters) occur in the reply. */
    static List<String> unmetPoints(List<String> expectedPoints, String reply) {
        String text = reply.toLowerCase(Locale.ROOT);
        List<String> unmet = new ArrayList<>();
        for (String point : expectedPoints) {
            boolean covered = Arrays.stream(point.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                    .filter(w -> w.length() >= 4)
                    .anyMatch(text::contains);
            if (!covered) unmet.add(point);
        }
        return unmet;
    }

    static boolean isAcceptable(String followup, int maxChars) {
        if (followup == null) return false;
        String s = followup.strip();
        return !s.isEmpty()
                && s.length() <= maxChars
                && !EXCLAMATION_RUN.matcher(s).find()
                && s.codePoints().noneMatch(FollowupAgent::isEmoji);
    }

    private static boolean isEmoji(int cp) {
        return (cp >= 0x1F300 && cp <= 0x1FAFF) || (cp >= 0x2600 && cp <= 0x27BF) || (cp >= 0x1F000 && cp <= 0x1F2FF);
    }

    /** Masks numbers that appear neither in the resume nor in the reply. */
    static String sanitizeAgainstSource(String followup, String sourceText) {
        Matcher m = NUMBER.matcher(followup);
        StringBuilder sb = new StringBuilder();
        boolean changed = false;
        while (m.find()) {
            if (sourceText.contains(m.group())) {
                m.appendReplacement(sb, Matcher.quoteReplacement(m.group()));
            } else {
                m.appendReplacement(sb, "a specific figure");
                changed = true;
            }
        }
        m.appendTail(sb);
        if (changed) {
            log.info("FollowupAgent: masked unsupported numbers: before={} after={}", followup, sb);
        }
        return sb.toString();
    }

    private static String clip(String s) {
        return s.length() > RESUME_EXCERPT_CHARS ? s.substring(0, RESUME_EXCERPT_CHARS) : s;
    }
}
