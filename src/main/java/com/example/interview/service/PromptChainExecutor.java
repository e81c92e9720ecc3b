package com.example.interview.service;

import com.example.interview.model.StageResult;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Runs one prompt stage: render, call, repair, and one corrective call if the output
 * is not a JSON object.
 * <p>
 * Never throws past its boundary except for {@link MissingTemplateVariableException}:
 * unparseable output becomes {@link StageResult#error}, an exhausted provider becomes
 * {@link StageResult#fatal}. Holds no state, so concurrent sessions can share it.
 */
@Service
public class PromptChainExecutor {

    private static final Logger log = LoggerFactory.getLogger(PromptChainExecutor.class);

    static final String JSON_ONLY_INSTRUCTION =
            "You must return ONLY a single valid JSON object. No markdown/code fences/commentary.";

    static final String CORRECTION_INSTRUCTION = """
            The previous output did not parse as JSON. Return ONLY a JSON object.
            Do not include code fences, markdown, or any explanation.
            Fix any missing commas or quotes.
            If a required field is missing, add it with an empty string "" or empty array [] according to the schema.""";

    private static final int MAX_ECHOED_CHARS = 4000;

    /**
     * Executes a stage.
     *
     * @param stage     template and sampling settings
     * @param variables values for every placeholder of the template
     * @param llm       model capability
     * @return parsed object or a structured error
     * @throws MissingTemplateVariableException if the template needs a variable that is not supplied
     */
    public StageResult runStage(PromptStage stage, Map<String, ?> variables, LlmClient llm) {
        String prompt = JSON_ONLY_INSTRUCTION + "\n\n"
                + PromptTemplateRenderer.render(stage.name(), stage.template(), variables);

        String raw;
        try {
            raw = llm.call(prompt, stage.temperature(), stage.maxTokens());
        } catch (LlmUnavailableException e) {
            log.error("{}: model unavailable ({})", stage.name(), e.getMessage());
            return StageResult.fatal(stage.name(), "model unavailable: " + e.getMessage());
        }

        ObjectNode parsed = JsonRepair.repair(raw);
        if (parsed != null) {
            return StageResult.ok(stage.name(), parsed);
        }

        // ── Corrective call ──────────────────────────────────────────────────
        log.warn("{}: output did not parse as JSON ({} chars), sending correction", stage.name(),
                raw != null ? raw.length() : 0);
        String correction = prompt
                + "\n\n[Previous output]\n" + truncate(raw)
                + "\n\n" + CORRECTION_INSTRUCTION;
        String corrected;
        try {
            corrected = llm.call(correction, 0.0, stage.maxTokens());
        } catch (LlmUnavailableException e) {
            log.error("{}: model unavailable during correction ({})", stage.name(), e.getMessage());
            return StageResult.fatal(stage.name(), "model unavailable: " + e.getMessage());
        }

        parsed = JsonRepair.repair(corrected);
        if (parsed != null) {
            log.info("{}: corrective call recovered a JSON object", stage.name());
            return StageResult.ok(stage.name(), parsed);
        }
        log.warn("{}: output still unparseable after correction", stage.name());
        return StageResult.error(stage.name(), "unparseable model output after correction");
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() > MAX_ECHOED_CHARS ? s.substring(0, MAX_ECHOED_CHARS) : s;
    }
}
