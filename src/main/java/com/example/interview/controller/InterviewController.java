package com.example.interview.controller;

import com.example.interview.agent.FollowupAgent;
import com.example.interview.model.AnswerRequest;
import com.example.interview.model.NextQuestion;
import com.example.interview.model.StartSessionRequest;
import com.example.interview.orchestrator.InterviewOrchestrator;
import com.example.interview.orchestrator.SessionNotFoundException;
import com.example.interview.service.LlmUnavailableException;
import com.example.interview.service.TokenUsageAccumulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.function.Supplier;

/**
 * REST surface of the interview engine.
 *
 * <p>Every model-backed call reports its usage in {@code X-Llm-*} response headers.
 */
@RestController
@RequestMapping("/api")
public class InterviewController {

    private static final Logger log = LoggerFactory.getLogger(InterviewController.class);

    private final InterviewOrchestrator orchestrator;
    private final FollowupAgent followupAgent;

    public InterviewController(InterviewOrchestrator orchestrator, FollowupAgent followupAgent) {
        this.orchestrator = orchestrator;
        this.followupAgent = followupAgent;
    }

    /**
     * Starts a session and returns its first question.
     *
     * <p>Endpoint: POST /api/interview/start
     */
    @PostMapping("/interview/start")
    public ResponseEntity<?> start(@RequestBody StartSessionRequest request) {
        if (request == null) {
            return badRequest("Missing request body.");
        }
        log.info("Received start request for '{}' at '{}'", request.jobTitle(), request.companyName());
        return metered(HttpStatus.CREATED,
                () -> orchestrator.startSession(request.toContext(), request.plan()));
    }

    /**
     * Evaluates the candidate's answer to the last question.
     *
     * <p>Endpoint: POST /api/interview/{id}/answer
     */
    @PostMapping("/interview/{id}/answer")
    public ResponseEntity<?> answer(@PathVariable("id") String id, @RequestBody AnswerRequest request) {
        if (request == null || isBlank(request.answer())) {
            return badRequest("Empty answer.");
        }
        return metered(HttpStatus.OK,
                () -> orchestrator.submitAnswer(id, request.question(), request.answer()));
    }

    /** Endpoint: POST /api/interview/{id}/next */
    @PostMapping("/interview/{id}/next")
    public ResponseEntity<NextQuestion> next(@PathVariable("id") String id) {
        return ResponseEntity.ok(orchestrator.nextQuestion(id));
    }

    /**
     * Finishes the session and returns the final report. Repeated calls return the same report.
     *
     * <p>Endpoint: POST /api/interview/{id}/finish
     */
    @PostMapping("/interview/{id}/finish")
    public ResponseEntity<?> finish(@PathVariable("id") String id) {
        return metered(HttpStatus.OK, () -> orchestrator.finishSession(id));
    }

    /** Endpoint: GET /api/interview/{id}/report */
    @GetMapping("/interview/{id}/report")
    public ResponseEntity<?> report(@PathVariable("id") String id) {
        return orchestrator.findReport(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "No report for session " + id)));
    }

    /** Endpoint: GET /api/health */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "interview-engine",
                "templateFallbackCount", followupAgent.templateFallbackCount()
        ));
    }

    // ── Error mapping ────────────────────────────────────────────────────────

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(SessionNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "session_not_found", e.getMessage());
    }

    @ExceptionHandler(LlmUnavailableException.class)
    public ResponseEntity<Map<String, String>> llmUnavailable(LlmUnavailableException e) {
        log.error("Model provider unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "llm_unavailable", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> invalid(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> unexpected(Exception e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private <T> ResponseEntity<T> metered(HttpStatus status, Supplier<T> call) {
        TokenUsageAccumulator usage = TokenUsageAccumulator.start();
        try {
            T body = call.get();
            log.info("LLM usage: {} calls, {} retries, {}in/{}out (tot {})", usage.getCalls(), usage.getRetries(),
                    usage.getPromptTokens(), usage.getCompletionTokens(), usage.getTotalTokens());
            return ResponseEntity.status(status).headers(usageHeaders(usage)).body(body);
        } finally {
            TokenUsageAccumulator.clear();
        }
    }

    private HttpHeaders usageHeaders(TokenUsageAccumulator usage) {
        HttpHeaders h = new HttpHeaders();
        h.set("X-Llm-Calls", String.valueOf(usage.getCalls()));
        h.set("X-Llm-Retries", String.valueOf(usage.getRetries()));
        h.set("X-Llm-Input-Tokens", String.valueOf(usage.getPromptTokens()));
        h.set("X-Llm-Output-Tokens", String.valueOf(usage.getCompletionTokens()));
        h.set("X-Llm-Total-Tokens", String.valueOf(usage.getTotalTokens()));
        return h;
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of("error", code, "message", message != null ? message : ""));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
