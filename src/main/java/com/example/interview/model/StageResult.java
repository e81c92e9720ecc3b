package com.example.interview.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Result of one prompt stage: either a parsed JSON object or an error message.
 * A fatal error means the model provider is unavailable and no further stage should run.
 *
 * @param stage   stage name
 * @param payload parsed object, {@code null} on error
 * @param error   error message, {@code null} on success
 * @param fatal   whether the provider retry budget was exhausted
 */
public record StageResult(String stage, ObjectNode payload, String error, boolean fatal) {

    public static StageResult ok(String stage, ObjectNode payload) {
        return new StageResult(stage, payload, null, false);
    }

    public static StageResult error(String stage, String error) {
        return new StageResult(stage, null, error, false);
    }

    public static StageResult fatal(String stage, String error) {
        return new StageResult(stage, null, error, true);
    }

    public boolean isError() {
        return error != null;
    }
}
