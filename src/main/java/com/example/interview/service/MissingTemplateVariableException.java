package com.example.interview.service;

/**
 * A prompt template references a variable the caller did not supply.
 * Signals drift between a stage template and its caller; never caught by the engine.
 */
public class MissingTemplateVariableException extends IllegalStateException {

    private final String stage;
    private final String variable;

    public MissingTemplateVariableException(String stage, String variable) {
        super("Prompt stage '" + stage + "' references undefined variable {" + variable + "}");
        this.stage = stage;
        this.variable = variable;
    }

    public String getStage() {
        return stage;
    }

    public String getVariable() {
        return variable;
    }
}
