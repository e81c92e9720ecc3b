package com.example.interview.orchestrator;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Unknown interview session: " + sessionId);
    }
}
