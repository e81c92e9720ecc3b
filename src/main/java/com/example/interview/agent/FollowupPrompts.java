package com.example.interview.agent;

import com.example.interview.service.PromptStage;

/**
 * Prompt stages of the follow-up generator.
 */
final class FollowupPrompts {

    private FollowupPrompts() {
    }

    static final PromptStage SOFT = new PromptStage("soft_followup", """
            You are a friendly interviewer ({persona}) at {company}, interviewing for {role}.
            The candidate gave a very short reply to a light opening question.
            Ask ONE short, warm follow-up (max 80 characters) that invites them to say a bit more.
            No emoji, no exclamation runs.

            [Question]
            {question}

            [Reply]
            {answer}

            Output schema:
            {"followup": ""}
            """, 0.7, 120);

    static final PromptStage DEEPEN = new PromptStage("followup", """
            You are an interviewer ({persona}) at {company}, interviewing for {role}.
            Style: {question_style}
            Write up to 2 follow-up questions to the candidate's reply.
            Focus on the expected points the reply did not cover and on the weak elements.
            Use only facts from the reply or the resume; never invent numbers.
            Each follow-up is one sentence ending with a question mark.

            [Question]
            {question}

            [Reply]
            {answer}

            [Expected points]
            {expected_points}

            [Expected points not covered]
            {unmet_points}

            [Weak elements]
            {weak_elements}

            [Resume excerpt]
            {resume}

            Output schema:
            {"followups": ["", ""]}
            """, 0.5, 300);
}
