package com.example.interview.agent;

import com.example.interview.service.PromptStage;

/**
 * Prompt stages of the answer evaluation chain.
 */
final class EvaluationPrompts {

    private EvaluationPrompts() {
    }

    static final PromptStage INTENT = new PromptStage("intent", """
            You classify a candidate's reply in a job interview.

            [Interviewer question]
            {question}

            [Candidate reply]
            {answer}

            Categories:
            - ANSWER: an attempt to answer the question, even if weak or short
            - IRRELEVANT: talks about something unrelated to the question
            - QUESTION: the candidate asks the interviewer something (salary, team, process)
            - CLARIFICATION_REQUEST: the candidate asks to repeat or explain the question
            - CANNOT_ANSWER: the candidate says they cannot or do not want to answer

            Output schema:
            {"intent": "ANSWER", "reason": "one sentence"}
            """, 0.0, 200);

    static final PromptStage FRAMEWORK = new PromptStage("framework", """
            You identify which answer framework a candidate's reply follows.
            Decide from explicit textual evidence only, never from keyword guessing.

            Frameworks:
            - STAR: situation, task, action, result of one concrete past episode
            - COMPETENCY: a competency, the behavior that shows it, its impact
            - CASE: problem definition, structure (MECE), analysis, recommendation
            - SYSTEMDESIGN: requirements, trade-offs, architecture, risks
            Extension flags, only when the reply contains them explicitly:
            - C: a challenge or obstacle that was overcome
            - L: a lesson learned and how it was applied later
            - M: quantified metrics (numbers with baseline or period)

            [Question]
            {question}

            [Reply]
            {answer}

            Output schema (base first, flags joined by '+'):
            {"frameworks": ["STAR+C+M"], "evidence": "short quote that justifies the choice"}
            """, 0.0, 300);

    static final PromptStage EXTRACTION = new PromptStage("extraction", """
            Summarize the candidate's reply by the components of the {framework} framework.

            Allowed keys, exactly: {component_keys}
            Rules:
            - Use only the allowed keys. Do not add other keys.
            - Summarize only what the reply actually says, in one or two sentences per key.
            - If the reply has nothing for a key, use "" (empty string). Never invent content.

            [Question]
            {question}

            [Reply]
            {answer}

            Output schema:
            {"framework": "STAR", "extracted": {"situation": "", "task": ""}}
            """, 0.1, 800);

    static final PromptStage SCORING = new PromptStage("scoring", """
            You are an interviewer ({persona}). Evaluation focus: {evaluation_focus}.
            Score the candidate's reply with the {framework} framework.

            Base elements, 0-20 each: {component_keys}
            Extension elements, 0-10 each: {extension_keys}
            An element with no supporting content in the reply scores 0.

            [Competency context]
            {competency_context}

            [Question rubric]
            {rubric}

            [Component summary]
            {extracted}

            [Question]
            {question}

            [Reply]
            {answer}

            Output schema:
            {"framework": "STAR", "scores_main": {"situation": 0}, "scores_ext": {"metrics": 0}, "scoring_reason": "2-4 sentences"}
            """, 0.0, 700);

    static final PromptStage SCORE_EXPLANATION = new PromptStage("score_explanation", """
            Explain each score of a candidate's interview reply.

            Framework: {framework}
            Scores (element: given/max): {scores}
            Scorer rationale: {scoring_reason}

            [Reply]
            {answer}

            For every element: why it is not at the maximum, and 1-3 concrete actions to close the gap.

            Output schema:
            {"calibration": [{"element": "situation", "given": 12, "max": 20, "why_not_max": "", "how_to_improve": [""]}], "overall_tip": ""}
            """, 0.3, 1200);

    static final PromptStage COACHING = new PromptStage("coaching", """
            You coach a candidate as an interviewer ({persona}).

            [Question]
            {question}

            [Reply]
            {answer}

            [Scorer rationale]
            {scoring_reason}

            Give 3-5 strengths and 3-5 improvements.
            Every item must quote a specific phrase of the reply in double quotes, e.g.
            "I cut the build time" shows ownership of a measurable result.
            Then a short overall feedback paragraph.

            Output schema:
            {"strengths": [""], "improvements": [""], "feedback": ""}
            """, 0.4, 1000);

    static final PromptStage MODEL_ANSWER = new PromptStage("model_answer", """
            Write an improved model answer to the interview question below, for the role
            {role} at {company}. Keep the candidate's own experience; do not invent employers.
            Length: 400-800 characters. Pick the framework that fits the question best.

            [Question]
            {question}

            [Candidate reply]
            {answer}

            [Resume excerpt]
            {resume}

            Output schema:
            {"model_answer": "", "model_answer_framework": "STAR", "selection_reason": "one sentence"}
            """, 0.6, 900);

    static final PromptStage BIAS_FILTER = new PromptStage("bias_filter", """
            Review the interview feedback text below for biased, discriminatory or
            sensitive-attribute content (gender, age, origin, religion, disability, family status,
            appearance). If any is found, rewrite the text without it and keep everything else.

            [Text]
            {text}

            Output schema:
            {"flagged": false, "issues": [{"span": "", "category": "", "reason": "", "suggested_fix": "", "severity": "low"}], "sanitized_text": ""}
            """, 0.0, 1200);
}
