package com.example.interview.orchestrator;

import com.example.interview.model.Intent;
import com.example.interview.model.InterviewPhase;
import com.example.interview.model.InterviewPlan;
import com.example.interview.model.NextQuestion;
import com.example.interview.model.PlanItem;
import com.example.interview.model.PlanPhase;
import com.example.interview.model.QuestionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InterviewFlowControllerTest {

    private InterviewFlowController flow;

    @BeforeEach
    void setUp() {
        flow = new InterviewFlowController(samplePlan());
    }

    static InterviewPlan samplePlan() {
        return new InterviewPlan(List.of(
                new PlanPhase("intro", List.of(
                        PlanItem.of("intro-1", QuestionType.ICEBREAKING, "How was your trip here?"),
                        PlanItem.of("intro-2", QuestionType.SELF_INTRO, "Please introduce yourself."))),
                new PlanPhase("core", List.of(
                        PlanItem.of("core-1", QuestionType.STAR, "Thanks. Tell me about a project you led. What was the outcome?"),
                        PlanItem.of("core-2", QuestionType.CASE, "How would you grow usage of our app?"),
                        PlanItem.of("core-3", QuestionType.SYSTEM, "Design a URL shortener."))),
                new PlanPhase("wrapup", List.of(
                        PlanItem.of("wrapup-1", QuestionType.WRAPUP, "Anything you want to ask us?")))));
    }

    @Nested
    @DisplayName("main question sequence")
    class Sequence {

        @Test
        @DisplayName("a 2+3+1 plan yields six labels in order, then done")
        void sixLabelsThenDone() {
            List<String> labels = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                NextQuestion q = flow.nextQuestion();
                assertThat(q.done()).isFalse();
                assertThat(q.followup()).isFalse();
                labels.add(q.label());
            }

            assertThat(labels).containsExactly("1", "2", "3", "4", "5", "6");
            assertThat(flow.nextQuestion().done()).isTrue();
            assertThat(flow.isFinished()).isTrue();
            assertThat(flow.state().getPhase()).isEqualTo(InterviewPhase.FINISHED);
        }

        @Test
        void phaseFollowsCursor() {
            flow.nextQuestion();
            assertThat(flow.state().getPhase()).isEqualTo(InterviewPhase.INTRO);
            flow.nextQuestion();
            NextQuestion third = flow.nextQuestion();

            assertThat(third.type()).isEqualTo(QuestionType.STAR);
            assertThat(flow.state().getPhase()).isEqualTo(InterviewPhase.CORE);
            assertThat(flow.state().getPhaseIndex()).isEqualTo(1);
            assertThat(flow.state().getQuestionIndex()).isZero();
            assertThat(flow.state().getLastMainQuestionId()).isEqualTo("core-1");
        }

        @Test
        void emptyPhasesAreSkipped() {
            InterviewFlowController sparse = new InterviewFlowController(new InterviewPlan(List.of(
                    new PlanPhase("intro", List.of()),
                    new PlanPhase("core", List.of(PlanItem.of("core-1", QuestionType.STAR, "Q1?"))),
                    new PlanPhase("wrapup", List.of()))));

            assertThat(sparse.nextQuestion().label()).isEqualTo("1");
            assertThat(sparse.nextQuestion().done()).isTrue();
        }

        @Test
        void peekDoesNotMoveTheCursor() {
            flow.nextQuestion();

            assertThat(flow.peekNextQuestion()).contains("Please introduce yourself.");
            assertThat(flow.peekNextQuestion()).contains("Please introduce yourself.");
            assertThat(flow.nextQuestion().label()).isEqualTo("2");
        }
    }

    @Nested
    @DisplayName("follow-ups")
    class Followups {

        @Test
        @DisplayName("queued follow-ups are served as <main>-1, <main>-2 before the next main question")
        void bufferedBeforeNextMain() {
            flow.nextQuestion();
            flow.nextQuestion();

            AnswerTransition t = flow.onAnswer(Intent.ANSWER, List.of("What did you build?", "Which team was it?"));

            assertThat(t.enqueued()).hasSize(2);
            assertThat(flow.nextIsMain()).isFalse();
            NextQuestion f1 = flow.nextQuestion();
            NextQuestion f2 = flow.nextQuestion();
            NextQuestion main = flow.nextQuestion();

            assertThat(f1.label()).isEqualTo("2-1");
            assertThat(f1.followup()).isTrue();
            assertThat(f1.question()).isEqualTo("What did you build?");
            assertThat(f1.type()).isEqualTo(QuestionType.SELF_INTRO);
            assertThat(f2.label()).isEqualTo("2-2");
            assertThat(main.label()).isEqualTo("3");
            assertThat(flow.state().getFollowupIndex()).isZero();
        }

        @Test
        void answerNeverMovesTheMainCursor() {
            flow.nextQuestion();
            flow.nextQuestion();
            flow.nextQuestion();

            flow.onAnswer(Intent.ANSWER, List.of("Why?"));

            assertThat(flow.state().getQuestionIndex()).isZero();
            assertThat(flow.state().getPhaseIndex()).isEqualTo(1);
        }

        @Test
        void queueIsCappedPerMainQuestion() {
            flow.nextQuestion();
            AnswerTransition first = flow.onAnswer(Intent.ANSWER, List.of("a?", "b?"));
            flow.nextQuestion();
            AnswerTransition second = flow.onAnswer(Intent.ANSWER, List.of("c?", "d?"));

            assertThat(first.enqueued()).containsExactly("a?", "b?");
            assertThat(second.enqueued()).containsExactly("c?");
            assertThat(flow.state().getPendingFollowups()).containsExactly("b?", "c?");
        }

        @Test
        void blankFollowupsAreIgnored() {
            flow.nextQuestion();

            assertThat(flow.onAnswer(Intent.ANSWER, List.of(" ", "Really?")).enqueued()).containsExactly("Really?");
        }
    }

    @Nested
    @DisplayName("non-answers")
    class NonAnswers {

        @Test
        @DisplayName("a clarification request keeps the cursor and rephrases the last question")
        void clarificationRequest() {
            flow.nextQuestion();
            flow.nextQuestion();
            flow.nextQuestion();

            AnswerTransition t = flow.onAnswer(Intent.CLARIFICATION_REQUEST, List.of("ignored?"));

            assertThat(t.recoveryPrompt())
                    .startsWith("Let me rephrase")
                    .endsWith("What was the outcome?")
                    .doesNotContain("Thanks.");
            assertThat(t.enqueued()).isEmpty();
            assertThat(flow.state().getLastQuestionLabel()).isEqualTo("3");
            assertThat(flow.state().getQuestionIndex()).isZero();
            assertThat(flow.nextQuestion().label()).isEqualTo("4");
        }

        @Test
        void eachIntentHasItsOwnPrompt() {
            flow.nextQuestion();

            String irrelevant = flow.onAnswer(Intent.IRRELEVANT, List.of()).recoveryPrompt();
            String question = flow.onAnswer(Intent.QUESTION, List.of()).recoveryPrompt();
            String cannot = flow.onAnswer(Intent.CANNOT_ANSWER, List.of()).recoveryPrompt();

            assertThat(irrelevant).contains("off the topic").endsWith("How was your trip here?");
            assertThat(question).contains("for the end of the interview");
            assertThat(cannot).contains("move on");
        }

        @Test
        void unknownIntentIsTreatedAsAnAnswer() {
            flow.nextQuestion();

            AnswerTransition t = flow.onAnswer(Intent.UNKNOWN, List.of("More?"));

            assertThat(t.recoveryPrompt()).isNull();
            assertThat(t.enqueued()).containsExactly("More?");
        }
    }

    @Nested
    @DisplayName("finished session")
    class Finished {

        @Test
        void misuseReturnsDoneResults() {
            flow.nextQuestion();
            flow.onAnswer(Intent.ANSWER, List.of("Pending?"));
            flow.finish();

            assertThat(flow.nextQuestion().done()).isTrue();
            assertThat(flow.onAnswer(Intent.ANSWER, List.of("x?")).done()).isTrue();
            assertThat(flow.peekNextQuestion()).isEmpty();
            assertThat(flow.state().getPendingFollowups()).isEmpty();
        }
    }
}
