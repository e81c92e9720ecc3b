package com.example.interview.service;

import com.example.interview.model.Coaching;
import com.example.interview.model.Dossier;
import com.example.interview.model.EvidenceTheme;
import com.example.interview.model.Intent;
import com.example.interview.model.QuestionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EvidenceMatrixBuilderTest {

    static Dossier coached(String label, List<String> strengths, List<String> improvements) {
        return new Dossier(label, QuestionType.STAR, Intent.ANSWER, null, null, null, null, null, null,
                new Coaching(strengths, improvements, ""), null, null, null);
    }

    @Nested
    @DisplayName("keyword theme classifier")
    class Classifier {

        private final KeywordThemeClassifier classifier = new KeywordThemeClassifier();

        @Test
        void firstMatchingThemeWins() {
            assertThat(classifier.themeOf("Clear ownership of the migration decision")).isEqualTo("Ownership");
            assertThat(classifier.themeOf("No measurable outcome was given")).isEqualTo("Quantified results");
            assertThat(classifier.themeOf("\"I worked with them\" shows collaboration")).isEqualTo("Collaboration");
        }

        @Test
        void quotedAnswerFragmentsDoNotDecideTheTheme() {
            assertThat(classifier.themeOf("\"we measured latency\" is a good start")).isEqualTo("Is a good start");
        }

        @Test
        void sentencesWithoutWordsAreGeneral() {
            assertThat(classifier.themeOf("  ")).isEqualTo("General");
            assertThat(classifier.themeOf("!!!")).isEqualTo("General");
            assertThat(classifier.themeOf(null)).isEqualTo("General");
        }
    }

    @Nested
    @DisplayName("matrix")
    class Matrix {

        private final EvidenceMatrixBuilder builder = new EvidenceMatrixBuilder(s -> s.split(":")[0]);

        @Test
        void groupsLabelsByThemeAndOrdersByEvidenceCount() {
            List<Dossier> dossiers = List.of(
                    coached("3", List.of("Ownership: led the rollout", "Metrics: 40% faster"), List.of()),
                    coached("4", List.of("Metrics: cut cost by 10k", "Metrics: second figure"), List.of()),
                    coached("5", List.of("Collaboration: aligned two teams", "Metrics: weekly active users"), List.of()));

            List<EvidenceTheme> strengths = builder.strengths(dossiers);

            assertThat(strengths).extracting(EvidenceTheme::theme)
                    .containsExactly("Metrics", "Collaboration", "Ownership");
            assertThat(strengths.get(0).evidence()).containsExactly("3", "4", "5");
            assertThat(strengths.get(0).examples()).hasSize(3);
        }

        @Test
        void weaknessesUseImprovements() {
            List<Dossier> dossiers = List.of(coached("2-1", List.of("A: x"), List.of("Specificity: no example")));

            assertThat(builder.weaknesses(dossiers))
                    .singleElement()
                    .satisfies(t -> {
                        assertThat(t.theme()).isEqualTo("Specificity");
                        assertThat(t.evidence()).containsExactly("2-1");
                    });
        }

        @Test
        void dossiersWithoutCoachingContributeNothing() {
            assertThat(builder.strengths(List.of(Dossier.intentOnly("1", QuestionType.ICEBREAKING, Intent.ANSWER, null))))
                    .isEmpty();
        }
    }
}
