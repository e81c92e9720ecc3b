package com.example.interview.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreTableTest {

    @Nested
    @DisplayName("score element lookup")
    class ElementLookup {

        @ParameterizedTest
        @EnumSource(Framework.class)
        void everyDeclaredKeyOfEveryFrameworkResolves(Framework framework) {
            for (ScoreElement element : framework.elements()) {
                assertThat(ScoreElement.lookup(element.key())).contains(element);
                assertThat(ScoreElement.lookup(element.key().toUpperCase())).contains(element);
                assertThat(element.isExtension()).isFalse();
            }
        }

        @ParameterizedTest
        @EnumSource(ScoreElement.class)
        void everyAliasResolvesToItsElement(ScoreElement element) {
            for (String alias : element.aliases()) {
                assertThat(ScoreElement.lookup(alias)).as(alias).contains(element);
            }
        }

        @ParameterizedTest
        @CsvSource({
                "s, SITUATION",
                "T, TASK",
                "' r ', RESULT",
                "stucture, STRUCTURE",
                "tradeoffs, TRADE_OFFS",
                "trade offs, TRADE_OFFS",
                "c, CHALLENGE",
                "l, LEARNING",
                "m, METRICS"
        })
        void abbreviationsAndTypos(String raw, ScoreElement expected) {
            assertThat(ScoreElement.lookup(raw)).contains(expected);
        }

        @Test
        void unknownKeys() {
            assertThat(ScoreElement.lookup("charisma")).isEmpty();
            assertThat(ScoreElement.lookup(null)).isEmpty();
        }

        @Test
        void extensionMaximaDifferFromBase() {
            assertThat(ScoreElement.extensions()).allMatch(ScoreElement::isExtension);
            assertThat(ScoreElement.METRICS.maxScore()).isEqualTo(10);
            assertThat(ScoreElement.ACTION.maxScore()).isEqualTo(20);
        }
    }

    @Nested
    @DisplayName("frameworks")
    class Frameworks {

        @Test
        void maxMainScoreIsTwentyPerElement() {
            assertThat(Framework.STAR.maxMainScore()).isEqualTo(80);
            assertThat(Framework.COMPETENCY.maxMainScore()).isEqualTo(60);
            assertThat(Framework.CASE.maxMainScore()).isEqualTo(80);
            assertThat(Framework.SYSTEMDESIGN.maxMainScore()).isEqualTo(80);
        }

        @ParameterizedTest
        @CsvSource({
                "STAR, STAR",
                "system, SYSTEMDESIGN",
                "System-Design, SYSTEMDESIGN",
                "MECE, CASE",
                "competency_based, COMPETENCY"
        })
        void aliases(String raw, Framework expected) {
            assertThat(Framework.lookup(raw)).contains(expected);
        }
    }

    @Nested
    @DisplayName("framework selection labels")
    class SelectionLabels {

        @Test
        void parsesBaseAndExtensionFlags() {
            FrameworkSelection selection = FrameworkSelection.parse("STAR+C+M", Framework.COMPETENCY);

            assertThat(selection.framework()).isEqualTo(Framework.STAR);
            assertThat(selection.extensions()).containsExactlyInAnyOrder(ScoreElement.CHALLENGE, ScoreElement.METRICS);
            assertThat(selection.extensionKeys()).containsExactly("challenge", "metrics");
            assertThat(selection.label()).isEqualTo("STAR+C+M");
        }

        @Test
        void flagsRenderInDeclarationOrder() {
            assertThat(FrameworkSelection.parse("CASE+M+L", Framework.STAR).label()).isEqualTo("CASE+L+M");
        }

        @Test
        void unknownBaseFallsBackAndUnknownFlagsAreIgnored() {
            FrameworkSelection selection = FrameworkSelection.parse("PARLA+X+C", Framework.CASE);

            assertThat(selection.framework()).isEqualTo(Framework.CASE);
            assertThat(selection.extensions()).isEqualTo(Set.of(ScoreElement.CHALLENGE));
        }

        @Test
        void baseElementsAreNotExtensionFlags() {
            assertThat(FrameworkSelection.parse("STAR+S", Framework.STAR).extensions()).isEmpty();
        }

        @Test
        void blankLabelUsesFallback() {
            assertThat(FrameworkSelection.parse(" ", Framework.SYSTEMDESIGN).label()).isEqualTo("SYSTEMDESIGN");
        }
    }
}
