package com.phillippitts.lineaccuracy.service;

import com.phillippitts.lineaccuracy.domain.AccuracyResult;
import com.phillippitts.lineaccuracy.testutil.TestEngine;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LineAccuracyServiceTest {

    private final LineAccuracyService service = TestEngine.service();

    @Test
    void exactMatchReturnsPerfectResult() {
        AccuracyResult r = service.checkAccuracy("To be or not to be", "To be or not to be");

        assertThat(r.correct()).isTrue();
        assertThat(r.accuracy()).isEqualTo(100);
        assertThat(r.missingWords()).isEmpty();
        assertThat(r.extraWords()).isEmpty();
        assertThat(r.wrongWords()).isEmpty();
    }

    @Test
    void ignoresCaseAndPunctuation() {
        assertThat(service.checkAccuracy("Hello World", "hello world").accuracy()).isEqualTo(100);

        AccuracyResult r = service.checkAccuracy("Hello, World!", "hello world");
        assertThat(r.correct()).isTrue();
        assertThat(r.accuracy()).isEqualTo(100);
    }

    @Test
    void reportsSubstitutionWithBothWords() {
        AccuracyResult r = service.checkAccuracy("I love you", "I hate you");

        assertThat(r.correct()).isFalse();
        assertThat(r.wrongWords()).containsExactly("\"hate\" instead of \"love\"");
    }

    @Test
    void anySubstitutionFailsEvenAtHighAccuracy() {
        AccuracyResult r = service.checkAccuracy(
                "the quick brown fox jumps over the lazy old dog",
                "the quick brown fox jumps over the lazy young dog");

        assertThat(r.accuracy()).isGreaterThanOrEqualTo(90);
        assertThat(r.correct()).isFalse();
        assertThat(r.wrongWords()).isNotEmpty();
    }

    @Test
    void missingWordOnShortLineFailsBelowThreshold() {
        AccuracyResult r = service.checkAccuracy("I am going home now", "I am going home");

        assertThat(r.missingWords()).containsExactly("now");
        assertThat(r.accuracy()).isEqualTo(80);
        assertThat(r.correct()).isFalse();
    }

    @Test
    void missingWordOnMediumLineStaysWithinTolerance() {
        AccuracyResult r = service.checkAccuracy(
                "I really truly do believe that this is quite nice today",
                "I really truly do believe that this is quite nice");

        assertThat(r.missingWords()).containsExactly("today");
        assertThat(r.wrongWords()).isEmpty();
        assertThat(r.accuracy()).isEqualTo(91);
        assertThat(r.correct()).isTrue();
    }

    @Test
    void detectsMultipleMissingWords() {
        AccuracyResult r = service.checkAccuracy("I will go to the store", "I will go");

        assertThat(r.missingWords()).containsExactly("to", "the", "store");
    }

    @Test
    void detectsExtraWords() {
        AccuracyResult r = service.checkAccuracy("I am fine", "I am really very fine");

        assertThat(r.extraWords()).isNotEmpty();
        assertThat(r.correct()).isFalse();
    }

    @Test
    void dropsTrailingFiller() {
        AccuracyResult r = service.checkAccuracy("I am going home", "I am going home uh");

        assertThat(r.extraWords()).isEmpty();
        assertThat(r.correct()).isTrue();
    }

    @Test
    void skipsFillerMidSentence() {
        AccuracyResult r = service.checkAccuracy("I am going home today", "I am going home uh today");

        assertThat(r.extraWords()).isEmpty();
        assertThat(r.missingWords()).isEmpty();
        assertThat(r.accuracy()).isEqualTo(100);
    }

    @Test
    void skipsLeadingFiller() {
        AccuracyResult r = service.checkAccuracy("I am fine", "um I am fine");

        assertThat(r.accuracy()).isEqualTo(100);
        assertThat(r.correct()).isTrue();
    }

    @Test
    void acceptsWrittenStutterSpokenOnce() {
        AccuracyResult r = service.checkAccuracy("I--I am here", "I am here");

        assertThat(r.wrongWords()).isEmpty();
        assertThat(r.missingWords()).isEmpty();
        assertThat(r.accuracy()).isEqualTo(100);
        assertThat(r.correct()).isTrue();
    }

    @Test
    void acceptsSingleDashStutter() {
        assertThat(service.checkAccuracy("I-I am here", "I am here").accuracy()).isEqualTo(100);
    }

    @Test
    void acceptsWrittenStutterSpokenTwice() {
        AccuracyResult r = service.checkAccuracy("I--I am here", "I I am here");

        assertThat(r.correct()).isTrue();
        assertThat(r.accuracy()).isEqualTo(100);
    }

    @Test
    void stutterOnLongerLineIsExcludedFromScore() {
        AccuracyResult r = service.checkAccuracy(
                "But I--I really think we should go to the store and get some food",
                "But I really think we should go to the store and get some food");

        assertThat(r.accuracy()).isEqualTo(100);
        assertThat(r.correct()).isTrue();
    }

    @Test
    void unspokenSkippableWordsAreExcludedFromScore() {
        assertThat(service.checkAccuracy("um I think so", "I think so").accuracy()).isEqualTo(100);
        assertThat(service.checkAccuracy("well I think so", "I think so").accuracy()).isEqualTo(100);
        assertThat(service.checkAccuracy("so what do you think", "what do you think").accuracy()).isEqualTo(100);

        AccuracyResult r = service.checkAccuracy("sighs I know", "I know");
        assertThat(r.accuracy()).isEqualTo(100);
        assertThat(r.missingWords()).isEmpty();
        assertThat(r.correct()).isTrue();
    }

    @Test
    void acceptsSkippableWordWhenSpoken() {
        AccuracyResult r = service.checkAccuracy("oh I see", "oh I see");

        assertThat(r.correct()).isTrue();
        assertThat(r.accuracy()).isEqualTo(100);
    }

    @Test
    void skippableWordOnLongerLineIsExcludedFromScore() {
        AccuracyResult r = service.checkAccuracy(
                "sighs I really do think we should leave this place right now before something happens",
                "I really do think we should leave this place right now before something happens");

        assertThat(r.accuracy()).isEqualTo(100);
        assertThat(r.correct()).isTrue();
    }

    @Test
    void mediumLineFailsOnAccuracyEvenWithinMissingAllowance() {
        AccuracyResult r = service.checkAccuracy(
                "I went to the store and bought some bread and milk and cheese",
                "I went to the store and bought some bread and milk");

        assertThat(r.missingWords()).containsExactly("and", "cheese");
        assertThat(r.accuracy()).isEqualTo(85);
        assertThat(r.correct()).isFalse();
    }

    @Test
    void longLineAllowsThreeMissingWords() {
        String line = "the quick brown fox jumps over the lazy dog and then runs across the wide open field "
                + "to find some food and water for the journey ahead";
        List<String> words = Arrays.asList(line.split(" "));
        String spoken = String.join(" ", words.subList(0, words.size() - 3));

        AccuracyResult r = service.checkAccuracy(line, spoken);

        assertThat(r.missingWords()).containsExactly("the", "journey", "ahead");
        assertThat(r.correct()).isTrue();
    }

    @Nested
    class Equivalents {

        @Test
        void matchesHomophones() {
            assertThat(service.checkAccuracy("their house is big", "there house is big").correct()).isTrue();
            assertThat(service.checkAccuracy("it's a nice day", "its a nice day").correct()).isTrue();
            assertThat(service.checkAccuracy("you're going home", "your going home").correct()).isTrue();
        }

        @Test
        void matchesNumeralsAndAbbreviations() {
            assertThat(service.checkAccuracy("I have two dogs", "I have 2 dogs").correct()).isTrue();
            assertThat(service.checkAccuracy("I have one dog", "I have 1 dog").correct()).isTrue();
            assertThat(service.checkAccuracy("I won the game", "I one the game").correct()).isTrue();
            assertThat(service.checkAccuracy("Doctor Smith is here", "dr Smith is here").correct()).isTrue();
        }

        @Test
        void matchesCasualSpellingsAndFillerSounds() {
            assertThat(service.checkAccuracy("okay lets go", "ok lets go").correct()).isTrue();
            assertThat(service.checkAccuracy("yeah I know", "yep I know").correct()).isTrue();
            assertThat(service.checkAccuracy("mmhmm I understand", "mhm I understand").correct()).isTrue();
        }

        @Test
        void matchesSeveralInOneLine() {
            assertThat(service.checkAccuracy("you're going to their house", "your going to there house").correct())
                    .isTrue();
        }

        @Test
        void matchesTwoWordSpellingOfOneWord() {
            assertThat(service.checkAccuracy("alright lets go", "all right lets go").correct()).isTrue();
        }
    }

    @Nested
    class ProperNouns {

        @Test
        void fuzzyMatchesCapitalizedNames() {
            assertThat(service.checkAccuracy("Hello Robinavitch how are you", "hello robinovich how are you")
                    .correct()).isTrue();
            assertThat(service.checkAccuracy("Hello Mackenzie how are you", "hello Mackensie how are you")
                    .correct()).isTrue();
        }

        @Test
        void neverFuzzyMatchesOrdinaryWords() {
            assertThat(service.checkAccuracy("the old man", "the young man").correct()).isFalse();
        }
    }

    @Nested
    class StrictMode {

        @Test
        void failsOnAnyMissingWord() {
            assertThat(service.checkAccuracy("I am going to the store today", "I am going to the store", true)
                    .correct()).isFalse();

            AccuracyResult r = service.checkAccuracy("hello world", "hello", true);
            assertThat(r.correct()).isFalse();
            assertThat(r.missingWords()).contains("world");
        }

        @Test
        void failsOnAnyExtraWord() {
            AccuracyResult r = service.checkAccuracy("hello world", "hello beautiful world", true);

            assertThat(r.correct()).isFalse();
            assertThat(r.extraWords()).isNotEmpty();
        }

        @Test
        void stillAcceptsEquivalentsStuttersSkipsAndFillers() {
            assertThat(service.checkAccuracy("you're welcome", "your welcome", true).correct()).isTrue();
            assertThat(service.checkAccuracy("I--I am here", "I am here", true).correct()).isTrue();
            assertThat(service.checkAccuracy("But I--I really do think we should go to the store",
                    "But I really do think we should go to the store", true).correct()).isTrue();
            assertThat(service.checkAccuracy("sighs I know right", "I know right", true).correct()).isTrue();
            assertThat(service.checkAccuracy("I know right", "um I know right", true).correct()).isTrue();
            assertThat(service.checkAccuracy("To be or not to be", "to be or not to be", true).correct()).isTrue();
        }

        @Test
        void failsOnSubstitution() {
            assertThat(service.checkAccuracy("I love you", "I hate you", true).correct()).isFalse();
        }
    }

    @Nested
    class EdgeCases {

        @Test
        void emptyExpectedAndSpokenIsTrivialMatch() {
            AccuracyResult r = service.checkAccuracy("", "");

            assertThat(r.correct()).isTrue();
            assertThat(r.accuracy()).isEqualTo(100);
        }

        @Test
        void nullIsTreatedAsEmpty() {
            assertThat(service.checkAccuracy(null, null).correct()).isTrue();
            assertThat(service.checkAccuracy("hello", null).accuracy()).isZero();
        }

        @Test
        void emptySpokenReportsEveryWordMissing() {
            AccuracyResult r = service.checkAccuracy("hello world", "");

            assertThat(r.correct()).isFalse();
            assertThat(r.accuracy()).isZero();
            assertThat(r.missingWords()).containsExactly("hello", "world");
        }

        @Test
        void emptyExpectedWithSpeechReportsExtras() {
            AccuracyResult r = service.checkAccuracy("", "hello world");

            assertThat(r.extraWords()).containsExactly("hello", "world");
            assertThat(r.correct()).isFalse();
        }

        @Test
        void handlesLongRepeatedLine() {
            String words = String.join(" ", Collections.nCopies(30, "word"));

            AccuracyResult r = service.checkAccuracy(words, words);

            assertThat(r.correct()).isTrue();
            assertThat(r.accuracy()).isEqualTo(100);
        }

        @Test
        void keepsApostrophes() {
            assertThat(service.checkAccuracy("don't", "don't").correct()).isTrue();
        }

        @Test
        void reportsMixedErrors() {
            AccuracyResult r = service.checkAccuracy("I love the big old house", "I hate the big house");

            assertThat(r.wrongWords()).isNotEmpty();
            assertThat(r.missingWords()).contains("old");
        }

        @Test
        void completelyWrongLineScoresLow() {
            AccuracyResult r = service.checkAccuracy("We need to leave right now", "The weather is beautiful today");

            assertThat(r.correct()).isFalse();
            assertThat(r.accuracy()).isLessThan(50);
        }
    }

    @Nested
    class PracticeScenarios {

        @Test
        void fillerInLongLineDoesNotMisalign() {
            AccuracyResult r = service.checkAccuracy(
                    "I think we should go to the market and buy some fruit today",
                    "I think we should uh go to the market and buy some fruit today");

            assertThat(r.accuracy()).isEqualTo(100);
            assertThat(r.correct()).isTrue();
        }

        @Test
        void leadingFillerBeforeSkippableWord() {
            AccuracyResult r = service.checkAccuracy("Well I think we should go", "um well I think we should go");

            assertThat(r.accuracy()).isEqualTo(100);
            assertThat(r.correct()).isTrue();
        }

        @Test
        void buildModeSegmentsPassWhenRepeated() {
            for (String segment : List.of("To be", "To be or not", "To be or not to be",
                    "To be or not to be that is the question")) {
                AccuracyResult r = service.checkAccuracy(segment, segment.toLowerCase());
                assertThat(r.correct()).as(segment).isTrue();
                assertThat(r.accuracy()).as(segment).isEqualTo(100);
            }
        }

        @Test
        void stageDirectionInsideDialogueIsIgnored() {
            AccuracyResult r = service.checkAccuracy("sighs I know I know", "I know I know");

            assertThat(r.accuracy()).isEqualTo(100);
            assertThat(r.wrongWords()).isEmpty();
        }
    }

    @Test
    void wordsMatchIsSymmetricForEquivalents() {
        assertThat(service.wordsMatch("their", "there", null)).isTrue();
        assertThat(service.wordsMatch("there", "their", null)).isTrue();
        assertThat(service.wordsMatch("old", "young", null)).isFalse();
    }

    @Test
    void identicalTextIsAlwaysCorrect() {
        for (String line : List.of("Is this a dagger which I see before me?", "(beat) No. No--no!",
                "Dr. O'Malley, 2nd floor.", "   ", "mm-hmm")) {
            AccuracyResult r = service.checkAccuracy(line, line);
            assertThat(r.correct()).as(line).isTrue();
            assertThat(r.accuracy()).as(line).isEqualTo(100);
        }
    }
}
