package com.phillippitts.lineaccuracy.config.accuracy;

import com.phillippitts.lineaccuracy.exception.WordTableException;
import com.phillippitts.lineaccuracy.service.align.ErrorPolicy;
import com.phillippitts.lineaccuracy.service.match.KnownNames;
import com.phillippitts.lineaccuracy.service.match.WordComparator;
import com.phillippitts.lineaccuracy.service.match.WordTables;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccuracyPropertiesTest {

    @Test
    void appliesDefaultsWhenUnset() {
        AccuracyProperties props = new AccuracyProperties();

        assertThat(props.getNameSimilarityThreshold()).isEqualTo(0.80);
        assertThat(props.getLookAhead()).isEqualTo(3);
        assertThat(props.isStrictByDefault()).isFalse();
        assertThat(props.getErrorPolicy()).isEqualTo(ErrorPolicy.FREEZE);
        assertThat(props.getWordTables().getEquivalents()).isEqualTo("classpath:accuracy/equivalents.txt");
        assertThat(props.getWordTables().getSkippable()).isEqualTo("classpath:accuracy/skippable-words.txt");
        assertThat(props.getWordTables().getFillers()).isEqualTo("classpath:accuracy/filler-words.txt");
    }

    @Test
    void keepsExplicitValues() {
        AccuracyProperties props = new AccuracyProperties(0.9, 5, true, ErrorPolicy.RECOVER,
                new AccuracyProperties.WordTableLocations("file:/etc/eq.txt", null, " "));

        assertThat(props.getNameSimilarityThreshold()).isEqualTo(0.9);
        assertThat(props.getLookAhead()).isEqualTo(5);
        assertThat(props.isStrictByDefault()).isTrue();
        assertThat(props.getErrorPolicy()).isEqualTo(ErrorPolicy.RECOVER);
        assertThat(props.getWordTables().getEquivalents()).isEqualTo("file:/etc/eq.txt");
        assertThat(props.getWordTables().getFillers()).isEqualTo("classpath:accuracy/filler-words.txt");
    }

    @Test
    void failsOnThresholdOutOfRange() {
        assertThatThrownBy(() -> new AccuracyProperties(1.5, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name-similarity-threshold");
        assertThatThrownBy(() -> new AccuracyProperties(-0.1, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failsOnLookAheadBelowOne() {
        assertThatThrownBy(() -> new AccuracyProperties(null, 0, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("look-ahead must be >= 1");
    }

    @Test
    void configBuildsComparatorFromBundledTables() {
        AccuracyConfig config = new AccuracyConfig();
        AccuracyProperties props = new AccuracyProperties();

        WordTables tables = config.wordTables(props, new DefaultResourceLoader());
        WordComparator comparator = config.wordComparator(tables, props);

        assertThat(tables.isFiller("um")).isTrue();
        assertThat(comparator.wordsMatch("okay", "ok", "okay", false, KnownNames.none())).isTrue();
    }

    @Test
    void configFailsFastOnMissingTable() {
        AccuracyProperties props = new AccuracyProperties(null, null, null, null,
                new AccuracyProperties.WordTableLocations("classpath:accuracy/no-such-file.txt", null, null));

        assertThatThrownBy(() -> new AccuracyConfig().wordTables(props, new DefaultResourceLoader()))
                .isInstanceOf(WordTableException.class)
                .hasMessageContaining("no-such-file.txt");
    }
}
