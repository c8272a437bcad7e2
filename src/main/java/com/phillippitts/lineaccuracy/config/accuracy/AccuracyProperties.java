package com.phillippitts.lineaccuracy.config.accuracy;

import com.phillippitts.lineaccuracy.service.align.ErrorPolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "line.accuracy")
public class AccuracyProperties {

    static final String DEFAULT_EQUIVALENTS = "classpath:accuracy/equivalents.txt";
    static final String DEFAULT_SKIPPABLE = "classpath:accuracy/skippable-words.txt";
    static final String DEFAULT_FILLERS = "classpath:accuracy/filler-words.txt";

    /** Minimum Jaro-Winkler similarity for proper nouns and known names (0..1). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double nameSimilarityThreshold;

    /** How many words the batch aligner looks ahead to tell missing, extra and wrong words apart. */
    @Min(1)
    private final int lookAhead;

    /** Strict mode used by the REST API when a request does not say. */
    private final boolean strictByDefault;

    /** Locked aligner behaviour after a mismatch. */
    @NotNull
    private final ErrorPolicy errorPolicy;

    @NotNull
    private final WordTableLocations wordTables;

    @ConstructorBinding
    public AccuracyProperties(Double nameSimilarityThreshold, Integer lookAhead, Boolean strictByDefault,
                              ErrorPolicy errorPolicy, WordTableLocations wordTables) {
        double t = nameSimilarityThreshold == null ? 0.80 : nameSimilarityThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("line.accuracy.name-similarity-threshold must be in [0,1]");
        }
        this.nameSimilarityThreshold = t;

        int la = lookAhead == null ? 3 : lookAhead;
        if (la < 1) {
            throw new IllegalArgumentException("line.accuracy.look-ahead must be >= 1");
        }
        this.lookAhead = la;
        this.strictByDefault = strictByDefault != null && strictByDefault;
        this.errorPolicy = errorPolicy == null ? ErrorPolicy.FREEZE : errorPolicy;
        this.wordTables = wordTables == null ? new WordTableLocations(null, null, null) : wordTables;
    }

    /** Defaults for tests and manual instantiation. */
    public AccuracyProperties() {
        this(null, null, null, null, null);
    }

    public double getNameSimilarityThreshold() {
        return nameSimilarityThreshold;
    }

    public int getLookAhead() {
        return lookAhead;
    }

    public boolean isStrictByDefault() {
        return strictByDefault;
    }

    public ErrorPolicy getErrorPolicy() {
        return errorPolicy;
    }

    public WordTableLocations getWordTables() {
        return wordTables;
    }

    /**
     * Resource locations of the word tables.
     */
    public static class WordTableLocations {

        @NotBlank
        private final String equivalents;
        @NotBlank
        private final String skippable;
        @NotBlank
        private final String fillers;

        public WordTableLocations(String equivalents, String skippable, String fillers) {
            this.equivalents = isBlank(equivalents) ? DEFAULT_EQUIVALENTS : equivalents;
            this.skippable = isBlank(skippable) ? DEFAULT_SKIPPABLE : skippable;
            this.fillers = isBlank(fillers) ? DEFAULT_FILLERS : fillers;
        }

        private static boolean isBlank(String s) {
            return s == null || s.isBlank();
        }

        public String getEquivalents() {
            return equivalents;
        }

        public String getSkippable() {
            return skippable;
        }

        public String getFillers() {
            return fillers;
        }
    }
}
