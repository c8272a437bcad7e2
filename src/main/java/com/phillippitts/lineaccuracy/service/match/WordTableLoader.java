package com.phillippitts.lineaccuracy.service.match;

import com.phillippitts.lineaccuracy.exception.WordTableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads word tables from text resources.
 *
 * <p>Formats (blank lines and lines starting with {@code #} are ignored; entries are trimmed and
 * lower-cased):
 * <ul>
 *   <li>equivalents: {@code key: alternative, alternative two, ...}</li>
 *   <li>word lists: one word per line</li>
 * </ul>
 */
public class WordTableLoader {

    private static final Logger LOG = LogManager.getLogger(WordTableLoader.class);

    private final ResourceLoader resourceLoader;

    public WordTableLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = Objects.requireNonNull(resourceLoader);
    }

    /**
     * Loads all three tables.
     *
     * @param equivalentsLocation resource location of the equivalence table
     * @param skippableLocation   resource location of the skippable script words
     * @param fillersLocation     resource location of the spoken filler words
     * @return immutable tables
     * @throws WordTableException if any resource is missing, unreadable, or malformed
     */
    public WordTables load(String equivalentsLocation, String skippableLocation, String fillersLocation) {
        WordTables tables = new WordTables(
                readEquivalents(equivalentsLocation),
                readWordList(skippableLocation),
                readWordList(fillersLocation));
        LOG.info("Loaded word tables: {} equivalence entries, {} skippable words, {} fillers",
                tables.equivalentCount(), tables.skippableCount(), tables.fillerCount());
        return tables;
    }

    Map<String, Set<String>> readEquivalents(String location) {
        Map<String, Set<String>> table = new LinkedHashMap<>();
        int lineNumber = 0;
        for (String line : readLines(location)) {
            lineNumber++;
            if (isIgnorable(line)) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new WordTableException(location, "line " + lineNumber + " has no 'key:' prefix");
            }
            String key = normalize(line.substring(0, colon));
            Set<String> alternatives = table.computeIfAbsent(key, k -> new LinkedHashSet<>());
            for (String alternative : line.substring(colon + 1).split(",")) {
                String normalized = normalize(alternative);
                if (!normalized.isEmpty() && !normalized.equals(key)) {
                    alternatives.add(normalized);
                }
            }
        }
        return table;
    }

    Set<String> readWordList(String location) {
        Set<String> words = new LinkedHashSet<>();
        for (String line : readLines(location)) {
            if (!isIgnorable(line)) {
                words.add(normalize(line));
            }
        }
        return words;
    }

    private List<String> readLines(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new WordTableException(location, "resource not found");
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().toList();
        } catch (IOException e) {
            throw new WordTableException(location, e);
        }
    }

    private static boolean isIgnorable(String line) {
        String trimmed = line.strip();
        return trimmed.isEmpty() || trimmed.startsWith("#");
    }

    private static String normalize(String entry) {
        return entry.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
