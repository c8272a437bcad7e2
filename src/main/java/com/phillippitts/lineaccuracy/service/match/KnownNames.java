package com.phillippitts.lineaccuracy.service.match;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Names that qualify for fuzzy matching even when the script does not capitalize them.
 *
 * <p>Passed explicitly with each call so the engine stays reentrant; use {@link #none()} when the
 * caller has no cast list.
 */
public final class KnownNames {

    private static final KnownNames NONE = new KnownNames(Set.of());
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_NAME_PART_LENGTH = 2;

    private final Set<String> names;

    private KnownNames(Set<String> names) {
        this.names = names;
    }

    public static KnownNames none() {
        return NONE;
    }

    /**
     * Wraps a set of names, lower-casing each one.
     *
     * @param names names (may be null)
     * @return known names, {@link #none()} when empty
     */
    public static KnownNames of(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return NONE;
        }
        Set<String> normalized = new HashSet<>();
        for (String name : names) {
            if (name != null && !name.isBlank()) {
                normalized.add(name.strip().toLowerCase(Locale.ROOT));
            }
        }
        return normalized.isEmpty() ? NONE : new KnownNames(Set.copyOf(normalized));
    }

    /**
     * Derives known names from a cast list: every part of every character name with at least two
     * letters, so "Dr. Mary-Ann Smith" contributes "dr", "maryann" and "smith".
     *
     * @param characterNames full character names (may be null)
     * @return known names, {@link #none()} when nothing qualifies
     */
    public static KnownNames fromCharacterNames(Collection<String> characterNames) {
        if (characterNames == null || characterNames.isEmpty()) {
            return NONE;
        }
        Set<String> parts = new HashSet<>();
        for (String name : characterNames) {
            if (name == null) {
                continue;
            }
            String cleaned = NON_WORD.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("");
            for (String part : WHITESPACE.split(cleaned.strip())) {
                if (part.length() >= MIN_NAME_PART_LENGTH) {
                    parts.add(part);
                }
            }
        }
        return parts.isEmpty() ? NONE : new KnownNames(Set.copyOf(parts));
    }

    public boolean contains(String normalizedWord) {
        return names.contains(normalizedWord);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public Set<String> asSet() {
        return names;
    }

    /**
     * @param other names to add (may be null)
     * @return names in either set
     */
    public KnownNames union(KnownNames other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Set<String> all = new HashSet<>(names);
        all.addAll(other.names);
        return new KnownNames(Set.copyOf(all));
    }

    @Override
    public String toString() {
        return "KnownNames" + names;
    }
}
