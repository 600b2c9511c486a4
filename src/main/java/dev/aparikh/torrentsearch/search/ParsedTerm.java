package dev.aparikh.torrentsearch.search;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Search text split into quoted literals and free text.
 *
 * @param requiredPhrases     quoted literals the display name must contain
 * @param excludedPhrases     {@code -"..."} literals the display name must not contain
 * @param requiredPhraseGroups {@code "a"|"b"} alternatives, each group satisfied by any one literal
 * @param residualText        everything else, for tokenized full-text matching; may be empty
 */
public record ParsedTerm(
        Set<String> requiredPhrases,
        Set<String> excludedPhrases,
        List<PhraseGroup> requiredPhraseGroups,
        String residualText
) {
    public static final ParsedTerm EMPTY = new ParsedTerm(Set.of(), Set.of(), List.of(), "");

    public ParsedTerm {
        requiredPhrases = Collections.unmodifiableSet(new LinkedHashSet<>(requiredPhrases));
        excludedPhrases = Collections.unmodifiableSet(new LinkedHashSet<>(excludedPhrases));
        requiredPhraseGroups = List.copyOf(requiredPhraseGroups);
        residualText = residualText == null ? "" : residualText.trim();
    }

    public boolean isEmpty() {
        return requiredPhrases.isEmpty() && excludedPhrases.isEmpty()
                && requiredPhraseGroups.isEmpty() && residualText.isEmpty();
    }

    public boolean hasResidualText() {
        return !residualText.isEmpty();
    }

    /**
     * Alternatives joined by {@code |}; a leading {@code -} negates the whole group.
     */
    public record PhraseGroup(boolean negated, Set<String> alternatives) {
        public PhraseGroup {
            alternatives = Collections.unmodifiableSet(new LinkedHashSet<>(alternatives));
        }
    }
}
