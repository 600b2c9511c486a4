package dev.aparikh.torrentsearch.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls quoted literals out of search text. For example
 * <pre>foo bar "hello world" -"exclude this" -"x"|"y"</pre>
 * yields the required phrase {@code hello world}, the excluded phrase {@code exclude this},
 * a negated group {@code {x, y}} and the residual text {@code foo bar}.
 * <p>
 * Groups are extracted before single literals so a group's members are never counted again on their own.
 * Unbalanced quotes are left in the residual text.
 */
public class TermParser {

    private static final Pattern QUOTED_LITERAL = Pattern.compile("(-)?\"([^\"]+)\"");
    private static final Pattern QUOTED_LITERAL_GROUP = Pattern.compile(
            "(-)?(\"[^\"]+\"(?:\\|\"[^\"]+\")+)");

    public ParsedTerm parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return ParsedTerm.EMPTY;
        }

        List<ParsedTerm.PhraseGroup> groups = new ArrayList<>();
        Matcher groupMatcher = QUOTED_LITERAL_GROUP.matcher(rawText);
        StringBuilder remaining = new StringBuilder();
        while (groupMatcher.find()) {
            Set<String> alternatives = new LinkedHashSet<>();
            Matcher literal = QUOTED_LITERAL.matcher(groupMatcher.group(2));
            while (literal.find()) {
                alternatives.add(literal.group(2));
            }
            groups.add(new ParsedTerm.PhraseGroup(groupMatcher.group(1) != null, alternatives));
            groupMatcher.appendReplacement(remaining, "");
        }
        groupMatcher.appendTail(remaining);

        Set<String> required = new LinkedHashSet<>();
        Set<String> excluded = new LinkedHashSet<>();
        Matcher literalMatcher = QUOTED_LITERAL.matcher(remaining.toString().trim());
        StringBuilder residual = new StringBuilder();
        while (literalMatcher.find()) {
            if (literalMatcher.group(1) != null) {
                excluded.add(literalMatcher.group(2));
            } else {
                required.add(literalMatcher.group(2));
            }
            literalMatcher.appendReplacement(residual, "");
        }
        literalMatcher.appendTail(residual);

        return new ParsedTerm(required, excluded, groups, residual.toString().replaceAll("\\s+", " ").trim());
    }
}
