package dev.aparikh.torrentsearch.search;

import dev.aparikh.torrentsearch.model.Torrent;
import dev.aparikh.torrentsearch.search.filter.FilterClause;
import dev.aparikh.torrentsearch.search.filter.SearchFilters;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * List-backed backend: the filter clauses decide visibility, quoted literals are case-insensitive
 * substrings and every residual word must occur in the display name.
 */
class InMemorySearchBackend implements TorrentSearchBackend {

    private final List<Torrent> torrents;
    private final int maxPages;

    InMemorySearchBackend(List<Torrent> torrents, int maxPages) {
        this.torrents = new ArrayList<>(torrents);
        this.maxPages = maxPages;
    }

    @Override
    public CountedQuery<Torrent> prepare(SearchRequest request, ParsedTerm term, Viewer viewer) {
        List<FilterClause> clauses = SearchFilters.build(request, viewer);
        Comparator<Torrent> order = Comparator.comparingLong(Torrent::id);
        if (request.sortOrder() == SortOrder.DESC) {
            order = order.reversed();
        }
        List<Torrent> matches = torrents.stream()
                .filter(t -> SearchFilters.matchesAll(clauses, t))
                .filter(t -> matchesTerm(term, t.displayName().toLowerCase(Locale.ROOT)))
                .sorted(order)
                .toList();
        return new CountedQuery<>() {
            @Override
            public QueryPage<Torrent> fetch(long offset, int limit) {
                int from = (int) Math.min(offset, matches.size());
                int to = (int) Math.min(offset + limit, matches.size());
                return QueryPage.of(matches.subList(from, to));
            }

            @Override
            public long count() {
                return matches.size();
            }

            @Override
            public String countKey() {
                return "memory:" + clauses + term;
            }
        };
    }

    private static boolean matchesTerm(ParsedTerm term, String name) {
        for (String phrase : term.requiredPhrases()) {
            if (!name.contains(phrase.toLowerCase(Locale.ROOT))) return false;
        }
        for (String phrase : term.excludedPhrases()) {
            if (name.contains(phrase.toLowerCase(Locale.ROOT))) return false;
        }
        for (ParsedTerm.PhraseGroup group : term.requiredPhraseGroups()) {
            boolean any = group.alternatives().stream().anyMatch(a -> name.contains(a.toLowerCase(Locale.ROOT)));
            if (any == group.negated()) return false;
        }
        if (term.hasResidualText()) {
            for (String word : term.residualText().toLowerCase(Locale.ROOT).split(" ")) {
                if (!name.contains(word)) return false;
            }
        }
        return true;
    }

    @Override
    public int pageLimit(int perPage, boolean privileged) {
        return privileged ? 0 : maxPages;
    }

    @Override
    public String name() {
        return "memory";
    }
}
