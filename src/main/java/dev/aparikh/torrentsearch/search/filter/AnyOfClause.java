package dev.aparikh.torrentsearch.search.filter;

import dev.aparikh.torrentsearch.model.Torrent;

import java.util.List;

public record AnyOfClause(List<FilterClause> alternatives) implements FilterClause {

    public AnyOfClause {
        if (alternatives == null || alternatives.isEmpty()) {
            throw new IllegalArgumentException("AnyOfClause needs at least one alternative");
        }
        alternatives = List.copyOf(alternatives);
    }

    public static AnyOfClause of(FilterClause... alternatives) {
        return new AnyOfClause(List.of(alternatives));
    }

    @Override
    public boolean matches(Torrent torrent) {
        return alternatives.stream().anyMatch(c -> c.matches(torrent));
    }
}
