package me.golemcore.courseqa.domain.model;

import java.util.List;

/**
 * Outcome of a content search: matched chunks, or an error message reported by
 * the content store.
 */
public record SearchResults(List<SearchHit> hits, String error) {

    public SearchResults {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public static SearchResults of(List<SearchHit> hits) {
        return new SearchResults(hits, null);
    }

    public static SearchResults error(String error) {
        return new SearchResults(List.of(), error);
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
