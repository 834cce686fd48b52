package com.my.memory.domain.model;

import java.util.List;

public record SearchPage(List<SearchResult> results, int page, int pageSize, boolean hasMore) {
    public SearchPage {
        results = List.copyOf(results);
    }
}
