package com.my.memory.domain.service;

import com.my.memory.domain.model.PageRequest;
import com.my.memory.domain.model.Project;
import com.my.memory.domain.model.SearchPage;
import com.my.memory.domain.model.SearchQuery;
import com.my.memory.domain.model.SearchResult;
import com.my.memory.domain.port.in.SearchUseCase;
import com.my.memory.domain.port.out.ClockPort;
import com.my.memory.domain.port.out.KnowledgeStorePort;

import java.time.Instant;
import java.util.List;

public class SearchService implements SearchUseCase {

    static final String DEFAULT_RECENT_TIMEFRAME = "7d";

    private final ProjectResolver projects;
    private final KnowledgeStorePort store;
    private final ClockPort clock;

    public SearchService(ProjectResolver projects, KnowledgeStorePort store, ClockPort clock) {
        this.projects = projects;
        this.store = store;
        this.clock = clock;
    }

    @Override
    public SearchPage search(SearchQuery query, PageRequest page) {
        Project project = projects.resolve(query.project());
        List<SearchResult> results = store.search(project.id(), query, page.pageSize() + 1, page.offset());
        boolean hasMore = results.size() > page.pageSize();
        return new SearchPage(hasMore ? results.subList(0, page.pageSize()) : results,
                page.page(), page.pageSize(), hasMore);
    }

    /**
     * timeframe 이 없으면 최근 7일.
     */
    @Override
    public SearchPage recentActivity(String project, String timeframe, PageRequest page) {
        String window = timeframe == null || timeframe.isBlank() ? DEFAULT_RECENT_TIMEFRAME : timeframe;
        Instant since = TimeframeParser.since(window, clock.now());
        return search(new SearchQuery(project, null, List.of(), List.of(), since, null), page);
    }
}
