package com.my.memory.domain.port.in;

import com.my.memory.domain.model.PageRequest;
import com.my.memory.domain.model.SearchPage;
import com.my.memory.domain.model.SearchQuery;

public interface SearchUseCase {

    SearchPage search(SearchQuery query, PageRequest page);

    SearchPage recentActivity(String project, String timeframe, PageRequest page);
}
