package com.my.memory.domain.service;

import com.my.memory.adapter.out.clock.SystemClockAdapter;
import com.my.memory.domain.exception.InvalidRequestException;
import com.my.memory.domain.exception.ProjectNotFoundException;
import com.my.memory.domain.model.PageRequest;
import com.my.memory.domain.model.SearchPage;
import com.my.memory.domain.model.SearchQuery;
import com.my.memory.domain.model.SearchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchServiceTest {

    @TempDir
    Path tempDir;

    private KnowledgeFixture fixture;
    private SearchService service;

    @BeforeEach
    void setUp() throws Exception {
        fixture = KnowledgeFixture.create(tempDir);
        service = new SearchService(fixture.projectResolver, fixture.store, SystemClockAdapter.system());
        fixture.write("coffee.md", "---\ntitle: Coffee Brewing\ntags: [drink]\n---\n- [method] pour over works best #coffee\n");
        fixture.write("tea.md", "---\ntitle: Green Tea\ntype: beverage\n---\nSteep for two minutes.\n");
        fixture.write("journal/monday.md", "# Monday\nHad espresso and a croissant.\n");
        fixture.scan();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void prefixTermsMatchTitlesAndBodies() {
        SearchPage page = service.search(SearchQuery.text(null, "coff"), PageRequest.first());

        assertThat(page.results()).extracting(SearchResult::permalink).containsExactly("coffee-brewing");
        assertThat(page.results().get(0).score()).isPositive();
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void substringFallbackFindsWordInteriors() {
        SearchPage page = service.search(SearchQuery.text("main", "spresso"), PageRequest.first());

        assertThat(page.results()).extracting(SearchResult::filePath).containsExactly("journal/monday.md");
    }

    @Test
    void punctuationOnlyTextMatchesLiterally() {
        SearchPage none = service.search(SearchQuery.text(null, "!!!"), PageRequest.first());
        SearchPage bracket = service.search(SearchQuery.text(null, "["), PageRequest.first());

        assertThat(none.results()).isEmpty();
        assertThat(bracket.results()).extracting(SearchResult::permalink).containsExactly("coffee-brewing");
    }

    @Test
    void filtersByTypeTagAndPermalinkPattern() {
        SearchPage byType = service.search(
                new SearchQuery(null, null, List.of("beverage"), List.of(), null, null), PageRequest.first());
        SearchPage byObservationTag = service.search(
                new SearchQuery(null, null, List.of(), List.of("#coffee"), null, null), PageRequest.first());
        SearchPage byFrontmatterTag = service.search(
                new SearchQuery(null, null, List.of(), List.of("drink"), null, null), PageRequest.first());
        SearchPage byPattern = service.search(
                new SearchQuery(null, null, List.of(), List.of(), null, "g*"), PageRequest.first());

        assertThat(byType.results()).extracting(SearchResult::permalink).containsExactly("green-tea");
        assertThat(byObservationTag.results()).extracting(SearchResult::permalink).containsExactly("coffee-brewing");
        assertThat(byFrontmatterTag.results()).extracting(SearchResult::permalink).containsExactly("coffee-brewing");
        assertThat(byPattern.results()).extracting(SearchResult::permalink).containsExactly("green-tea");
    }

    @Test
    void pagesReportWhetherMoreResultsExist() {
        SearchPage first = service.search(SearchQuery.text(null, null), PageRequest.of(1, 2));
        SearchPage second = service.search(SearchQuery.text(null, null), PageRequest.of(2, 2));

        assertThat(first.results()).hasSize(2);
        assertThat(first.hasMore()).isTrue();
        assertThat(second.results()).hasSize(1);
        assertThat(second.hasMore()).isFalse();
    }

    @Test
    void recentActivityUsesTimeframeAgainstClock() {
        SearchService future = new SearchService(fixture.projectResolver, fixture.store,
                SystemClockAdapter.fixed(Instant.parse("2100-01-01T00:00:00Z")));

        assertThat(service.recentActivity(null, null, PageRequest.first()).results()).hasSize(3);
        assertThat(future.recentActivity(null, "7d", PageRequest.first()).results()).isEmpty();
        assertThatThrownBy(() -> service.recentActivity(null, "someday", PageRequest.first()))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void unknownProjectFails() {
        assertThatThrownBy(() -> service.search(SearchQuery.text("nope", "x"), PageRequest.first()))
                .isInstanceOf(ProjectNotFoundException.class);
    }
}
