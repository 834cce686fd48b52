package com.my.memory.domain.service;

import com.my.memory.domain.exception.MarkdownParseException;
import com.my.memory.domain.model.ObservationDraft;
import com.my.memory.domain.model.ParsedDraft;
import com.my.memory.domain.model.RelationDraft;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class MarkdownKnowledgeParserTest {

    private final MarkdownKnowledgeParser parser = new MarkdownKnowledgeParser(new FrontmatterCodec());

    @Test
    void extractsFrontmatterObservationsAndRelations() {
        String text = """
                ---
                title: Coffee
                tags: "#drink, beverage"
                type: topic
                ---
                # Heading Ignored
                Intro mentions [[Espresso]] inline.
                - [method] Pour over #brewing #manual (morning)
                - pairs_with [[Tea]] (afternoon)
                - [[Milk]]
                - [ ] buy [[Beans]]
                - [link](http://example.com) not an observation
                - plain item
                - loose #tagged thought
                """;

        ParsedDraft draft = parser.parse(text, "coffee.md");

        assertThat(draft.title()).isEqualTo("Coffee");
        assertThat(draft.entityType()).isEqualTo("topic");
        assertThat(draft.tags()).containsExactly("drink", "beverage");
        assertThat(draft.hasFrontmatter()).isTrue();
        assertThat(draft.isDegraded()).isFalse();
        assertThat(draft.body()).startsWith("# Heading Ignored\n");

        assertThat(draft.observations())
                .extracting(ObservationDraft::category, ObservationDraft::content, ObservationDraft::context)
                .containsExactly(
                        tuple("method", "Pour over #brewing #manual", "morning"),
                        tuple("note", "loose #tagged thought", null));
        assertThat(draft.observations().get(0).tags()).containsExactly("brewing", "manual");

        assertThat(draft.relations())
                .extracting(RelationDraft::relationType, RelationDraft::targetTitle, RelationDraft::context)
                .containsExactly(
                        tuple("links to", "Espresso", null),
                        tuple("pairs_with", "Tea", "afternoon"),
                        tuple("relates_to", "Milk", null),
                        tuple("links to", "Beans", null));
    }

    @Test
    void titleFallsBackToHeadingThenFileName() {
        assertThat(parser.parse("intro\n## First Heading ##\nbody", "x.md").title()).isEqualTo("First Heading");
        assertThat(parser.parse("no heading here", "notes/Weekly Review.md").title()).isEqualTo("Weekly Review");
        assertThat(parser.parse("", "").title()).isEqualTo(Slugs.FALLBACK);
    }

    @Test
    void fencedCodeIsIgnored() {
        String text = """
                ```
                - [ignored] inside #code
                [[Nope]]
                ```
                ~~~
                - rel [[AlsoNope]]
                ~~~
                - [kept] outside
                """;

        ParsedDraft draft = parser.parse(text, "code.md");

        assertThat(draft.observations()).extracting(ObservationDraft::category).containsExactly("kept");
        assertThat(draft.relations()).isEmpty();
    }

    @Test
    void duplicateRelationsCollapse() {
        ParsedDraft draft = parser.parse("- [[A]]\n- [[A]]\nsee [[A]] and [[A|alias]]\n", "dup.md");

        assertThat(draft.relations())
                .extracting(RelationDraft::relationType, RelationDraft::targetTitle)
                .containsExactly(tuple("relates_to", "A"), tuple("links to", "A"));
    }

    @Test
    void malformedFrontmatterDegradesButKeepsBody() {
        ParsedDraft draft = parser.parse("---\ntitle: [unclosed\n---\n# Body Title\n- [idea] kept\n", "bad.md");

        assertThat(draft.isDegraded()).isTrue();
        assertThat(draft.hasFrontmatter()).isFalse();
        assertThat(draft.frontmatter()).isEmpty();
        assertThat(draft.title()).isEqualTo("Body Title");
        assertThat(draft.observations()).hasSize(1);
    }

    @Test
    void emptyPartsAreReportedAsProblems() {
        ParsedDraft draft = parser.parse("- [idea]\n- rel [[ ]]\n", "empty.md");

        assertThat(draft.observations()).isEmpty();
        assertThat(draft.relations()).isEmpty();
        assertThat(draft.problems()).hasSize(2);
    }

    @Test
    void byteOrderMarkIsStrippedAndInvalidUtf8Rejected() {
        byte[] withBom = "\uFEFF---\ntitle: Marked\n---\nbody".getBytes(StandardCharsets.UTF_8);

        assertThat(parser.parse(withBom, "bom.md").title()).isEqualTo("Marked");
        assertThatThrownBy(() -> parser.parse(new byte[]{(byte) 0xC3, (byte) 0x28}, "bin.md"))
                .isInstanceOf(MarkdownParseException.class);
    }

    @Test
    void tagsAcceptListsAndCommaStrings() {
        assertThat(MarkdownKnowledgeParser.parseTags(List.of("#a", "b", "#a"))).containsExactly("a", "b");
        assertThat(MarkdownKnowledgeParser.parseTags("[x, #y]")).containsExactly("x", "y");
        assertThat(MarkdownKnowledgeParser.parseTags(null)).isEmpty();
    }
}
