package com.my.memory.domain.policy;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IgnorePolicyTest {

    @Test
    void indexesOrdinaryFiles() {
        assertThat(IgnorePolicy.shouldIndex("notes/a.md")).isTrue();
        assertThat(IgnorePolicy.shouldIndex("img/logo.png")).isTrue();
    }

    @Test
    void skipsHiddenAndToolDirectories() {
        assertThat(IgnorePolicy.shouldIndex(".git/config")).isFalse();
        assertThat(IgnorePolicy.shouldIndex("web/node_modules/lib/index.js")).isFalse();
        assertThat(IgnorePolicy.shouldIndex("a/.obsidian/workspace.md")).isFalse();
        assertThat(IgnorePolicy.shouldDescend("target")).isFalse();
        assertThat(IgnorePolicy.shouldDescend("projects")).isTrue();
    }

    @Test
    void skipsHiddenTemporaryAndSystemFiles() {
        assertThat(IgnorePolicy.shouldIndex(".draft.md")).isFalse();
        assertThat(IgnorePolicy.shouldIndex("notes/.a.md.tmp")).isFalse();
        assertThat(IgnorePolicy.shouldIndex("notes/a.md~")).isFalse();
        assertThat(IgnorePolicy.shouldIndex("notes/a.swp")).isFalse();
        assertThat(IgnorePolicy.shouldIndex("server.LOG")).isFalse();
        assertThat(IgnorePolicy.shouldIndex("Thumbs.db")).isFalse();
        assertThat(IgnorePolicy.shouldIndex("")).isFalse();
    }
}
