package com.my.memory.domain.model;

import com.my.memory.domain.exception.InvalidMemoryUrlException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryUrlTest {

    @Test
    void parsesProjectQualifiedUrls() {
        MemoryUrl url = MemoryUrl.parse("memory://work/specs/search");

        assertThat(url.project()).isEqualTo("work");
        assertThat(url.path()).isEqualTo("specs/search");
        assertThat(url.isPattern()).isFalse();
        assertThat(url).hasToString("memory://work/specs/search");
    }

    @Test
    void plainReferencesHaveNoProject() {
        MemoryUrl url = MemoryUrl.parse("  specs/*  ");

        assertThat(url.project()).isNull();
        assertThat(url.path()).isEqualTo("specs/*");
        assertThat(url.isPattern()).isTrue();
    }

    @Test
    void rejectsMalformedReferences() {
        assertThatThrownBy(() -> MemoryUrl.parse(" ")).isInstanceOf(InvalidMemoryUrlException.class);
        assertThatThrownBy(() -> MemoryUrl.parse("memory://work")).isInstanceOf(InvalidMemoryUrlException.class);
        assertThatThrownBy(() -> MemoryUrl.parse("memory://work/")).isInstanceOf(InvalidMemoryUrlException.class);
        assertThatThrownBy(() -> MemoryUrl.parse("a//b")).isInstanceOf(InvalidMemoryUrlException.class);
        assertThatThrownBy(() -> MemoryUrl.parse("what?")).isInstanceOf(InvalidMemoryUrlException.class);
        assertThatThrownBy(() -> MemoryUrl.parse("memory://work/http://x")).isInstanceOf(InvalidMemoryUrlException.class);
    }
}
