package com.my.memory.domain.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * frontmatter 와 본문을 다시 하나의 마크다운 문서로 합친다. 본문은 바이트 단위로 보존된다.
 */
public class MarkdownWriter {

    private static final List<String> LEADING_KEYS = List.of("title", "type", "permalink", "tags");

    private final FrontmatterCodec codec;

    public MarkdownWriter(FrontmatterCodec codec) {
        this.codec = codec;
    }

    public String compose(Map<String, Object> frontmatter, String body) {
        if (frontmatter == null || frontmatter.isEmpty()) {
            return body;
        }
        String yaml = codec.encode(ordered(frontmatter));
        if (!yaml.endsWith("\n")) {
            yaml = yaml + "\n";
        }
        return "---\n" + yaml + "---\n" + body;
    }

    /**
     * title, type, permalink, tags 를 앞에 두고 나머지 키는 기존 순서를 따른다.
     */
    static Map<String, Object> ordered(Map<String, Object> frontmatter) {
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String key : LEADING_KEYS) {
            if (frontmatter.containsKey(key)) {
                ordered.put(key, frontmatter.get(key));
            }
        }
        frontmatter.forEach(ordered::putIfAbsent);
        return ordered;
    }
}
