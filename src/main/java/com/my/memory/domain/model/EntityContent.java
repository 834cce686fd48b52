package com.my.memory.domain.model;

import java.util.Map;

/**
 * 파일에서 읽은 엔티티 내용. body 는 frontmatter 를 제외한 원문 그대로다.
 */
public record EntityContent(Entity entity, Map<String, Object> frontmatter, String body, String rawText) {
}
