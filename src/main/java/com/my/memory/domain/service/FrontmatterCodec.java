package com.my.memory.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 문서 앞의 "---" 블록을 분리하고 YAML 로 읽고 쓴다. 키 순서는 원문 순서를 유지한다.
 */
public class FrontmatterCodec {

    private static final String DELIMITER = "---";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper yaml;

    public FrontmatterCodec() {
        this(new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.LITERAL_BLOCK_STYLE)
                .disable(YAMLGenerator.Feature.SPLIT_LINES)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)));
    }

    public FrontmatterCodec(ObjectMapper yaml) {
        this.yaml = yaml;
    }

    /**
     * frontmatter 가 없거나 닫히지 않았으면 전체가 본문이다. YAML 이 깨졌으면 값은 비우고 problem 을 채운다.
     */
    public Decoded decode(String text) {
        if (!text.startsWith(DELIMITER + "\n") && !text.startsWith(DELIMITER + "\r\n")) {
            return Decoded.absent(text);
        }
        int yamlStart = text.indexOf('\n') + 1;
        int pos = yamlStart;
        while (pos <= text.length()) {
            int eol = text.indexOf('\n', pos);
            String line = eol < 0 ? text.substring(pos) : text.substring(pos, eol);
            if (stripCarriageReturn(line).equals(DELIMITER)) {
                String block = text.substring(yamlStart, pos);
                String body = eol < 0 ? "" : text.substring(eol + 1);
                return parseBlock(block, body);
            }
            if (eol < 0) {
                break;
            }
            pos = eol + 1;
        }
        return new Decoded(new LinkedHashMap<>(), text, false, "frontmatter 가 닫히지 않았습니다.");
    }

    public String encode(Map<String, Object> values) {
        try {
            return yaml.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("frontmatter 직렬화 실패", e);
        }
    }

    private Decoded parseBlock(String block, String body) {
        if (block.isBlank()) {
            return new Decoded(new LinkedHashMap<>(), body, true, null);
        }
        try {
            LinkedHashMap<String, Object> values = yaml.readValue(block, MAP_TYPE);
            return new Decoded(values == null ? new LinkedHashMap<>() : values, body, true, null);
        } catch (JsonProcessingException e) {
            return new Decoded(new LinkedHashMap<>(), body, true,
                    "frontmatter YAML 을 해석할 수 없습니다: " + e.getOriginalMessage());
        }
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    public record Decoded(Map<String, Object> values, String body, boolean present, String problem) {

        static Decoded absent(String text) {
            return new Decoded(new LinkedHashMap<>(), text, false, null);
        }

        public boolean malformed() {
            return problem != null;
        }
    }
}
