package com.my.memory.domain.service;

import com.my.memory.domain.exception.MarkdownParseException;
import com.my.memory.domain.model.ObservationDraft;
import com.my.memory.domain.model.ParsedDraft;
import com.my.memory.domain.model.RelationDraft;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 마크다운 문서에서 제목, 태그, 관찰, 관계를 뽑아낸다. 순수 함수이며 파일 시스템이나 저장소에 접근하지 않는다.
 *
 * <ul>
 *   <li>관찰: {@code - [category] 내용 #tag (context)}, 카테고리가 없으면 #tag 가 하나 이상 있어야 한다.</li>
 *   <li>관계: {@code - relation_type [[Target]] (context)}, 유형이 없으면 relates_to.</li>
 *   <li>그 밖의 {@code [[Target]]} 은 "links to" 관계가 된다.</li>
 * </ul>
 * 코드 블록 안의 줄은 무시한다.
 */
public class MarkdownKnowledgeParser {

    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*[-*+]\\s+(.*)$");
    private static final Pattern HEADING = Pattern.compile("^#{1,6}\\s+(.+?)\\s*#*\\s*$");
    private static final Pattern TASK_MARKER = Pattern.compile("^\\[[ xX-]]\\s.*|^\\[[ xX-]]$");
    private static final Pattern WIKI_LINK = Pattern.compile("\\[\\[([^\\[\\]]*)]]");
    private static final Pattern TAG_TRAILING_PUNCTUATION = Pattern.compile("[.,;:!?)]+$");

    private final FrontmatterCodec codec;

    public MarkdownKnowledgeParser(FrontmatterCodec codec) {
        this.codec = codec;
    }

    /**
     * @throws MarkdownParseException UTF-8 로 해석할 수 없는 바이트일 때
     */
    public ParsedDraft parse(byte[] raw, String filePath) {
        return parse(decode(raw, filePath), filePath);
    }

    public ParsedDraft parse(String text, String filePath) {
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        List<String> problems = new ArrayList<>();
        FrontmatterCodec.Decoded decoded = codec.decode(text);
        if (decoded.malformed()) {
            problems.add(decoded.problem());
        }
        Map<String, Object> frontmatter = decoded.values();
        String body = decoded.body();

        List<ObservationDraft> observations = new ArrayList<>();
        Map<String, RelationDraft> relations = new LinkedHashMap<>();
        String heading = scanBody(body, observations, relations, problems);

        String title = firstNonBlank(scalar(frontmatter.get("title")), heading, Slugs.stem(filePath));
        if (title == null || title.isBlank()) {
            title = Slugs.FALLBACK;
        }
        return new ParsedDraft(
                title,
                scalar(frontmatter.get("type")),
                scalar(frontmatter.get("permalink")),
                parseTags(frontmatter.get("tags")),
                frontmatter,
                decoded.present() && !decoded.malformed(),
                body,
                observations,
                new ArrayList<>(relations.values()),
                problems);
    }

    /**
     * 리스트, 쉼표 구분 문자열, 단일 값을 모두 허용하고 앞의 '#' 은 떼어 낸다.
     */
    public static List<String> parseTags(Object value) {
        Set<String> tags = new LinkedHashSet<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                addTag(tags, item == null ? null : String.valueOf(item));
            }
        } else if (value != null) {
            String text = String.valueOf(value).strip();
            if (text.startsWith("[") && text.endsWith("]")) {
                text = text.substring(1, text.length() - 1);
            }
            for (String part : text.split(",")) {
                addTag(tags, part);
            }
        }
        return new ArrayList<>(tags);
    }

    private String scanBody(String body, List<ObservationDraft> observations,
                            Map<String, RelationDraft> relations, List<String> problems) {
        String heading = null;
        String fence = null;
        for (String rawLine : body.split("\n", -1)) {
            String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
            String trimmed = line.strip();
            if (fence != null) {
                if (trimmed.startsWith(fence)) {
                    fence = null;
                }
                continue;
            }
            if (trimmed.startsWith("```") || trimmed.startsWith("~~~")) {
                fence = trimmed.substring(0, 3);
                continue;
            }
            if (heading == null) {
                Matcher headingMatcher = HEADING.matcher(trimmed);
                if (headingMatcher.matches()) {
                    heading = headingMatcher.group(1).strip();
                    continue;
                }
            }
            Matcher item = LIST_ITEM.matcher(line);
            if (item.matches()) {
                parseListItem(item.group(1).strip(), observations, relations, problems);
            } else {
                addInlineLinks(line, relations);
            }
        }
        return heading;
    }

    private void parseListItem(String item, List<ObservationDraft> observations,
                               Map<String, RelationDraft> relations, List<String> problems) {
        if (TASK_MARKER.matcher(item).matches()) {
            addInlineLinks(item, relations);
            return;
        }
        if (isCategorized(item)) {
            int close = item.indexOf(']');
            String category = item.substring(1, close).strip();
            String rest = item.substring(close + 1).strip();
            if (rest.isEmpty()) {
                problems.add("내용이 없는 관찰: " + item);
                return;
            }
            observations.add(observation(category, rest));
            addInlineLinks(rest, relations);
            return;
        }
        int open = item.indexOf("[[");
        if (open >= 0 && item.indexOf("]]", open) > open) {
            parseRelation(item, open, relations, problems);
            return;
        }
        if (hasHashtag(item)) {
            observations.add(observation(ObservationDraft.DEFAULT_CATEGORY, item));
        }
    }

    private void parseRelation(String item, int open, Map<String, RelationDraft> relations, List<String> problems) {
        int close = item.indexOf("]]", open);
        String relationType = item.substring(0, open).strip();
        String target = LinkText.normalize(item.substring(open + 2, close));
        String after = item.substring(close + 2).strip();
        if (target.isEmpty()) {
            problems.add("대상이 없는 관계: " + item);
            return;
        }
        String context = null;
        if (after.startsWith("(") && after.endsWith(")")) {
            context = after.substring(1, after.length() - 1).strip();
            after = "";
        }
        put(relations, new RelationDraft(relationType, target, context));
        addInlineLinks(after, relations);
    }

    private static boolean isCategorized(String item) {
        if (!item.startsWith("[") || item.startsWith("[[")) {
            return false;
        }
        int close = item.indexOf(']');
        if (close <= 1) {
            return false;
        }
        // [text](url) 는 링크다.
        return close + 1 >= item.length() || item.charAt(close + 1) != '(';
    }

    private static ObservationDraft observation(String category, String text) {
        String content = text;
        String context = null;
        if (content.endsWith(")")) {
            int open = content.lastIndexOf('(');
            if (open > 0) {
                context = content.substring(open + 1, content.length() - 1).strip();
                content = content.substring(0, open).strip();
            }
        }
        Set<String> tags = new LinkedHashSet<>();
        for (String token : content.split("\\s+")) {
            if (!token.startsWith("#")) {
                continue;
            }
            for (String part : token.split("#")) {
                addTag(tags, TAG_TRAILING_PUNCTUATION.matcher(part).replaceAll(""));
            }
        }
        return new ObservationDraft(category, content, tags, context == null || context.isEmpty() ? null : context);
    }

    private static boolean hasHashtag(String text) {
        for (String token : text.split("\\s+")) {
            if (token.length() > 1 && token.startsWith("#") && token.charAt(1) != '#') {
                return true;
            }
        }
        return false;
    }

    private static void addInlineLinks(String text, Map<String, RelationDraft> relations) {
        Matcher matcher = WIKI_LINK.matcher(text);
        while (matcher.find()) {
            String target = LinkText.normalize(matcher.group(1));
            if (!target.isEmpty()) {
                put(relations, new RelationDraft(RelationDraft.INLINE_LINK_TYPE, target, null));
            }
        }
    }

    private static void put(Map<String, RelationDraft> relations, RelationDraft draft) {
        relations.putIfAbsent(draft.relationType() + "\u0000" + draft.targetTitle(), draft);
    }

    private static void addTag(Set<String> tags, String raw) {
        if (raw == null) {
            return;
        }
        String tag = raw.strip();
        while (tag.startsWith("#")) {
            tag = tag.substring(1);
        }
        if (!tag.isEmpty()) {
            tags.add(tag);
        }
    }

    private static String scalar(Object value) {
        if (value == null || value instanceof Map || value instanceof Collection) {
            return null;
        }
        String text = String.valueOf(value).strip();
        return text.isEmpty() ? null : text;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String decode(byte[] raw, String filePath) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MarkdownParseException("UTF-8 로 읽을 수 없는 파일입니다: " + filePath, e);
        }
    }
}
