package com.my.memory.domain.service;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 제목과 경로를 URL 에 안전한 식별자와 파일 이름으로 바꾼다. 라틴 문자는 음역하고 CJK 등은 그대로 둔다.
 */
public final class Slugs {

    public static final String FALLBACK = "untitled";

    private static final int MAX_LENGTH = 120;
    private static final int MAX_FILE_NAME_LENGTH = 100;

    private static final Map<Integer, String> TRANSLITERATION = Map.ofEntries(
            Map.entry((int) 'ø', "o"),
            Map.entry((int) 'å', "a"),
            Map.entry((int) 'æ', "ae"),
            Map.entry((int) 'œ', "oe"),
            Map.entry((int) 'ß', "ss"),
            Map.entry((int) 'ł', "l"),
            Map.entry((int) 'đ', "d"),
            Map.entry((int) 'ð', "d"),
            Map.entry((int) 'þ', "th"),
            Map.entry((int) 'ı', "i")
    );

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(\\p{Ll})(\\p{Lu})");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\p{Z}_/\\\\.]+");
    private static final Pattern DISALLOWED = Pattern.compile("[^\\p{L}\\p{N}-]");
    private static final Pattern HYPHEN_RUNS = Pattern.compile("-{2,}");
    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^\\p{L}\\p{N}_-]");
    private static final Pattern UNDERSCORE_RUNS = Pattern.compile("_{2,}");

    private Slugs() {
    }

    /**
     * "Café Society" → "cafe-society", "dataModel v2" → "data-model-v2", "커피 노트" → "커피-노트".
     */
    public static String slugify(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String transliterated = transliterate(text.strip());
        String hyphenated = CAMEL_BOUNDARY.matcher(transliterated).replaceAll("$1-$2");
        String lower = hyphenated.toLowerCase(Locale.ROOT);
        String separated = SEPARATORS.matcher(lower).replaceAll("-");
        String cleaned = DISALLOWED.matcher(separated).replaceAll("");
        String collapsed = HYPHEN_RUNS.matcher(cleaned).replaceAll("-");
        return trimHyphens(truncate(trimHyphens(collapsed), MAX_LENGTH));
    }

    /**
     * 제목에서 파생한 슬러그가 비면 파일 이름, 그것도 비면 "untitled" 를 쓴다.
     */
    public static String slugOrFallback(String title, String filePath) {
        String slug = slugify(title);
        if (!slug.isEmpty()) {
            return slug;
        }
        slug = slugify(stem(filePath));
        return slug.isEmpty() ? FALLBACK : slug;
    }

    public static String fileName(String title) {
        if (title == null || title.isBlank()) {
            return FALLBACK;
        }
        String name = title.strip().replace(':', '-').replace('.', '_');
        name = UNSAFE_FILE_CHARS.matcher(name).replaceAll("_");
        name = UNDERSCORE_RUNS.matcher(name).replaceAll("_");
        name = trim(name, '_');
        if (name.length() > MAX_FILE_NAME_LENGTH) {
            name = trim(name.substring(0, MAX_FILE_NAME_LENGTH), '_');
        }
        return name.isEmpty() ? FALLBACK : name;
    }

    public static String stem(String filePath) {
        if (filePath == null) {
            return "";
        }
        String name = filePath.replace('\\', '/');
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String transliterate(String text) {
        StringBuilder out = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            String mapped = TRANSLITERATION.get(Character.toLowerCase(cp));
            if (mapped != null) {
                out.append(Character.isUpperCase(cp) ? mapped.toUpperCase(Locale.ROOT) : mapped);
            } else if (Character.UnicodeScript.of(cp) == Character.UnicodeScript.LATIN) {
                String decomposed = Normalizer.normalize(new String(Character.toChars(cp)), Normalizer.Form.NFD);
                out.append(COMBINING_MARKS.matcher(decomposed).replaceAll(""));
            } else {
                out.appendCodePoint(cp);
            }
        });
        return Normalizer.normalize(out, Normalizer.Form.NFC);
    }

    private static String truncate(String value, int max) {
        if (value.codePointCount(0, value.length()) <= max) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, max));
    }

    private static String trimHyphens(String value) {
        return trim(value, '-');
    }

    private static String trim(String value, char c) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == c) {
            start++;
        }
        while (end > start && value.charAt(end - 1) == c) {
            end--;
        }
        return value.substring(start, end);
    }
}
