package com.my.memory.domain.service;

import com.my.memory.domain.model.Entity;

/**
 * [[Target|alias]] 형태의 링크 텍스트를 정규화하고 엔티티와 맞춰 본다.
 */
public final class LinkText {

    private LinkText() {
    }

    public static String normalize(String linkText) {
        if (linkText == null) {
            return "";
        }
        String text = linkText.strip();
        if (text.startsWith("[[") && text.endsWith("]]")) {
            text = text.substring(2, text.length() - 2);
        }
        int pipe = text.indexOf('|');
        if (pipe >= 0) {
            text = text.substring(0, pipe);
        }
        return text.strip();
    }

    /**
     * permalink, 제목(대소문자 무시 포함), 파일 경로, ".md" 를 붙인 파일 경로 순서로 비교한다.
     */
    public static boolean matches(String linkText, Entity entity) {
        String target = normalize(linkText);
        if (target.isEmpty()) {
            return false;
        }
        return target.equals(entity.permalink())
                || target.equalsIgnoreCase(entity.title())
                || target.equals(entity.filePath())
                || (target + ".md").equals(entity.filePath());
    }
}
