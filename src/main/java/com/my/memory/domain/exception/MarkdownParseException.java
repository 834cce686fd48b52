package com.my.memory.domain.exception;

/**
 * 파일 내용을 마크다운으로 해석할 수 없는 치명적 파싱 실패. 해당 파일만 실패로 기록된다.
 */
public class MarkdownParseException extends RuntimeException {
    public MarkdownParseException(String message) {
        super(message);
    }

    public MarkdownParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
