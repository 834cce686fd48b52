package com.my.memory.domain.exception;

/**
 * 일시적인 파일 입출력 실패. 재시도 후에도 실패하면 해당 경로는 재스캔 대기로 표시된다.
 */
public class TransientIoException extends RuntimeException {

    private final String path;

    public TransientIoException(String path, Throwable cause) {
        super("파일 입출력 실패: " + path, cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
