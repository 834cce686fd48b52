package com.my.memory.domain.exception;

/**
 * memory:// 참조의 형식이 올바르지 않을 때 사용한다.
 */
public class InvalidMemoryUrlException extends RuntimeException {
    public InvalidMemoryUrlException(String message) {
        super(message);
    }

    public InvalidMemoryUrlException(String message, Throwable cause) {
        super(message, cause);
    }
}
