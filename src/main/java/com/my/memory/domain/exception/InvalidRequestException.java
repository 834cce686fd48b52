package com.my.memory.domain.exception;

/**
 * 도구 계층에서 들어온 요청이 계약을 위반했을 때 사용한다.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
