package com.my.memory.domain.exception;

/**
 * 파일 감시 이벤트가 유실되었거나 큐가 가득 찼음을 알린다. 전체 재스캔으로 복구된다.
 */
public class WatchStreamOverflowException extends RuntimeException {
    public WatchStreamOverflowException(String message) {
        super(message);
    }

    public WatchStreamOverflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
