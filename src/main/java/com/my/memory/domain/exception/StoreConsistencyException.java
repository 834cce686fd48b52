package com.my.memory.domain.exception;

/**
 * 저장소 트랜잭션 실패나 스키마 손상. 해당 프로젝트의 동기화 작업을 ERROR 상태로 전환시킨다.
 */
public class StoreConsistencyException extends RuntimeException {
    public StoreConsistencyException(String message) {
        super(message);
    }

    public StoreConsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
