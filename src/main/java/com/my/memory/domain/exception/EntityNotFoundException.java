package com.my.memory.domain.exception;

public class EntityNotFoundException extends RuntimeException {

    private final String identifier;

    public EntityNotFoundException(String identifier) {
        super("엔티티를 찾을 수 없습니다: " + identifier);
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
