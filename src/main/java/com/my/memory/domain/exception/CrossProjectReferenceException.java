package com.my.memory.domain.exception;

/**
 * 다른 프로젝트의 엔티티나 관계를 참조하려는 시도. 쓰기 전에 거부된다.
 */
public class CrossProjectReferenceException extends RuntimeException {

    private final long projectId;
    private final long entityId;

    public CrossProjectReferenceException(long projectId, long entityId) {
        super("엔티티 " + entityId + " 는 프로젝트 " + projectId + " 에 속하지 않습니다.");
        this.projectId = projectId;
        this.entityId = entityId;
    }

    public CrossProjectReferenceException(String message) {
        super(message);
        this.projectId = -1;
        this.entityId = -1;
    }

    public long projectId() {
        return projectId;
    }

    public long entityId() {
        return entityId;
    }
}
