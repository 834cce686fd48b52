package com.my.memory.domain.exception;

public class ProjectNotFoundException extends RuntimeException {

    public ProjectNotFoundException(String project) {
        super("프로젝트를 찾을 수 없습니다: " + project);
    }
}
