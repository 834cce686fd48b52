package com.my.memory.domain.port.out;

import com.my.memory.domain.model.FileSnapshot;
import com.my.memory.domain.model.ProjectScope;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 프로젝트 루트 기준 상대 경로로 동작하는 파일 시스템 추상화. 경로 구분자는 항상 '/' 이다.
 */
public interface FilePort {

    /**
     * 프로젝트 루트 디렉터리가 없으면 만든다.
     */
    void ensureRoot(ProjectScope scope);

    /**
     * 무시 규칙을 적용해 색인 대상 파일을 모두 나열한다. 개별 파일 오류는 errors 에 담긴다.
     */
    List<FileSnapshot> walk(ProjectScope scope, Map<String, String> errors);

    /**
     * 파일 바이트를 읽는다. 파일이 없으면 빈 값을 돌려준다.
     */
    Optional<byte[]> read(ProjectScope scope, String path);

    String checksum(ProjectScope scope, String path);

    boolean exists(ProjectScope scope, String path);

    boolean isDirectory(ProjectScope scope, String path);

    Instant modifiedAt(ProjectScope scope, String path);

    /**
     * 임시 파일에 쓰고 원자적으로 교체한다. 새 checksum 을 돌려준다.
     */
    String write(ProjectScope scope, String path, String content);

    void move(ProjectScope scope, String from, String to);

    boolean delete(ProjectScope scope, String path);
}
