package com.my.memory.domain.port.out;

import com.my.memory.domain.model.Project;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface ProjectStorePort {

    Project create(String name, String permalink, Path rootPath, boolean isDefault);

    Optional<Project> findByPermalink(String permalink);

    Optional<Project> findById(long projectId);

    Optional<Project> findDefault();

    List<Project> findAll();

    void setDefault(long projectId);

    /**
     * 프로젝트와 그에 속한 모든 행을 지운다. 파일은 건드리지 않는다.
     */
    void remove(long projectId);
}
