package com.my.memory.domain.service;

import com.my.memory.domain.exception.ProjectNotFoundException;
import com.my.memory.domain.model.Project;
import com.my.memory.domain.port.out.ProjectStorePort;

/**
 * 도구 계층의 프로젝트 인자를 해석한다. null 이나 빈 값은 기본 프로젝트다.
 */
public class ProjectResolver {

    private final ProjectStorePort projects;

    public ProjectResolver(ProjectStorePort projects) {
        this.projects = projects;
    }

    public Project resolve(String project) {
        if (project == null || project.isBlank()) {
            return projects.findDefault().orElseThrow(() -> new ProjectNotFoundException("(default)"));
        }
        return projects.findByPermalink(project.strip())
                .or(() -> projects.findByPermalink(Slugs.slugify(project)))
                .orElseThrow(() -> new ProjectNotFoundException(project));
    }
}
