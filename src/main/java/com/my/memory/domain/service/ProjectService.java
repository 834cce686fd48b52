package com.my.memory.domain.service;

import com.my.memory.domain.exception.InvalidRequestException;
import com.my.memory.domain.model.Project;
import com.my.memory.domain.port.in.ManageProjectUseCase;
import com.my.memory.domain.port.out.ProjectStorePort;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public class ProjectService implements ManageProjectUseCase {

    private static final Logger log = Logger.getLogger(ProjectService.class);

    private final ProjectStorePort projects;
    private final ProjectResolver resolver;
    private final SyncOrchestrator sync;

    public ProjectService(ProjectStorePort projects, SyncOrchestrator sync) {
        this.projects = projects;
        this.resolver = new ProjectResolver(projects);
        this.sync = sync;
    }

    /**
     * 프로젝트를 등록하고 곧바로 동기화를 시작한다. 첫 프로젝트는 항상 기본 프로젝트가 된다.
     */
    @Override
    public Project createProject(String name, Path rootPath, boolean makeDefault) {
        Project project = register(name, rootPath, makeDefault);
        sync.start(project);
        return project;
    }

    /**
     * 시작 시 설정된 기본 프로젝트가 없으면 만든다. 동기화는 시작하지 않는다.
     */
    public Project ensureProject(String name, Path rootPath) {
        Optional<Project> existing = projects.findByPermalink(Slugs.slugify(name));
        if (existing.isPresent()) {
            if (projects.findDefault().isEmpty()) {
                projects.setDefault(existing.get().id());
            }
            return existing.get();
        }
        return register(name, rootPath, projects.findDefault().isEmpty());
    }

    @Override
    public List<Project> listProjects() {
        return projects.findAll();
    }

    @Override
    public void removeProject(String project) {
        Project resolved = resolver.resolve(project);
        if (resolved.isDefault() && projects.findAll().size() > 1) {
            throw new InvalidRequestException("기본 프로젝트는 지울 수 없습니다. 다른 프로젝트를 먼저 기본으로 지정하세요.");
        }
        sync.stop(resolved.id());
        projects.remove(resolved.id());
        log.infof("프로젝트 삭제: project=%s (파일은 유지)", resolved.permalink());
    }

    @Override
    public Project setDefaultProject(String project) {
        Project resolved = resolver.resolve(project);
        projects.setDefault(resolved.id());
        return projects.findById(resolved.id()).orElse(resolved);
    }

    private Project register(String name, Path rootPath, boolean makeDefault) {
        if (name == null || name.isBlank()) {
            throw new InvalidRequestException("프로젝트 이름은 비어 있을 수 없습니다.");
        }
        String permalink = Slugs.slugify(name);
        if (permalink.isEmpty()) {
            throw new InvalidRequestException("프로젝트 이름으로 식별자를 만들 수 없습니다: " + name);
        }
        if (projects.findByPermalink(permalink).isPresent()) {
            throw new InvalidRequestException("이미 있는 프로젝트입니다: " + permalink);
        }
        boolean isDefault = makeDefault || projects.findDefault().isEmpty();
        Project project = projects.create(name, permalink, rootPath.toAbsolutePath().normalize(), isDefault);
        log.infof("프로젝트 등록: project=%s, root=%s, default=%s", permalink, project.rootPath(), isDefault);
        return project;
    }
}
