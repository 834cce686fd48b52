package com.my.memory.adapter.in.startup;

import com.my.memory.config.AppConfig;
import com.my.memory.domain.model.Project;
import com.my.memory.domain.service.ProjectService;
import com.my.memory.domain.service.SyncOrchestrator;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Path;

/**
 * 왜: 애플리케이션 시작 시 기본 프로젝트를 준비하고 모든 프로젝트의 초기 스캔과 감시를 띄우기 위함.
 */
@Startup
@ApplicationScoped
public class SyncBootstrap {

    private static final Logger log = Logger.getLogger(SyncBootstrap.class);

    private final ProjectService projectService;
    private final SyncOrchestrator orchestrator;
    private final AppConfig appConfig;

    public SyncBootstrap(ProjectService projectService, SyncOrchestrator orchestrator, AppConfig appConfig) {
        this.projectService = projectService;
        this.orchestrator = orchestrator;
        this.appConfig = appConfig;
    }

    @PostConstruct
    void start() {
        Project project = projectService.ensureProject(
                appConfig.projects().defaultName(),
                Path.of(appConfig.projects().defaultPath()));
        log.infof("기본 프로젝트: %s (%s)", project.permalink(), project.rootPath());
        orchestrator.startAll();
    }

    @PreDestroy
    void stop() {
        orchestrator.stopAll();
    }
}
