package com.my.memory.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.nio.file.Files;
import java.nio.file.Path;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean isProd = LaunchMode.current() == LaunchMode.NORMAL;
        validateRequired("memory.projects.default-name", appConfig.projects().defaultName(), true);
        validatePath("memory.projects.default-path", appConfig.projects().defaultPath(), isProd);
        validateParent("memory.database.path", appConfig.database().path(), isProd);
        validatePositive("memory.sync.queue-capacity", appConfig.sync().queueCapacity());
        validatePositive("memory.context.max-depth", appConfig.context().maxDepth());
        if (appConfig.sync().debounceMs() < 0) {
            throw new IllegalStateException("memory.sync.debounce-ms 는 음수일 수 없습니다.");
        }
    }

    private void validateRequired(String name, String value, boolean strict) {
        if (value == null || value.isBlank()) {
            String message = "필수 설정이 비어 있습니다: " + name;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    private void validatePath(String name, String path, boolean strict) {
        Path resolved = Path.of(path);
        if (!Files.isDirectory(resolved)) {
            String message = "경로가 존재하지 않습니다: " + name + "=" + path;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message + " (시작 시 생성)");
        }
    }

    private void validateParent(String name, String path, boolean strict) {
        Path parent = Path.of(path).toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            String message = "상위 디렉터리가 존재하지 않습니다: " + name + "=" + path;
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message + " (시작 시 생성)");
        }
    }

    private void validatePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalStateException(name + " 는 1 이상이어야 합니다: " + value);
        }
    }
}
