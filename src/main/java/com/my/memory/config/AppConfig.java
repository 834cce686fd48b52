package com.my.memory.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

@StaticInitSafe
@ConfigMapping(prefix = "memory")
public interface AppConfig {

    DatabaseConfig database();

    ProjectsConfig projects();

    SyncConfig sync();

    ContextConfig context();

    interface DatabaseConfig {
        @WithName("path")
        @WithDefault("./data/memory.db")
        String path();

        @WithName("busy-timeout-ms")
        @WithDefault("5000")
        long busyTimeoutMs();
    }

    interface ProjectsConfig {
        @WithName("default-name")
        @WithDefault("main")
        String defaultName();

        @WithName("default-path")
        @WithDefault("./data/main")
        String defaultPath();
    }

    interface SyncConfig {
        @WithName("watch-enabled")
        @WithDefault("true")
        boolean watchEnabled();

        @WithName("debounce-ms")
        @WithDefault("1000")
        long debounceMs();

        @WithName("queue-capacity")
        @WithDefault("256")
        int queueCapacity();

        @WithName("max-scan-seconds")
        @WithDefault("300")
        long maxScanSeconds();

        @WithName("update-permalinks-on-move")
        @WithDefault("false")
        boolean updatePermalinksOnMove();

        @WithName("write-permalinks")
        @WithDefault("true")
        boolean writePermalinks();
    }

    interface ContextConfig {
        @WithName("max-depth")
        @WithDefault("5")
        int maxDepth();
    }
}
