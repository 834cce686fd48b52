package com.my.memory.domain.policy;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 색인 대상 경로를 판별하는 고정 규칙. 상태가 없고 같은 입력에 항상 같은 결과를 낸다.
 */
public final class IgnorePolicy {

    private static final Set<String> IGNORED_DIRECTORIES = Set.of(
            "node_modules", "vendor", "bower_components",
            "dist", "build", "target", "out", "coverage",
            "__pycache__", "venv", "env",
            ".git", ".svn", ".hg", ".idea", ".vscode", ".gradle", ".cargo",
            ".tox", ".pytest_cache", ".venv", ".next", ".nuxt", ".obsidian", ".trash"
    );

    private static final Set<String> IGNORED_FILES = Set.of(
            ".DS_Store", "Thumbs.db", "desktop.ini"
    );

    private static final List<String> IGNORED_SUFFIXES = List.of(
            ".tmp", ".temp", ".swp", ".swo", ".bak", ".log", ".part", ".crdownload", "~"
    );

    private IgnorePolicy() {
    }

    /**
     * 프로젝트 루트 기준 상대 경로가 색인 대상인지 판단한다.
     */
    public static boolean shouldIndex(Path relativePath) {
        if (relativePath == null || relativePath.getNameCount() == 0) {
            return false;
        }
        int last = relativePath.getNameCount() - 1;
        for (int i = 0; i < last; i++) {
            if (!shouldDescend(relativePath.getName(i).toString())) {
                return false;
            }
        }
        return shouldIndexFile(relativePath.getName(last).toString());
    }

    public static boolean shouldIndex(String relativePath) {
        return relativePath != null && !relativePath.isBlank() && shouldIndex(Path.of(relativePath));
    }

    /**
     * 전체 스캔이 하위 디렉터리로 내려갈지 판단한다. 제외된 디렉터리는 통째로 건너뛴다.
     */
    public static boolean shouldDescend(String directoryName) {
        if (directoryName.isEmpty()) {
            return true;
        }
        if (directoryName.startsWith(".")) {
            return false;
        }
        return !IGNORED_DIRECTORIES.contains(directoryName);
    }

    private static boolean shouldIndexFile(String fileName) {
        if (fileName.isEmpty() || fileName.startsWith(".")) {
            return false;
        }
        if (IGNORED_FILES.contains(fileName)) {
            return false;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String suffix : IGNORED_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                return false;
            }
        }
        return true;
    }
}
