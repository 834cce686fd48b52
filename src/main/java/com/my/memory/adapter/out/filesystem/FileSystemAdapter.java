package com.my.memory.adapter.out.filesystem;

import com.my.memory.domain.exception.InvalidRequestException;
import com.my.memory.domain.exception.TransientIoException;
import com.my.memory.domain.model.FileSnapshot;
import com.my.memory.domain.model.ProjectScope;
import com.my.memory.domain.policy.IgnorePolicy;
import com.my.memory.domain.port.out.FilePort;
import com.my.memory.domain.service.Checksums;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 왜: 프로젝트 루트 아래 파일 읽기/쓰기를 한곳에서 처리해 경로 이탈을 막고 일시적 입출력 오류를 재시도하기 위함.
 */
@ApplicationScoped
public class FileSystemAdapter implements FilePort {

    private static final Logger log = Logger.getLogger(FileSystemAdapter.class);

    @Override
    public void ensureRoot(ProjectScope scope) {
        try {
            Files.createDirectories(scope.rootPath());
        } catch (IOException e) {
            throw new TransientIoException(scope.rootPath().toString(), e);
        }
    }

    @Override
    public List<FileSnapshot> walk(ProjectScope scope, Map<String, String> errors) {
        Path root = scope.rootPath();
        List<FileSnapshot> snapshots = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            log.warnf("프로젝트 루트가 없습니다: project=%s, root=%s", scope.permalink(), root);
            return snapshots;
        }
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && !IgnorePolicy.shouldDescend(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    String relative = relativize(root, file);
                    if (!attrs.isRegularFile() || !IgnorePolicy.shouldIndex(relative)) {
                        return FileVisitResult.CONTINUE;
                    }
                    try {
                        byte[] content = Files.readAllBytes(file);
                        snapshots.add(new FileSnapshot(relative, Checksums.sha256(content),
                                attrs.lastModifiedTime().toInstant()));
                    } catch (NoSuchFileException e) {
                        log.debugf("스캔 중 사라진 파일: %s", relative);
                    } catch (IOException e) {
                        errors.put(relative, e.getMessage());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    errors.put(relativize(root, file), String.valueOf(exc.getMessage()));
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new TransientIoException(root.toString(), e);
        }
        snapshots.sort(Comparator.comparing(FileSnapshot::path));
        return snapshots;
    }

    @Override
    @Retry(maxRetries = 3, delay = 100, retryOn = TransientIoException.class)
    @ExponentialBackoff
    public Optional<byte[]> read(ProjectScope scope, String path) {
        Path file = resolve(scope, path);
        try {
            if (!Files.isRegularFile(file)) {
                return Optional.empty();
            }
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new TransientIoException(path, e);
        }
    }

    @Override
    @Retry(maxRetries = 3, delay = 100, retryOn = TransientIoException.class)
    @ExponentialBackoff
    public String checksum(ProjectScope scope, String path) {
        try {
            return Checksums.sha256(Files.readAllBytes(resolve(scope, path)));
        } catch (IOException e) {
            throw new TransientIoException(path, e);
        }
    }

    @Override
    public boolean exists(ProjectScope scope, String path) {
        return Files.exists(resolve(scope, path));
    }

    @Override
    public boolean isDirectory(ProjectScope scope, String path) {
        return Files.isDirectory(resolve(scope, path));
    }

    @Override
    public Instant modifiedAt(ProjectScope scope, String path) {
        try {
            return Files.getLastModifiedTime(resolve(scope, path)).toInstant();
        } catch (IOException e) {
            throw new TransientIoException(path, e);
        }
    }

    /**
     * 같은 디렉터리의 숨김 임시 파일에 쓴 뒤 교체한다. 임시 파일은 무시 규칙에 걸려 색인되지 않는다.
     */
    @Override
    @Retry(maxRetries = 3, delay = 100, retryOn = TransientIoException.class)
    @ExponentialBackoff
    public String write(ProjectScope scope, String path, String content) {
        Path target = resolve(scope, path);
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        Path temp = target.resolveSibling("." + target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            Files.write(temp, bytes);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return Checksums.sha256(bytes);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new TransientIoException(path, e);
        }
    }

    @Override
    public void move(ProjectScope scope, String from, String to) {
        Path source = resolve(scope, from);
        Path target = resolve(scope, to);
        try {
            Files.createDirectories(target.getParent());
            Files.move(source, target);
        } catch (IOException e) {
            throw new TransientIoException(from, e);
        }
    }

    @Override
    public boolean delete(ProjectScope scope, String path) {
        try {
            return Files.deleteIfExists(resolve(scope, path));
        } catch (IOException e) {
            throw new TransientIoException(path, e);
        }
    }

    private static Path resolve(ProjectScope scope, String path) {
        Path root = scope.rootPath().toAbsolutePath().normalize();
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new InvalidRequestException("프로젝트 루트 밖의 경로입니다: " + path);
        }
        return resolved;
    }

    private static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debugf("임시 파일 삭제 실패: %s (%s)", temp, e.getMessage());
        }
    }
}
