package net.gpumeter.adapter.runtime.storage;

import net.gpumeter.core.spi.BlobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 로컬(또는 공유 마운트) 파일시스템 blob 저장소.
 * 레이아웃: {root}/jobs/{jobId}/{path}
 */
public final class FileSystemBlobStore implements BlobStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemBlobStore.class);
    private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final Path root;

    public FileSystemBlobStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void write(String jobId, String path, byte[] content) throws IOException {
        Path target = resolve(jobId, path);
        Files.createDirectories(target.getParent());
        Path tmp = Files.createTempFile(target.getParent(), ".blob-", ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("blob written: {}/{} ({} bytes)", jobId, path, content.length);
    }

    @Override
    public byte[] read(String jobId, String path) throws IOException {
        return Files.readAllBytes(resolve(jobId, path));
    }

    /** prefix 아래 파일 목록 (jobs/{jobId} 기준 상대경로, '/' 구분, 정렬) */
    @Override
    public List<String> list(String jobId, String prefix) throws IOException {
        Path jobDir = jobDir(jobId);
        Path base = prefix == null || prefix.isEmpty() ? jobDir : resolve(jobId, prefix);
        if (!Files.isDirectory(base)) return List.of();
        try (Stream<Path> files = Files.walk(base)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith(".blob-"))
                    .map(p -> jobDir.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    public Path inputDir(String jobId) throws IOException {
        return Files.createDirectories(jobDir(jobId).resolve("input"));
    }

    @Override
    public Path outputDir(String jobId) throws IOException {
        return Files.createDirectories(jobDir(jobId).resolve("output"));
    }

    private Path jobDir(String jobId) {
        if (jobId == null || !JOB_ID.matcher(jobId).matches()) {
            throw new IllegalArgumentException("invalid jobId: " + jobId);
        }
        return root.resolve("jobs").resolve(jobId);
    }

    // 절대경로, '..' 로 잡 디렉터리 밖을 가리키는 경로 거부
    private Path resolve(String jobId, String path) {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("path is required");
        Path jobDir = jobDir(jobId);
        Path rel = Path.of(path);
        if (rel.isAbsolute()) throw new IllegalArgumentException("absolute path not allowed: " + path);
        Path p = jobDir.resolve(rel).normalize();
        if (!p.startsWith(jobDir) || p.equals(jobDir)) {
            throw new IllegalArgumentException("path escapes job directory: " + path);
        }
        return p;
    }
}
