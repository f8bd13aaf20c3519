package net.gpumeter.core.spi;

import java.nio.file.Path;
import java.util.List;

/** 잡 단위 공유 저장소 (jobs/{jobId}/input, jobs/{jobId}/output, jobs/{jobId}/logs) */
public interface BlobStore {
    void write(String jobId, String path, byte[] content) throws Exception;

    byte[] read(String jobId, String path) throws Exception;

    List<String> list(String jobId, String prefix) throws Exception;

    /** 샌드박스 read-only 마운트 원본 */
    Path inputDir(String jobId) throws Exception;

    /** 샌드박스 writable 마운트 원본 */
    Path outputDir(String jobId) throws Exception;
}
