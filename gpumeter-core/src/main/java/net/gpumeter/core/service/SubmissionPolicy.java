package net.gpumeter.core.service;

/**
 * 제출 검증 한도.
 *
 * @param maxActiveJobsPerUser 사용자당 비터미널 잡 수 한도
 * @param maxTimeoutSeconds    resource_config.timeout_seconds 상한
 * @param maxCpuCount          cpu 상한
 * @param maxMemoryBytes       메모리 상한
 * @param maxInputBytes        입력 파일 총합 상한
 */
public record SubmissionPolicy(
        int maxActiveJobsPerUser,
        int maxTimeoutSeconds,
        double maxCpuCount,
        long maxMemoryBytes,
        long maxInputBytes
) {
    public static SubmissionPolicy defaults() {
        return new SubmissionPolicy(3, 14_400, 16, 64L * 1024 * 1024 * 1024, 500L * 1024 * 1024);
    }
}
