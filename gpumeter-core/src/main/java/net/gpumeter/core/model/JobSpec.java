package net.gpumeter.core.model;

/** 워커가 실행에 필요로 하는 잡 사본 */
public record JobSpec(
        String jobId,
        String ownerId,
        String dockerImage,
        String scriptName,
        ResourceConfig resources,
        int tickSeconds
) {}
