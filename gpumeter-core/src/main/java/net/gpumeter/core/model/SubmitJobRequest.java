package net.gpumeter.core.model;

import java.util.Map;

public record SubmitJobRequest(
        String ownerId,
        String dockerImage,
        String scriptName,
        ResourceConfig resources,
        Map<String, byte[]> inputs     // 입력 마운트 기준 상대 경로 → 내용
) {
    public SubmitJobRequest {
        inputs = inputs == null ? Map.of() : Map.copyOf(inputs);
    }
}
