package net.gpumeter.core.model;

/** 샌드박스 자원 한도. memoryLimit은 docker 표기(예: "4g") */
public record ResourceConfig(String memoryLimit, double cpuCount, int timeoutSeconds) {
    public ResourceConfig {
        if (memoryLimit == null || memoryLimit.isBlank()) throw new IllegalArgumentException("memoryLimit is required");
        if (cpuCount <= 0) throw new IllegalArgumentException("cpuCount must be positive: " + cpuCount);
        if (timeoutSeconds <= 0) throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
    }

    /** "512m", "4g" 형태를 바이트로 환산 */
    public long memoryBytes() {
        String v = memoryLimit.trim().toLowerCase();
        char unit = v.charAt(v.length() - 1);
        long mul = switch (unit) {
            case 'k' -> 1024L;
            case 'm' -> 1024L * 1024;
            case 'g' -> 1024L * 1024 * 1024;
            default -> 1L;
        };
        String digits = Character.isDigit(unit) ? v : v.substring(0, v.length() - 1);
        try {
            return Long.parseLong(digits) * mul;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid memoryLimit: " + memoryLimit, e);
        }
    }
}
