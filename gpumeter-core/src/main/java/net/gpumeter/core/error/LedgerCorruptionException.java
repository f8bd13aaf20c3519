package net.gpumeter.core.error;

/** 치명적: 해당 사용자의 지갑 변경을 수동 정산 전까지 중단 */
public class LedgerCorruptionException extends GpuMeterException {
    private final String userId;

    public LedgerCorruptionException(String userId, String message) {
        super(message);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
