package net.gpumeter.core.model;

public enum HeartbeatVerdict {
    CONTINUE, STOP, DUPLICATE, REJECTED;

    /** 워커가 샌드박스를 내려야 하는지 */
    public boolean mustStop() {
        return this == STOP;
    }
}
