package net.gpumeter.core.model;

public enum KillReason {
    CANCELLED, INSUFFICIENT_CREDITS, TIMEOUT, HEARTBEAT_TIMEOUT, UNKNOWN;

    public static KillReason from(String s) {
        if (s == null) return null;
        try { return KillReason.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }
    public String code() { return name().toLowerCase(); }
}
