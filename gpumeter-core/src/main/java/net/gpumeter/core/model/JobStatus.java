package net.gpumeter.core.model;

/**
 * 잡 상태 머신.
 * PENDING → PREPARING → RUNNING → {COMPLETED | FAILED | CANCELLED | KILLED_NO_CREDITS}
 * 추가로 PENDING → {CANCELLED | FAILED}, PREPARING → {FAILED | CANCELLED}.
 * 터미널 상태는 흡수 상태.
 */
public enum JobStatus {
    PENDING, PREPARING, RUNNING, COMPLETED, FAILED, CANCELLED, KILLED_NO_CREDITS, UNKNOWN;

    public static JobStatus from(String s) {
        if (s == null) return UNKNOWN;
        try { return JobStatus.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }

    public String code() { return name().toLowerCase(); }

    public boolean isTerminal() {
        return switch (this) {
            case COMPLETED, FAILED, CANCELLED, KILLED_NO_CREDITS -> true;
            case PENDING, PREPARING, RUNNING, UNKNOWN -> false;
        };
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == PREPARING || next == CANCELLED || next == FAILED;
            case PREPARING -> next == RUNNING || next == FAILED || next == CANCELLED;
            case RUNNING -> next == COMPLETED || next == FAILED || next == CANCELLED || next == KILLED_NO_CREDITS;
            case COMPLETED, FAILED, CANCELLED, KILLED_NO_CREDITS, UNKNOWN -> false;
        };
    }

    /** 불법 전이는 IllegalStateException */
    public void checkTransition(JobStatus next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("illegal job transition " + this + " -> " + next);
        }
    }
}
