package net.gpumeter.core.model;

/** job.exit_reason 값 */
public final class ExitReasons {
    public static final String COMPLETED = "completed";
    public static final String INSUFFICIENT_CREDITS = "insufficient_credits";
    public static final String HEARTBEAT_TIMEOUT = "heartbeat_timeout";
    public static final String TIMEOUT = "timeout";
    public static final String CANCELLED_BY_USER = "cancelled_by_user";
    public static final String KILL_ACK_TIMEOUT = "kill_ack_timeout";
    public static final String SANDBOX_CREATION_FAILED = "sandbox_creation_failed";
    public static final String OOM_KILLED = "oom_killed";
    public static final String INPUT_UPLOAD_FAILED = "input_upload_failed";
    public static final String DISPATCH_FAILED = "dispatch_failed";
    public static final String CONTROLLER_UNREACHABLE = "controller_unreachable";
    public static final String BILLING_HALTED = "billing_halted";
    public static final String PREPARING_TIMEOUT = "preparing_timeout";

    private ExitReasons() {}

    public static String exitCode(int code) {
        return "exit_code:" + code;
    }
}
