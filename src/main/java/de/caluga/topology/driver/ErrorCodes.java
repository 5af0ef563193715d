package de.caluga.topology.driver;

import java.util.Set;
import java.util.TreeSet;

/**
 * server error codes the driver classifies errors by
 */
public final class ErrorCodes {
    public static final int HOST_UNREACHABLE = 6;
    public static final int HOST_NOT_FOUND = 7;
    public static final int MAX_TIME_MS_EXPIRED = 50;
    public static final int WRITE_CONCERN_FAILED = 64;
    public static final int NETWORK_TIMEOUT = 89;
    public static final int INTERRUPTED_AT_SHUTDOWN = 11600;
    public static final int SHUTDOWN_IN_PROGRESS = 91;
    public static final int NOT_WRITABLE_PRIMARY = 10107;
    public static final int NOT_PRIMARY_NO_SECONDARY_OK = 13435;
    public static final int INTERRUPTED_DUE_TO_REPL_STATE_CHANGE = 11602;
    public static final int NOT_PRIMARY_OR_SECONDARY = 13436;
    public static final int PRIMARY_STEPPED_DOWN = 189;
    public static final int SOCKET_EXCEPTION = 9001;

    public static final Set<Integer> SHUTDOWN_CODES = Set.of(INTERRUPTED_AT_SHUTDOWN, SHUTDOWN_IN_PROGRESS);
    public static final Set<Integer> NOT_PRIMARY_CODES;
    public static final Set<Integer> RETRYABLE_CODES;
    public static final Set<Integer> UNKNOWN_COMMIT_CODES;

    static {
        Set<Integer> s = new TreeSet<>(SHUTDOWN_CODES);
        s.add(NOT_WRITABLE_PRIMARY);
        s.add(NOT_PRIMARY_NO_SECONDARY_OK);
        s.add(INTERRUPTED_DUE_TO_REPL_STATE_CHANGE);
        s.add(NOT_PRIMARY_OR_SECONDARY);
        s.add(PRIMARY_STEPPED_DOWN);
        NOT_PRIMARY_CODES = Set.copyOf(s);
        s.add(HOST_NOT_FOUND);
        s.add(HOST_UNREACHABLE);
        s.add(NETWORK_TIMEOUT);
        s.add(SOCKET_EXCEPTION);
        RETRYABLE_CODES = Set.copyOf(s);
        s.add(WRITE_CONCERN_FAILED);
        s.add(MAX_TIME_MS_EXPIRED);
        UNKNOWN_COMMIT_CODES = Set.copyOf(s);
    }

    private ErrorCodes() {
    }

    public static boolean isRetryable(Integer code) {
        return code != null && RETRYABLE_CODES.contains(code);
    }

    public static boolean isNotPrimary(Integer code) {
        return code != null && NOT_PRIMARY_CODES.contains(code);
    }

    public static boolean isShutdown(Integer code) {
        return code != null && SHUTDOWN_CODES.contains(code);
    }

    /**
     * codes after which the outcome of a commit is unknown
     */
    public static boolean isUnknownCommit(Integer code) {
        return code != null && UNKNOWN_COMMIT_CODES.contains(code);
    }
}
