package in.signaltruth.domain.common;

import java.nio.file.Path;

/**
 * Outcome of a truth-log write. Rejections are policy decisions; I/O failures are thrown instead.
 */
public record LogResult(Status status, String reason, Path partition) {

    public enum Status {
        LOGGED,
        REJECTED
    }

    public static LogResult logged(Path partition) {
        return new LogResult(Status.LOGGED, null, partition);
    }

    public static LogResult rejected(String reason) {
        return new LogResult(Status.REJECTED, reason, null);
    }

    public boolean isLogged() {
        return status == Status.LOGGED;
    }
}
