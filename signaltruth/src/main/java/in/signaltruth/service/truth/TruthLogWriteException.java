package in.signaltruth.service.truth;

import java.nio.file.Path;

/**
 * A truth-log partition could not be written. The result was not persisted.
 */
public class TruthLogWriteException extends RuntimeException {

    private final Path partition;

    public TruthLogWriteException(Path partition, Throwable cause) {
        super("Failed to append to truth log " + partition + ": " + cause.getMessage(), cause);
        this.partition = partition;
    }

    public Path getPartition() {
        return partition;
    }
}
