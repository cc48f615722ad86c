package im.arun.nexusoutline.buffer;

/**
 * Thrown when line mutations computed from one snapshot are committed against a buffer that
 * has moved on, or when a snapshot is committed twice.
 */
public class StaleSnapshotException extends RuntimeException {

    public StaleSnapshotException(String message) {
        super(message);
    }
}
