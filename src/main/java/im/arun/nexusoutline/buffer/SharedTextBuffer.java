package im.arun.nexusoutline.buffer;

/**
 * The shared text the outline is stored in.
 *
 * Implementations wrap a replicated text type; merging concurrent edits is their concern.
 * The outline core only reads whole snapshots and writes whole replacements, each replacement
 * as a single atomic transaction so no reader observes a half-applied edit.
 */
public interface SharedTextBuffer {

    String read();

    /**
     * Increases with every committed transaction.
     */
    long version();

    /**
     * Reads text and version together.
     */
    TextSnapshot snapshot();

    /**
     * Replaces the entire text in one transaction.
     */
    void transact(String replacement);

    /**
     * Replaces the entire text only if no other transaction committed since {@code expectedVersion}.
     * The check and the write happen atomically.
     *
     * @return false, leaving the text untouched, if the buffer is no longer at {@code expectedVersion}
     */
    boolean transact(long expectedVersion, String replacement);

    void addChangeListener(BufferChangeListener listener);

    void removeChangeListener(BufferChangeListener listener);
}
