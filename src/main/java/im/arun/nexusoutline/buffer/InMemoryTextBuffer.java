package im.arun.nexusoutline.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single-process {@link SharedTextBuffer}. All access is synchronized, so a transaction is
 * never observed half-applied.
 */
public class InMemoryTextBuffer implements SharedTextBuffer {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryTextBuffer.class);

    private final List<BufferChangeListener> listeners = new CopyOnWriteArrayList<>();
    private String text;
    private long version;

    public InMemoryTextBuffer() {
        this("");
    }

    public InMemoryTextBuffer(String initialText) {
        this.text = initialText == null ? "" : initialText;
    }

    @Override
    public synchronized String read() {
        return text;
    }

    @Override
    public synchronized long version() {
        return version;
    }

    @Override
    public synchronized TextSnapshot snapshot() {
        return new TextSnapshot(text, version);
    }

    @Override
    public void transact(String replacement) {
        long committed;
        String current;
        synchronized (this) {
            committed = write(replacement);
            current = text;
        }
        notifyListeners(committed, current);
    }

    @Override
    public boolean transact(long expectedVersion, String replacement) {
        long committed;
        String current;
        synchronized (this) {
            if (version != expectedVersion) {
                logger.debug("Rejected transaction expecting version {}, buffer is at {}", expectedVersion, version);
                return false;
            }
            committed = write(replacement);
            current = text;
        }
        notifyListeners(committed, current);
        return true;
    }

    private long write(String replacement) {
        text = replacement == null ? "" : replacement;
        version++;
        return version;
    }

    private void notifyListeners(long committed, String current) {
        logger.debug("Committed version {} ({} chars)", committed, current.length());
        for (BufferChangeListener listener : listeners) {
            try {
                listener.onChange(committed, current);
            } catch (RuntimeException e) {
                logger.warn("Buffer change listener failed: {}", e.getMessage(), e);
            }
        }
    }

    @Override
    public void addChangeListener(BufferChangeListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeChangeListener(BufferChangeListener listener) {
        listeners.remove(listener);
    }
}
