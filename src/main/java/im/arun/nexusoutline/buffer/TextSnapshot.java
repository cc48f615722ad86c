package im.arun.nexusoutline.buffer;

import im.arun.nexusoutline.util.TextLines;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Buffer text at one version, split into lines.
 *
 * Lines are split on any line ending; {@link #getLineSeparator()} keeps the terminator the text
 * used so a rewrite can put it back.
 *
 * Line indices computed from a snapshot are valid only against it. A snapshot can back exactly
 * one commit; after that it is consumed and any further commit fails.
 */
@Getter
public final class TextSnapshot {

    private final String text;
    private final long version;
    private final List<String> lines;
    private final String lineSeparator;
    private boolean consumed;

    public TextSnapshot(String text, long version) {
        this.text = text == null ? "" : text;
        this.version = version;
        this.lines = Collections.unmodifiableList(TextLines.split(this.text));
        this.lineSeparator = TextLines.detectLineSeparator(this.text);
    }

    public int lineCount() {
        return lines.size();
    }

    public String line(int index) {
        return lines.get(index);
    }

    public synchronized void consume() {
        if (consumed) {
            throw new StaleSnapshotException("Snapshot at version " + version + " was already committed");
        }
        consumed = true;
    }
}
