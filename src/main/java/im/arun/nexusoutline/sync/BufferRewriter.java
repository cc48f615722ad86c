package im.arun.nexusoutline.sync;

import im.arun.nexusoutline.buffer.SharedTextBuffer;
import im.arun.nexusoutline.buffer.StaleSnapshotException;
import im.arun.nexusoutline.buffer.TextSnapshot;
import im.arun.nexusoutline.util.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies line mutations to a snapshot and commits the result as one buffer transaction.
 *
 * Mutations are applied in descending line order so that each splice leaves the indices of the
 * ones still pending untouched. At the same index a replacement goes first, then a deletion, then
 * an insertion.
 */
public class BufferRewriter {
    private static final Logger logger = LoggerFactory.getLogger(BufferRewriter.class);

    private static final Comparator<LineMutation> APPLY_ORDER = Comparator
        .comparingInt(LineMutation::getIndex).reversed()
        .thenComparingInt(LineMutation::tieBreak);

    public List<String> apply(List<String> lines, List<LineMutation> mutations) {
        List<String> result = new ArrayList<>(lines);
        List<LineMutation> ordered = new ArrayList<>(mutations);
        ordered.sort(APPLY_ORDER);

        Set<Integer> deleted = new HashSet<>();
        for (LineMutation mutation : ordered) {
            int index = mutation.getIndex();
            if (mutation instanceof LineMutation.ReplaceLine) {
                if (index >= 0 && index < result.size()) {
                    result.set(index, ((LineMutation.ReplaceLine) mutation).getText());
                }
            } else if (mutation instanceof LineMutation.DeleteLines) {
                int count = ((LineMutation.DeleteLines) mutation).getCount();
                for (int i = index + count - 1; i >= index; i--) {
                    // The same line may be queued twice; remove it once
                    if (i >= 0 && i < result.size() && deleted.add(i)) {
                        result.remove(i);
                    }
                }
            } else if (mutation instanceof LineMutation.InsertLines) {
                int at = Math.max(0, Math.min(index, result.size()));
                result.addAll(at, ((LineMutation.InsertLines) mutation).getLines());
            }
        }
        return result;
    }

    /**
     * Commits the mutations computed from {@code snapshot}, joined with the snapshot's line separator.
     *
     * @return true if the buffer text changed
     * @throws StaleSnapshotException if the buffer moved past the snapshot, before or during the commit,
     *                                or the snapshot was already used
     */
    public boolean commit(SharedTextBuffer buffer, TextSnapshot snapshot, List<LineMutation> mutations) {
        if (buffer.version() != snapshot.getVersion()) {
            throw new StaleSnapshotException(String.format(
                "Snapshot version %d does not match buffer version %d", snapshot.getVersion(), buffer.version()));
        }
        snapshot.consume();

        if (mutations.isEmpty()) {
            logger.debug("No mutations to commit at version {}", snapshot.getVersion());
            return false;
        }

        String updated = TextLines.join(apply(snapshot.getLines(), mutations), snapshot.getLineSeparator());
        if (updated.equals(snapshot.getText())) {
            logger.debug("Mutations left text unchanged at version {}", snapshot.getVersion());
            return false;
        }

        if (!buffer.transact(snapshot.getVersion(), updated)) {
            throw new StaleSnapshotException(String.format(
                "Buffer moved past version %d while committing", snapshot.getVersion()));
        }
        logger.debug("Committed {} mutations on top of version {}", mutations.size(), snapshot.getVersion());
        return true;
    }
}
