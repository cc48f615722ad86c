package im.arun.nexusoutline.sync;

import lombok.Value;

import java.util.List;

/**
 * An edit intent addressed by line index in one text snapshot.
 * Intents are collected first and applied together by {@link BufferRewriter}.
 */
public interface LineMutation {

    int getIndex();

    /**
     * Rank among mutations at the same index; lower is applied first.
     */
    int tieBreak();

    static LineMutation replace(int index, String text) {
        return new ReplaceLine(index, text);
    }

    static LineMutation insert(int index, List<String> lines) {
        return new InsertLines(index, List.copyOf(lines));
    }

    static LineMutation delete(int index) {
        return new DeleteLines(index, 1);
    }

    @Value
    class ReplaceLine implements LineMutation {
        int index;
        String text;

        @Override
        public int tieBreak() {
            return 0;
        }
    }

    @Value
    class DeleteLines implements LineMutation {
        int index;
        int count;

        @Override
        public int tieBreak() {
            return 1;
        }
    }

    /**
     * Inserts before {@code index}; an index equal to the line count appends.
     */
    @Value
    class InsertLines implements LineMutation {
        int index;
        List<String> lines;

        @Override
        public int tieBreak() {
            return 2;
        }
    }
}
