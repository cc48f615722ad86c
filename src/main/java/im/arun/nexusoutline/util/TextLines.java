package im.arun.nexusoutline.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line-level helpers shared by the parser and the buffer rewriter.
 */
public final class TextLines {

    public static final String FENCE = "```";
    public static final String SEPARATOR = "---";

    private TextLines() {}

    /**
     * Converts CRLF and lone CR line endings to LF.
     */
    public static String normalizeNewlines(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * Splits on LF keeping trailing empty lines, so {@link #join} restores the exact text.
     */
    public static List<String> split(String text) {
        return new ArrayList<>(Arrays.asList(normalizeNewlines(text).split("\n", -1)));
    }

    public static String join(List<String> lines) {
        return join(lines, "\n");
    }

    public static String join(List<String> lines, String lineSeparator) {
        return String.join(lineSeparator, lines);
    }

    /**
     * The terminator used by the text: CRLF if any line ends with it, else a lone CR if present, else LF.
     * Mixed endings resolve to the first of these found.
     */
    public static String detectLineSeparator(String text) {
        if (text == null) {
            return "\n";
        }
        if (text.contains("\r\n")) {
            return "\r\n";
        }
        return text.indexOf('\r') >= 0 ? "\r" : "\n";
    }

    public static int leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    public static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(0, end);
    }

    /**
     * Index of the first {@code ---} line that is not inside a fenced block, or -1.
     */
    public static int findSeparatorOutsideFences(List<String> lines) {
        boolean inFence = false;
        for (int i = 0; i < lines.size(); i++) {
            String trimmed = lines.get(i).trim();
            if (trimmed.startsWith(FENCE)) {
                inFence = !inFence;
                continue;
            }
            if (!inFence && SEPARATOR.equals(trimmed)) {
                return i;
            }
        }
        return -1;
    }
}
