package im.arun.nexusoutline.sync;

import im.arun.nexusoutline.model.Marker;
import im.arun.nexusoutline.model.NexusNode;

import java.util.regex.Pattern;

/**
 * Content comparison used to pair nodes across variants.
 *
 * Matching is by text only, not identity: two unrelated nodes with the same text in one variant
 * are indistinguishable here.
 */
final class ContentMatcher {

    private static final Pattern COMMENT = Pattern.compile("<!--[\\s\\S]*?-->");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ContentMatcher() {}

    static String normalize(String content) {
        if (content == null) {
            return "";
        }
        String text = COMMENT.matcher(content).replaceAll("");
        for (Marker marker : Marker.values()) {
            text = marker.stripFrom(text);
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    static boolean sameContent(NexusNode a, NexusNode b) {
        return normalize(a.getContent()).equals(normalize(b.getContent()));
    }

    static boolean hasCommonTag(String line) {
        return Marker.COMMON.isPresentIn(line);
    }
}
