package im.arun.nexusoutline.parse;

import im.arun.nexusoutline.model.NodeAttribute;
import im.arun.nexusoutline.model.NodeAttribute.Kind;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts sidecar attributes stored as inline HTML comments and strips them from the line.
 *
 * Format: {@code <!-- key:value -->}, e.g. {@code <!-- icon:🙂 -->}, {@code <!-- tags:tag-1,tag-2 -->},
 * {@code <!-- ann:Hello%20world\nsecond -->}. Comments are order independent. Comments with an
 * unknown key are left in the text untouched.
 */
public class LineAnnotator {

    private static final String OPEN = "<!--";
    private static final String CLOSE = "-->";
    private static final Pattern KEY = Pattern.compile("[A-Za-z]+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    /**
     * Single pass over the line. Every recognised comment is removed from the returned text,
     * including repeats of a kind already seen; {@link AnnotatedLine#first} returns the earliest.
     */
    public AnnotatedLine annotate(String line) {
        if (line == null || !line.contains(OPEN)) {
            return new AnnotatedLine(line == null ? "" : line, List.of());
        }

        StringBuilder kept = new StringBuilder(line.length());
        List<NodeAttribute> attributes = new ArrayList<>();
        int cursor = 0;

        while (cursor < line.length()) {
            int open = line.indexOf(OPEN, cursor);
            if (open < 0) {
                break;
            }
            int close = line.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                break;
            }

            String inner = line.substring(open + OPEN.length(), close);
            Optional<Recognised> recognised = recognise(inner);

            kept.append(line, cursor, open);
            if (recognised.isPresent()) {
                Recognised r = recognised.get();
                if (r.kind.isSurfaced() && !r.value.isEmpty()) {
                    attributes.add(new NodeAttribute(r.kind, r.value));
                }
            } else {
                kept.append(line, open, close + CLOSE.length());
            }
            cursor = close + CLOSE.length();
        }
        kept.append(line.substring(cursor));

        return new AnnotatedLine(kept.toString(), attributes);
    }

    /**
     * Decodes a stored {@code ann:} value: URL-decoded, then escaped {@code \n} sequences become newlines.
     * A value that is not valid percent-encoding is taken literally.
     */
    public static String decodeAnnotation(String raw) {
        String value = raw == null ? "" : raw.trim();
        String decoded;
        try {
            // '+' is literal in stored annotations
            decoded = URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            decoded = value;
        }
        return decoded.replace("\\n", "\n");
    }

    private Optional<Recognised> recognise(String inner) {
        String body = inner.stripLeading();
        int colon = body.indexOf(':');
        if (colon <= 0) {
            return Optional.empty();
        }
        String key = body.substring(0, colon);
        if (!KEY.matcher(key).matches()) {
            return Optional.empty();
        }
        Optional<Kind> kind = Kind.fromKey(key);
        if (kind.isEmpty()) {
            return Optional.empty();
        }

        String rawValue = body.substring(colon + 1);
        if (kind.get() != Kind.ICON && rawValue.indexOf('>') >= 0) {
            return Optional.empty();
        }
        String value = rawValue.trim();
        if (kind.get().isNumeric() && !DIGITS.matcher(value).matches()) {
            return Optional.empty();
        }
        return Optional.of(new Recognised(kind.get(), value));
    }

    private static final class Recognised {
        final Kind kind;
        final String value;

        Recognised(Kind kind, String value) {
            this.kind = kind;
            this.value = value;
        }
    }
}
