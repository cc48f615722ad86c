package im.arun.nexusoutline.parse;

import im.arun.nexusoutline.config.OutlineConfig;
import im.arun.nexusoutline.model.Marker;
import im.arun.nexusoutline.model.NexusNode;
import im.arun.nexusoutline.model.NodeAttribute.Kind;
import im.arun.nexusoutline.model.NodeMetadata;
import im.arun.nexusoutline.tree.VariantGrouper;
import im.arun.nexusoutline.util.TextLines;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses an outline buffer into a tree of {@link NexusNode}s.
 *
 * Structure comes from indentation (indentWidth spaces per level). Fenced blocks are skipped and
 * everything after the first top-level {@code ---} is ignored. Node ids and line indices refer to
 * the lines of the text as given, so edits can be spliced back into the buffer.
 */
public class OutlineParser {
    private static final Logger logger = LoggerFactory.getLogger(OutlineParser.class);

    static final String ID_PREFIX = "node-";
    private static final Pattern PAREN_GROUP = Pattern.compile("\\(([^)]+)\\)");
    private static final Pattern FENCE_LINE = Pattern.compile("^```(\\w+)?");

    private final OutlineConfig config;
    private final LineAnnotator annotator;
    private final VariantGrouper grouper;

    public OutlineParser() {
        this(new OutlineConfig());
    }

    public OutlineParser(OutlineConfig config) {
        this.config = config;
        this.annotator = new LineAnnotator();
        this.grouper = new VariantGrouper();
    }

    public static String idForLine(int lineIndex) {
        return ID_PREFIX + lineIndex;
    }

    /**
     * Parses and groups variants (unless grouping is disabled in the config).
     */
    public List<NexusNode> parse(String text) {
        List<NexusNode> roots = parseStructure(text);
        return config.isGroupVariants() ? grouper.group(roots) : roots;
    }

    /**
     * Parses structure only, without variant grouping.
     */
    public List<NexusNode> parseStructure(String text) {
        List<String> lines = TextLines.split(text);
        int offset = config.isUnwrapOuterFence() ? outerFenceOffset(lines) : 0;
        int end = offset > 0 ? lastNonBlankIndex(lines) : lines.size();

        List<String> region = lines.subList(offset, end);
        int separator = TextLines.findSeparatorOutsideFences(region);
        if (separator >= 0) {
            region = region.subList(0, separator);
        }

        List<NexusNode> roots = new ArrayList<>();
        Deque<NexusNode> stack = new ArrayDeque<>();
        boolean inCodeBlock = false;

        for (int i = 0; i < region.size(); i++) {
            String line = region.get(i);
            Matcher fence = FENCE_LINE.matcher(line);
            if (fence.find()) {
                inCodeBlock = !inCodeBlock;
                continue;
            }
            if (inCodeBlock) {
                continue;
            }

            NexusNode node = parseLine(line, offset + i);
            if (node == null) {
                continue;
            }
            attach(node, roots, stack);
        }

        logger.debug("Parsed {} root nodes from {} lines", roots.size(), lines.size());
        return roots;
    }

    private void attach(NexusNode node, List<NexusNode> roots, Deque<NexusNode> stack) {
        if (node.getLevel() == 0) {
            roots.add(node);
            stack.clear();
            stack.push(node);
            return;
        }

        while (!stack.isEmpty() && stack.peek().getLevel() >= node.getLevel()) {
            stack.pop();
        }

        if (!stack.isEmpty()) {
            NexusNode parent = stack.peek();
            node.setParentId(parent.getId());
            parent.getChildren().add(node);
        } else {
            // Orphaned by inconsistent indentation: keep it as a root
            logger.debug("Line {} has no parent at level {}, treating as root", node.getLineIndex(), node.getLevel());
            roots.add(node);
        }
        stack.push(node);
    }

    /**
     * Builds a node for a single line, or returns null when nothing displayable remains.
     * Strip order matters: comments, then visual indent, conditions, markers, and finally trimming.
     */
    NexusNode parseLine(String line, int lineIndex) {
        AnnotatedLine annotated = annotator.annotate(line);
        String cleaned = annotated.getText();

        int spaces = TextLines.leadingWhitespace(cleaned);
        String rawContent = cleaned.substring(spaces).trim();
        if (rawContent.isEmpty()) {
            return null;
        }

        int visualLevel = 0;
        String working = rawContent;
        while (working.startsWith(">>")) {
            visualLevel++;
            working = working.substring(2).stripLeading();
        }

        int level = spaces / Math.max(1, config.getIndentWidth());

        Map<String, String> conditions = new LinkedHashMap<>();
        working = consumeConditions(working, conditions);

        Set<Marker> markers = EnumSet.noneOf(Marker.class);
        for (Marker marker : Marker.values()) {
            if (marker.isPresentIn(working)) {
                markers.add(marker);
                working = marker.stripFrom(working).trim();
            }
        }

        String display = working.trim();
        if (display.isEmpty()) {
            return null;
        }

        NexusNode node = new NexusNode();
        node.setId(idForLine(lineIndex));
        node.setContent(display.replace("\\n", "\n"));
        node.setRawContent(rawContent);
        node.setLevel(level);
        node.setVisualLevel(visualLevel);
        node.setLineIndex(lineIndex);
        node.setConditions(conditions);
        node.setCommon(markers.contains(Marker.COMMON));
        node.setFlowNode(markers.contains(Marker.FLOW));
        applyAttributes(node, annotated, markers);
        return node;
    }

    /**
     * Consumes {@code (k=v, k2=v2)} groups. The first group without '=' is left as literal
     * content and ends consumption.
     */
    static String consumeConditions(String text, Map<String, String> conditions) {
        String working = text;
        while (true) {
            Matcher matcher = PAREN_GROUP.matcher(working);
            if (!matcher.find()) {
                break;
            }
            String inner = matcher.group(1);
            if (!inner.contains("=")) {
                break;
            }
            for (String pair : inner.split(",")) {
                String[] parts = pair.split("=", -1);
                String key = parts[0].trim();
                String value = parts.length > 1 ? parts[1].trim() : "";
                if (!key.isEmpty() && !value.isEmpty()) {
                    conditions.put(key, value);
                }
            }
            working = working.substring(0, matcher.start()) + working.substring(matcher.end());
        }
        return working;
    }

    private void applyAttributes(NexusNode node, AnnotatedLine annotated, Set<Marker> markers) {
        annotated.value(Kind.ICON).ifPresent(node::setIcon);
        annotated.value(Kind.DATA_OBJECT).ifPresent(node::setDataObjectId);
        node.setDataObjectAttributeIds(new ArrayList<>(annotated.list(Kind.DATA_OBJECT_ATTRIBUTES)));
        node.setTags(new ArrayList<>(annotated.list(Kind.TAGS)));

        annotated.value(Kind.ANNOTATION)
            .map(LineAnnotator::decodeAnnotation)
            .filter(a -> !a.trim().isEmpty())
            .ifPresent(node::setAnnotation);

        NodeMetadata metadata = new NodeMetadata();
        metadata.setFlowTab(markers.contains(Marker.FLOW_TAB));
        metadata.setSystemFlow(markers.contains(Marker.SYSTEM_FLOW));
        annotated.value(Kind.FLOW_TAB_ID).ifPresent(metadata::setFid);
        annotated.value(Kind.SYSTEM_FLOW_ID).ifPresent(metadata::setSfid);
        metadata.setDoStatusAttrIds(new ArrayList<>(annotated.list(Kind.STATUS_ATTRIBUTES)));
        if (!metadata.isBlank()) {
            node.setMetadata(metadata);
        }
    }

    /**
     * When the whole input is one fenced block (a common copy/paste shape), returns the index of
     * the first line inside it; otherwise 0.
     */
    static int outerFenceOffset(List<String> lines) {
        int first = 0;
        while (first < lines.size() && lines.get(first).trim().isEmpty()) {
            first++;
        }
        int last = lastNonBlankIndex(lines);
        if (first >= last) {
            return 0;
        }
        if (!lines.get(first).trim().startsWith(TextLines.FENCE) || !TextLines.FENCE.equals(lines.get(last).trim())) {
            return 0;
        }
        return first + 1;
    }

    private static int lastNonBlankIndex(List<String> lines) {
        int last = lines.size() - 1;
        while (last >= 0 && lines.get(last).trim().isEmpty()) {
            last--;
        }
        return last;
    }
}
